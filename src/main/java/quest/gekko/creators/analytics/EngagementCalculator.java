package quest.gekko.creators.analytics;

import org.springframework.stereotype.Component;
import quest.gekko.creators.analytics.model.EngagementStats;
import quest.gekko.creators.analytics.model.VideoSnapshot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Engagement rate of a video is {@code (likes + comments) / views * 100}, or 0 for a video
 * without views. Negative counts are read as 0, so a rate is never negative or non-finite.
 */
@Component
public class EngagementCalculator {
    static final int DISPLAY_SCALE = 2;

    public double engagementRate(final VideoSnapshot video) {
        return round(rawEngagementRate(video));
    }

    /** Unrounded rate; callers averaging several videos round once at the end. */
    public double rawEngagementRate(final VideoSnapshot video) {
        return rawEngagementRate(video.views(), video.likes(), video.comments());
    }

    public double rawEngagementRate(final long views, final long likes, final long comments) {
        final long safeViews = clamp(views);
        if (safeViews == 0) return 0.0;
        final double rate = ((double) clamp(likes) + clamp(comments)) / safeViews * 100.0;
        return Double.isFinite(rate) ? rate : 0.0;
    }

    public EngagementStats summarize(final List<VideoSnapshot> videos) {
        if (videos == null || videos.isEmpty()) return EngagementStats.empty();

        long views = 0, likes = 0, comments = 0;
        double rateSum = 0.0;
        Instant earliest = null, latest = null;

        for (VideoSnapshot v : videos) {
            views = addCapped(views, clamp(v.views()));
            likes = addCapped(likes, clamp(v.likes()));
            comments = addCapped(comments, clamp(v.comments()));
            rateSum += rawEngagementRate(v);

            final Instant at = v.postedAt();
            if (at != null) {
                if (earliest == null || at.isBefore(earliest)) earliest = at;
                if (latest == null || at.isAfter(latest)) latest = at;
            }
        }

        return new EngagementStats(videos.size(), views, likes, comments,
                round(rateSum / videos.size()), earliest, latest);
    }

    static long clamp(final long count) {
        return Math.max(0L, count);
    }

    // totals stop at Long.MAX_VALUE instead of wrapping negative
    static long addCapped(final long total, final long count) {
        try {
            return Math.addExact(total, count);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    static double round(final double value) {
        if (!Double.isFinite(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(DISPLAY_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
