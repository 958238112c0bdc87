package quest.gekko.creators.analytics;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.creators.analytics.model.TopVideo;
import quest.gekko.creators.analytics.model.VideoSnapshot;

import java.util.Comparator;
import java.util.List;

/**
 * Picks a creator's best performing videos: highest engagement rate first, then most views,
 * then input order.
 */
@Component
@RequiredArgsConstructor
public class TopContentRanker {
    private static final Comparator<TopVideo> RANKING =
            Comparator.comparingDouble(TopVideo::engagementRate).reversed()
                    .thenComparing(Comparator.comparingLong(TopVideo::views).reversed());

    private final EngagementCalculator calculator;

    public List<TopVideo> rank(final List<VideoSnapshot> videos, final int limit) {
        if (limit <= 0 || videos == null || videos.isEmpty()) return List.of();

        // stable sort, input order is the final tie-break
        return videos.stream()
                .map(this::toTopVideo)
                .sorted(RANKING)
                .limit(limit)
                .toList();
    }

    private TopVideo toTopVideo(final VideoSnapshot v) {
        return new TopVideo(
                v.videoId(),
                v.caption(),
                v.hashtags(),
                EngagementCalculator.clamp(v.views()),
                EngagementCalculator.clamp(v.likes()),
                EngagementCalculator.clamp(v.comments()),
                EngagementCalculator.clamp(v.shares()),
                calculator.engagementRate(v),
                v.postedAt());
    }
}
