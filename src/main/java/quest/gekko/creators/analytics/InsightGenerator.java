package quest.gekko.creators.analytics;

import org.springframework.stereotype.Component;
import quest.gekko.creators.analytics.model.ComparisonResult;
import quest.gekko.creators.analytics.model.CreatorSummary;
import quest.gekko.creators.analytics.model.Insight;
import quest.gekko.creators.analytics.model.InsightCategory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Superlatives over a comparison: largest audience, highest engagement, most viewed and,
 * when anyone posts at all, most active. Ties go to the creator listed first.
 */
@Component
public class InsightGenerator {

    public List<Insight> generate(final ComparisonResult result) {
        if (result == null || result.size() < 2) return List.of();
        final List<CreatorSummary> entries = result.creators();
        final List<Insight> insights = new ArrayList<>();

        final CreatorSummary audience = leader(entries, Comparator.comparingLong(CreatorSummary::followerCount));
        insights.add(Insight.of(InsightCategory.LARGEST_AUDIENCE, audience.handle(),
                compact(audience.followerCount()) + " followers"));

        final CreatorSummary engagement = leader(entries, Comparator.comparingDouble(CreatorSummary::avgEngagementRate));
        insights.add(Insight.of(InsightCategory.HIGHEST_ENGAGEMENT, engagement.handle(),
                plain(engagement.avgEngagementRate()) + "% avg rate"));

        final CreatorSummary viewed = leader(entries, Comparator.comparingLong(CreatorSummary::avgViews));
        insights.add(Insight.of(InsightCategory.MOST_VIEWED, viewed.handle(),
                compact(viewed.avgViews()) + " avg views"));

        final CreatorSummary active = leader(entries, Comparator.comparingDouble(CreatorSummary::postingFrequency));
        if (active.postingFrequency() > 0) {
            insights.add(Insight.of(InsightCategory.MOST_ACTIVE, active.handle(),
                    plain(active.postingFrequency()) + " posts/day"));
        }

        return insights;
    }

    // strictly greater, so the earliest entry keeps a tie
    private static CreatorSummary leader(final List<CreatorSummary> entries, final Comparator<CreatorSummary> order) {
        CreatorSummary best = entries.get(0);
        for (int i = 1; i < entries.size(); i++) {
            if (order.compare(entries.get(i), best) > 0) best = entries.get(i);
        }
        return best;
    }

    static String compact(final long n) {
        if (n >= 1_000_000_000L) return scaled(n, 1_000_000_000d, "B");
        if (n >= 1_000_000L) return scaled(n, 1_000_000d, "M");
        if (n >= 1_000L) return scaled(n, 1_000d, "K");
        return Long.toString(n);
    }

    private static String scaled(final long n, final double unit, final String suffix) {
        return String.format(Locale.ROOT, "%.1f", n / unit) + suffix;
    }

    private static String plain(final double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
