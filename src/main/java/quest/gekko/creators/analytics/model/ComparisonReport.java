package quest.gekko.creators.analytics.model;

import java.util.List;

public record ComparisonReport(List<CreatorSummary> creators, List<Long> skippedIds, List<Insight> insights) {

    public static ComparisonReport of(ComparisonResult result, List<Insight> insights) {
        return new ComparisonReport(result.creators(), result.skippedIds(), List.copyOf(insights));
    }
}
