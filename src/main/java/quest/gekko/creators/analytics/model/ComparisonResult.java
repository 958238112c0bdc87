package quest.gekko.creators.analytics.model;

import java.util.List;

/**
 * @param creators   one summary per known creator, in the order they were requested
 * @param skippedIds requested ids with no matching creator, in request order
 */
public record ComparisonResult(List<CreatorSummary> creators, List<Long> skippedIds) {
    public ComparisonResult {
        creators = List.copyOf(creators);
        skippedIds = List.copyOf(skippedIds);
    }

    public int size() {
        return creators.size();
    }
}
