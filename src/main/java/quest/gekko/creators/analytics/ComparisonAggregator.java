package quest.gekko.creators.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.creators.analytics.model.ComparisonResult;
import quest.gekko.creators.analytics.model.CreatorSnapshot;
import quest.gekko.creators.analytics.model.CreatorSummary;
import quest.gekko.creators.analytics.model.EngagementStats;

import java.util.*;

/**
 * Builds the side-by-side dataset for a comparison batch.
 * <p>
 * Output order follows the requested order so position-based coloring stays stable.
 * Ids without a snapshot are reported in {@link ComparisonResult#skippedIds()} instead of
 * failing the batch; a repeated id only counts the first time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ComparisonAggregator {
    private final EngagementCalculator calculator;
    private final PatternMiner patternMiner;

    public ComparisonResult aggregate(final List<Long> requestedIds, final Map<Long, CreatorSnapshot> snapshots) {
        if (requestedIds == null || requestedIds.isEmpty()) {
            return new ComparisonResult(List.of(), List.of());
        }

        final Set<Long> seen = new HashSet<>();
        final List<CreatorSummary> creators = new ArrayList<>();
        final List<Long> skipped = new ArrayList<>();

        for (Long id : requestedIds) {
            if (id == null || !seen.add(id)) continue;

            final CreatorSnapshot snapshot = snapshots.get(id);
            if (snapshot == null) {
                skipped.add(id);
                continue;
            }
            creators.add(summarize(snapshot));
        }

        if (!skipped.isEmpty()) {
            log.debug("Comparison skipped unknown creator ids {}", skipped);
        }
        return new ComparisonResult(creators, skipped);
    }

    public CreatorSummary summarize(final CreatorSnapshot creator) {
        final EngagementStats stats = calculator.summarize(creator.videos());
        final int n = stats.totalVideos();

        return new CreatorSummary(
                creator.id(),
                creator.handle(),
                creator.niche(),
                EngagementCalculator.clamp(creator.followerCount()),
                n,
                stats.totalViews(),
                stats.totalLikes(),
                n == 0 ? 0L : stats.totalViews() / n,
                n == 0 ? 0L : stats.totalLikes() / n,
                n == 0 ? 0L : stats.totalComments() / n,
                stats.avgEngagementRate(),
                patternMiner.postingFrequency(creator.videos()));
    }
}
