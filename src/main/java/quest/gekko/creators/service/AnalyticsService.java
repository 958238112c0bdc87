package quest.gekko.creators.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import quest.gekko.creators.analytics.*;
import quest.gekko.creators.analytics.model.*;
import quest.gekko.creators.config.AnalyticsProperties;
import quest.gekko.creators.config.CacheConfig;

import java.util.List;
import java.util.Map;

/**
 * Loads snapshots from storage and runs the analytics engine over them.
 * Per-creator results are cached until the creator's data changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsService {
    private final SnapshotService snapshotService;
    private final EngagementCalculator engagementCalculator;
    private final PatternMiner patternMiner;
    private final TopContentRanker topContentRanker;
    private final ComparisonAggregator comparisonAggregator;
    private final InsightGenerator insightGenerator;
    private final AnalyticsProperties properties;

    @Cacheable(value = CacheConfig.STATS, key = "#creatorId")
    public CreatorStats stats(Long creatorId) {
        final CreatorSnapshot creator = require(creatorId);
        final EngagementStats stats = engagementCalculator.summarize(creator.videos());
        log.debug("Stats for @{}: {} videos, {}% avg engagement", creator.handle(), stats.totalVideos(), stats.avgEngagementRate());
        return new CreatorStats(creator.id(), creator.handle(), Math.max(0L, creator.followerCount()), stats);
    }

    @Cacheable(value = CacheConfig.PATTERNS, key = "#creatorId")
    public PatternReport patterns(Long creatorId) {
        final CreatorSnapshot creator = require(creatorId);
        return patternMiner.mine(creator.videos());
    }

    /**
     * @param limit requested list size; {@code null} means the configured default, larger values
     *              are capped at the configured maximum
     */
    @Cacheable(value = CacheConfig.TOP_VIDEOS, key = "#creatorId + ':' + #limit")
    public List<TopVideo> topVideos(Long creatorId, Integer limit) {
        final int size = resolveLimit(limit);
        final CreatorSnapshot creator = require(creatorId);
        return topContentRanker.rank(creator.videos(), size);
    }

    public ComparisonReport compare(List<Long> creatorIds) {
        final Map<Long, CreatorSnapshot> snapshots = snapshotService.loadAll(creatorIds);
        final ComparisonResult result = comparisonAggregator.aggregate(creatorIds, snapshots);
        final List<Insight> insights = insightGenerator.generate(result);

        log.info("Compared {} creators ({} unknown ids skipped), {} insights",
                result.size(), result.skippedIds().size(), insights.size());
        return ComparisonReport.of(result, insights);
    }

    int resolveLimit(Integer limit) {
        if (limit == null) return properties.topVideosLimit();
        if (limit < 1) throw new IllegalArgumentException("limit must be at least 1");
        return Math.min(limit, properties.maxTopVideosLimit());
    }

    private CreatorSnapshot require(Long creatorId) {
        return snapshotService.load(creatorId)
                .orElseThrow(() -> new CreatorNotFoundException(creatorId));
    }
}
