package quest.gekko.creators.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.creators.analytics.*;
import quest.gekko.creators.analytics.model.*;
import quest.gekko.creators.config.AnalyticsProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalyticsServiceTest {
    @Mock
    SnapshotService snapshotService;

    private AnalyticsService analyticsService;

    private final CreatorSnapshot dancer = new CreatorSnapshot(1L, "dancer", "dance", 2_000_000, videos(12));
    private final CreatorSnapshot chef = new CreatorSnapshot(2L, "chef", "food", 300_000, List.of());

    @BeforeEach
    void setUp() {
        AnalyticsProperties properties = new AnalyticsProperties(null, null, 3, 5);
        EngagementCalculator calculator = new EngagementCalculator();
        PatternMiner miner = new PatternMiner(calculator, properties);
        analyticsService = new AnalyticsService(snapshotService, calculator, miner,
                new TopContentRanker(calculator), new ComparisonAggregator(calculator, miner),
                new InsightGenerator(), properties);
    }

    private static List<VideoSnapshot> videos(int count) {
        List<VideoSnapshot> videos = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            videos.add(new VideoSnapshot("v" + i, "clip " + i, null,
                    Instant.parse("2024-03-01T18:00:00Z").plusSeconds(86_400L * i), 1_000, i * 10L, 0, 0));
        }
        return videos;
    }

    @Test
    void statsCarryCreatorIdentity() {
        when(snapshotService.load(1L)).thenReturn(Optional.of(dancer));

        CreatorStats stats = analyticsService.stats(1L);

        assertThat(stats.handle()).isEqualTo("dancer");
        assertThat(stats.followerCount()).isEqualTo(2_000_000);
        assertThat(stats.stats().totalVideos()).isEqualTo(12);
        assertThat(stats.stats().avgEngagementRate()).isEqualTo(6.5);
    }

    @Test
    void negativeFollowerCountReadsAsZeroLikeInComparisons() {
        CreatorSnapshot broken = new CreatorSnapshot(5L, "broken", "", -40, List.of());
        when(snapshotService.load(5L)).thenReturn(Optional.of(broken));
        when(snapshotService.loadAll(anyCollection())).thenReturn(Map.of(5L, broken, 2L, chef));

        assertThat(analyticsService.stats(5L).followerCount()).isZero();
        assertThat(analyticsService.compare(List.of(5L, 2L)).creators().get(0).followerCount()).isZero();
    }

    @Test
    void unknownCreatorIsNotFound() {
        when(snapshotService.load(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> analyticsService.stats(9L)).isInstanceOf(CreatorNotFoundException.class);
        assertThatThrownBy(() -> analyticsService.patterns(9L)).isInstanceOf(CreatorNotFoundException.class);
        assertThatThrownBy(() -> analyticsService.topVideos(9L, null)).isInstanceOf(CreatorNotFoundException.class);
    }

    @Test
    void patternsComeFromTheSnapshot() {
        when(snapshotService.load(1L)).thenReturn(Optional.of(dancer));

        PatternReport report = analyticsService.patterns(1L);

        assertThat(report.totalPosts()).isEqualTo(12);
        assertThat(report.bestHours()).extracting(PatternBucket::key).containsExactly(18);
        assertThat(report.postingFrequency()).isEqualTo(1.09);
    }

    @Test
    void topVideosUseDefaultAndCappedLimits() {
        when(snapshotService.load(1L)).thenReturn(Optional.of(dancer));

        assertThat(analyticsService.topVideos(1L, null)).extracting(TopVideo::videoId).containsExactly("v12", "v11", "v10");
        assertThat(analyticsService.topVideos(1L, 100)).hasSize(5);
        assertThatThrownBy(() -> analyticsService.topVideos(1L, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void compareBuildsSummariesAndInsights() {
        when(snapshotService.loadAll(anyCollection())).thenReturn(Map.of(1L, dancer, 2L, chef));

        ComparisonReport report = analyticsService.compare(List.of(2L, 404L, 1L));

        assertThat(report.creators()).extracting(CreatorSummary::handle).containsExactly("chef", "dancer");
        assertThat(report.skippedIds()).containsExactly(404L);
        assertThat(report.insights()).extracting(Insight::handle)
                .containsExactly("dancer", "dancer", "dancer", "dancer");
    }
}
