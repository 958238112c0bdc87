package quest.gekko.creators.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.creators.analytics.model.PatternBucket;
import quest.gekko.creators.analytics.model.PatternReport;
import quest.gekko.creators.analytics.model.VideoSnapshot;
import quest.gekko.creators.config.AnalyticsProperties;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.*;

/**
 * Buckets a creator's posts by hour-of-day and weekday and ranks the buckets by mean
 * engagement rate. Posts without a timestamp are counted but never bucketed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PatternMiner {
    private final EngagementCalculator calculator;
    private final AnalyticsProperties properties;

    public PatternReport mine(final List<VideoSnapshot> videos) {
        final List<VideoSnapshot> dated = dated(videos);
        final int undated = (videos == null ? 0 : videos.size()) - dated.size();

        final Map<Integer, List<Double>> byHour = new HashMap<>();
        final Map<DayOfWeek, List<Double>> byDay = new EnumMap<>(DayOfWeek.class);

        for (VideoSnapshot v : dated) {
            final ZonedDateTime at = v.postedAt().atZone(properties.zone());
            final double rate = calculator.rawEngagementRate(v);
            byHour.computeIfAbsent(at.getHour(), h -> new ArrayList<>()).add(rate);
            byDay.computeIfAbsent(at.getDayOfWeek(), d -> new ArrayList<>()).add(rate);
        }

        final boolean lowConfidence = dated.size() < properties.minPatternPosts();
        if (undated > 0) {
            log.debug("Excluded {} posts without timestamp from pattern buckets", undated);
        }

        return new PatternReport(
                dated.size(),
                undated,
                lowConfidence,
                rank(byHour, Comparator.<Integer>naturalOrder()),
                rank(byDay, Comparator.<DayOfWeek>naturalOrder()),
                frequencyOf(dated));
    }

    /** Posts per day across the timestamped posts, with a span of at least one day. */
    public double postingFrequency(final List<VideoSnapshot> videos) {
        return frequencyOf(dated(videos));
    }

    private double frequencyOf(final List<VideoSnapshot> dated) {
        if (dated.isEmpty()) return 0.0;

        Instant first = dated.get(0).postedAt();
        Instant last = first;
        for (VideoSnapshot v : dated) {
            if (v.postedAt().isBefore(first)) first = v.postedAt();
            if (v.postedAt().isAfter(last)) last = v.postedAt();
        }

        final long spanDays = Math.max(1L, Duration.between(first, last).toDays());
        return EngagementCalculator.round((double) dated.size() / spanDays);
    }

    private static <K> List<PatternBucket<K>> rank(final Map<K, List<Double>> buckets, final Comparator<K> keyOrder) {
        final Comparator<PatternBucket<K>> byRateDesc =
                Comparator.comparingDouble((PatternBucket<K> b) -> b.avgEngagementRate()).reversed();

        return buckets.entrySet().stream()
                .map(e -> new PatternBucket<>(e.getKey(), mean(e.getValue()), e.getValue().size()))
                .sorted(byRateDesc.thenComparing(b -> b.key(), keyOrder))
                .toList();
    }

    private static double mean(final List<Double> rates) {
        double sum = 0.0;
        for (double r : rates) sum += r;
        return EngagementCalculator.round(sum / rates.size());
    }

    private static List<VideoSnapshot> dated(final List<VideoSnapshot> videos) {
        if (videos == null) return List.of();
        return videos.stream().filter(v -> v.postedAt() != null).toList();
    }
}
