package quest.gekko.creators.analytics.model;

import java.time.DayOfWeek;
import java.util.List;

/**
 * When a creator's content performs best.
 *
 * @param totalPosts       posts with a usable timestamp
 * @param undatedPosts     posts left out of bucketing because they carry no timestamp
 * @param lowConfidence    {@code true} when {@code totalPosts} is under the configured minimum
 * @param bestHours        hours 0-23 that have posts, best mean engagement first
 * @param bestDays         weekdays that have posts, best mean engagement first
 * @param postingFrequency posts per day between the first and last timestamped post
 */
public record PatternReport(
        int totalPosts,
        int undatedPosts,
        boolean lowConfidence,
        List<PatternBucket<Integer>> bestHours,
        List<PatternBucket<DayOfWeek>> bestDays,
        double postingFrequency
) {
    public PatternReport {
        bestHours = List.copyOf(bestHours);
        bestDays = List.copyOf(bestDays);
    }
}
