package quest.gekko.creators.analytics.model;

import java.time.Instant;

/**
 * Creator-level aggregate over a set of videos.
 *
 * @param avgEngagementRate mean of the per-video engagement rates, not a ratio of the totals
 * @param earliestPost      earliest timestamped post, {@code null} when no video has a timestamp
 * @param latestPost        latest timestamped post, {@code null} when no video has a timestamp
 */
public record EngagementStats(
        int totalVideos,
        long totalViews,
        long totalLikes,
        long totalComments,
        double avgEngagementRate,
        Instant earliestPost,
        Instant latestPost
) {
    public static EngagementStats empty() {
        return new EngagementStats(0, 0L, 0L, 0L, 0.0, null, null);
    }
}
