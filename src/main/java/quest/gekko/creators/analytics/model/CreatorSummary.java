package quest.gekko.creators.analytics.model;

/**
 * Side-by-side row for one creator in a comparison.
 * Averages of counts are whole numbers rounded down.
 */
public record CreatorSummary(
        Long creatorId,
        String handle,
        String niche,
        long followerCount,
        int totalVideos,
        long totalViews,
        long totalLikes,
        long avgViews,
        long avgLikes,
        long avgComments,
        double avgEngagementRate,
        double postingFrequency
) {}
