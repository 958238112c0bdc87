package quest.gekko.creators.analytics.model;

import java.time.Instant;

public record TopVideo(
        String videoId,
        String caption,
        String hashtags,
        long views,
        long likes,
        long comments,
        long shares,
        double engagementRate,
        Instant postedAt
) {}
