package quest.gekko.creators.analytics.model;

import java.time.Instant;

/**
 * Read-only copy of a stored video handed to the analytics engine.
 * Counts are taken as delivered by ingestion; the engine clamps anything negative.
 */
public record VideoSnapshot(
        String videoId,
        String caption,
        String hashtags,
        Instant postedAt,
        long views,
        long likes,
        long comments,
        long shares
) {}
