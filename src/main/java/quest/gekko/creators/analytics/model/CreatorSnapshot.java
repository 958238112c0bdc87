package quest.gekko.creators.analytics.model;

import java.util.List;

/**
 * Read-only copy of a creator and the videos it owns, in storage order.
 */
public record CreatorSnapshot(
        Long id,
        String handle,
        String niche,
        long followerCount,
        List<VideoSnapshot> videos
) {
    public CreatorSnapshot {
        videos = videos == null ? List.of() : List.copyOf(videos);
    }
}
