package quest.gekko.creators.analytics;

import quest.gekko.creators.analytics.model.VideoSnapshot;

import java.time.Instant;

final class Videos {
    private Videos() {}

    static VideoSnapshot video(String id, long views, long likes, long comments) {
        return new VideoSnapshot(id, "caption " + id, "fyp", null, views, likes, comments, 0L);
    }

    static VideoSnapshot video(String id, long views, long likes, long comments, String postedAt) {
        return new VideoSnapshot(id, "caption " + id, "fyp", Instant.parse(postedAt), views, likes, comments, 0L);
    }

    /** Video whose engagement rate is exactly {@code percent} on 1000 views. */
    static VideoSnapshot withRate(String id, long percent, String postedAt) {
        return video(id, 1_000, percent * 10, 0, postedAt);
    }
}
