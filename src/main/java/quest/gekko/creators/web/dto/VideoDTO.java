package quest.gekko.creators.web.dto;

import quest.gekko.creators.domain.Video;

import java.time.Instant;

public record VideoDTO(
        String videoId,
        String caption,
        String hashtags,
        Instant postedAt,
        long views,
        long likes,
        long comments,
        long shares,
        Double durationSeconds
) {
    public static VideoDTO from(Video v) {
        return new VideoDTO(v.getVideoId(), v.getCaption(), v.getHashtags(), v.getPostedAt(),
                v.getViews(), v.getLikes(), v.getComments(), v.getShares(), v.getDurationSeconds());
    }
}
