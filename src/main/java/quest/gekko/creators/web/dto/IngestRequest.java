package quest.gekko.creators.web.dto;

import java.util.List;

/**
 * @param followerCount latest follower count, left unchanged when {@code null}
 * @param videos        video records to insert or refresh
 */
public record IngestRequest(Long followerCount, List<VideoPayload> videos) {}
