package quest.gekko.creators.web.dto;

public record IngestResult(Long creatorId, long followerCount, int inserted, int updated, int skipped, long totalVideos) {}
