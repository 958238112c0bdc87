package quest.gekko.creators.analytics.model;

public record CreatorStats(Long creatorId, String handle, long followerCount, EngagementStats stats) {}
