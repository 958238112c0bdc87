package quest.gekko.creators.web.dto;

/**
 * One video record as delivered by the acquisition side. Counts may be missing; the
 * timestamp is kept as text because scrapers do not always produce a parsable one.
 */
public record VideoPayload(
        String videoId,
        String caption,
        String hashtags,
        String postedAt,
        Long views,
        Long likes,
        Long comments,
        Long shares,
        Double durationSeconds
) {}
