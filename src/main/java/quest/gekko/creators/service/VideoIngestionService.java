package quest.gekko.creators.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Caching;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.creators.config.CacheConfig;
import quest.gekko.creators.domain.Creator;
import quest.gekko.creators.domain.Video;
import quest.gekko.creators.repository.CreatorRepository;
import quest.gekko.creators.repository.VideoRepository;
import quest.gekko.creators.web.dto.IngestRequest;
import quest.gekko.creators.web.dto.IngestResult;
import quest.gekko.creators.web.dto.VideoPayload;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Entry point for the acquisition side: stores follower counts and inserts or refreshes
 * video records. Bad records are skipped and counted, never fatal for the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VideoIngestionService {
    private final CreatorRepository creatorRepository;
    private final VideoRepository videoRepository;

    @Transactional
    @Caching(evict = {
            @CacheEvict(cacheNames = { CacheConfig.STATS, CacheConfig.PATTERNS }, key = "#id"),
            @CacheEvict(cacheNames = CacheConfig.TOP_VIDEOS, allEntries = true)
    })
    public IngestResult ingest(Long id, IngestRequest request) {
        final Creator creator = creatorRepository.findById(id)
                .orElseThrow(() -> new CreatorNotFoundException(id));

        if (request.followerCount() != null) {
            creator.setFollowerCount(nonNegative(request.followerCount()));
        }

        int inserted = 0, updated = 0, skipped = 0;
        final List<VideoPayload> videos = request.videos() == null ? List.of() : request.videos();
        for (VideoPayload payload : videos) {
            if (payload == null || payload.videoId() == null || payload.videoId().isBlank()) {
                skipped++;
                continue;
            }

            final var existing = videoRepository.findByCreatorIdAndVideoId(creator.getId(), payload.videoId());
            if (existing.isPresent()) {
                refreshCounts(existing.get(), payload);
                updated++;
            } else {
                final Video video = new Video();
                video.setVideoId(payload.videoId());
                video.setCaption(payload.caption());
                video.setHashtags(payload.hashtags());
                video.setPostedAt(parseTimestamp(payload.postedAt()));
                video.setDurationSeconds(payload.durationSeconds());
                refreshCounts(video, payload);
                creator.addVideo(video);
                inserted++;
            }
        }

        creatorRepository.save(creator);
        log.info("Ingested videos for @{}: {} new, {} updated, {} skipped", creator.getHandle(), inserted, updated, skipped);
        return new IngestResult(creator.getId(), creator.getFollowerCount(), inserted, updated, skipped,
                creator.getVideos().size());
    }

    private static void refreshCounts(Video video, VideoPayload payload) {
        video.setViews(nonNegative(payload.views()));
        video.setLikes(nonNegative(payload.likes()));
        video.setComments(nonNegative(payload.comments()));
        video.setShares(nonNegative(payload.shares()));
    }

    static long nonNegative(Long value) {
        return value == null ? 0L : Math.max(0L, value);
    }

    /**
     * Accepts ISO instants, offset date-times and zone-less date-times (read as UTC).
     * Anything else yields {@code null}, which analytics treat as an undated post.
     */
    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) return null;
        final String text = raw.trim();
        try {
            final TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime odt
                    ? odt.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Unparsable posted_at '{}', storing video without timestamp", text);
            return null;
        }
    }
}
