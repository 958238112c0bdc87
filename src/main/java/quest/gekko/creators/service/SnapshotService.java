package quest.gekko.creators.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.creators.analytics.model.CreatorSnapshot;
import quest.gekko.creators.analytics.model.VideoSnapshot;
import quest.gekko.creators.domain.Creator;
import quest.gekko.creators.domain.Video;
import quest.gekko.creators.repository.CreatorRepository;

import java.util.*;

/**
 * Reads creators and their videos out of storage as detached, immutable snapshots for the
 * analytics engine. Videos keep storage (insertion) order.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SnapshotService {
    private final CreatorRepository creatorRepository;

    public Optional<CreatorSnapshot> load(Long creatorId) {
        return creatorRepository.findWithVideosById(creatorId).map(SnapshotService::toSnapshot);
    }

    public Map<Long, CreatorSnapshot> loadAll(Collection<Long> creatorIds) {
        final Set<Long> ids = new LinkedHashSet<>();
        for (Long id : creatorIds) {
            if (id != null) ids.add(id);
        }
        if (ids.isEmpty()) return Map.of();

        final Map<Long, CreatorSnapshot> snapshots = new HashMap<>();
        for (Creator c : creatorRepository.findAllWithVideosByIdIn(ids)) {
            snapshots.put(c.getId(), toSnapshot(c));
        }
        return snapshots;
    }

    static CreatorSnapshot toSnapshot(Creator creator) {
        final List<VideoSnapshot> videos = creator.getVideos().stream()
                .sorted(Comparator.comparing(Video::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(SnapshotService::toSnapshot)
                .toList();
        return new CreatorSnapshot(creator.getId(), creator.getHandle(), creator.getNiche(),
                creator.getFollowerCount(), videos);
    }

    static VideoSnapshot toSnapshot(Video video) {
        return new VideoSnapshot(video.getVideoId(), video.getCaption(), video.getHashtags(), video.getPostedAt(),
                video.getViews(), video.getLikes(), video.getComments(), video.getShares());
    }
}
