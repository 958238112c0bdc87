package quest.gekko.creators.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Caching;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.creators.config.CacheConfig;
import quest.gekko.creators.domain.Creator;
import quest.gekko.creators.repository.CreatorRepository;

import java.util.List;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class CreatorService {
    static final Pattern HANDLE = Pattern.compile("^[\\w.]{1,30}$");

    private final CreatorRepository creatorRepository;

    public List<Creator> list() {
        return creatorRepository.findAllByOrderByIdAsc();
    }

    /** Creator with its videos loaded. */
    public Creator get(Long id) {
        return creatorRepository.findWithVideosById(id)
                .orElseThrow(() -> new CreatorNotFoundException(id));
    }

    @Transactional
    public Creator track(String rawHandle, String niche) {
        final String handle = normalizeHandle(rawHandle);
        if (creatorRepository.existsByHandle(handle)) {
            throw new DuplicateCreatorException(handle);
        }

        final Creator creator = new Creator();
        creator.setHandle(handle);
        creator.setNiche(niche == null ? "" : niche.trim());
        final Creator saved = creatorRepository.save(creator);
        log.info("Tracking creator @{} (ID: {})", saved.getHandle(), saved.getId());
        return saved;
    }

    @Transactional
    @Caching(evict = {
            @CacheEvict(cacheNames = { CacheConfig.STATS, CacheConfig.PATTERNS }, key = "#id"),
            @CacheEvict(cacheNames = CacheConfig.TOP_VIDEOS, allEntries = true)
    })
    public Creator updateNiche(Long id, String niche) {
        final Creator creator = creatorRepository.findById(id)
                .orElseThrow(() -> new CreatorNotFoundException(id));
        creator.setNiche(niche == null ? "" : niche.trim());
        return creatorRepository.save(creator);
    }

    @Transactional
    @Caching(evict = {
            @CacheEvict(cacheNames = { CacheConfig.STATS, CacheConfig.PATTERNS }, key = "#id"),
            @CacheEvict(cacheNames = CacheConfig.TOP_VIDEOS, allEntries = true)
    })
    public void delete(Long id) {
        final Creator creator = creatorRepository.findById(id)
                .orElseThrow(() -> new CreatorNotFoundException(id));
        final int videos = creator.getVideos().size();
        creatorRepository.delete(creator);
        log.info("Deleted creator @{} and {} videos", creator.getHandle(), videos);
    }

    /**
     * Strips whitespace and a leading {@code @}, then checks the handle is 1-30 letters, digits,
     * underscores or dots.
     */
    public static String normalizeHandle(String raw) {
        final String handle = raw == null ? "" : raw.strip();
        final String stripped = handle.startsWith("@") ? handle.substring(1) : handle;
        if (!HANDLE.matcher(stripped).matches()) {
            throw new IllegalArgumentException(
                    "Invalid username. Use only letters, numbers, underscores, and dots (max 30 chars).");
        }
        return stripped;
    }
}
