package quest.gekko.creators.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.creators.domain.Video;

import java.util.Optional;

public interface VideoRepository extends JpaRepository<Video, Long> {
    Optional<Video> findByCreatorIdAndVideoId(final Long creatorId, final String videoId);
    long countByCreatorId(final Long creatorId);
}
