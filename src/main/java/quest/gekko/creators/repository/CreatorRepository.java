package quest.gekko.creators.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.creators.domain.Creator;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CreatorRepository extends JpaRepository<Creator, Long> {
    boolean existsByHandle(final String handle);
    List<Creator> findAllByOrderByIdAsc();

    @Query("select distinct c from Creator c left join fetch c.videos where c.id = :id")
    Optional<Creator> findWithVideosById(@Param("id") final Long id);

    @Query("select distinct c from Creator c left join fetch c.videos where c.id in :ids")
    List<Creator> findAllWithVideosByIdIn(@Param("ids") final Collection<Long> ids);
}
