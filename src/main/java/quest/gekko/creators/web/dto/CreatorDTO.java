package quest.gekko.creators.web.dto;

import quest.gekko.creators.domain.Creator;

import java.time.Instant;

public record CreatorDTO(Long id, String handle, String niche, long followerCount, Instant createdAt) {

    public static CreatorDTO from(Creator creator) {
        return new CreatorDTO(creator.getId(), creator.getHandle(), creator.getNiche(),
                creator.getFollowerCount(), creator.getCreatedAt());
    }
}
