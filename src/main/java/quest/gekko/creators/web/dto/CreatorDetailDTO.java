package quest.gekko.creators.web.dto;

import quest.gekko.creators.domain.Creator;

import java.util.List;

public record CreatorDetailDTO(CreatorDTO creator, List<VideoDTO> videos) {

    public static CreatorDetailDTO from(Creator creator) {
        return new CreatorDetailDTO(CreatorDTO.from(creator),
                creator.getVideos().stream().map(VideoDTO::from).toList());
    }
}
