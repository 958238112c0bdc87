package quest.gekko.creators.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import quest.gekko.creators.analytics.model.CreatorStats;
import quest.gekko.creators.analytics.model.PatternReport;
import quest.gekko.creators.analytics.model.TopVideo;
import quest.gekko.creators.service.AnalyticsService;
import quest.gekko.creators.service.CreatorService;
import quest.gekko.creators.service.VideoIngestionService;
import quest.gekko.creators.web.dto.CreatorDTO;
import quest.gekko.creators.web.dto.CreatorDetailDTO;
import quest.gekko.creators.web.dto.IngestRequest;
import quest.gekko.creators.web.dto.IngestResult;

import java.util.List;

@RestController
@RequestMapping("/api/creators")
@RequiredArgsConstructor
public class CreatorController {
    private final CreatorService creatorService;
    private final VideoIngestionService ingestionService;
    private final AnalyticsService analyticsService;

    @GetMapping
    public List<CreatorDTO> list() {
        return creatorService.list().stream().map(CreatorDTO::from).toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CreatorDTO track(@RequestParam String handle, @RequestParam(defaultValue = "") String niche) {
        return CreatorDTO.from(creatorService.track(handle, niche));
    }

    @GetMapping("/{id}")
    public CreatorDetailDTO get(@PathVariable Long id) {
        return CreatorDetailDTO.from(creatorService.get(id));
    }

    @PatchMapping("/{id}")
    public CreatorDTO updateNiche(@PathVariable Long id, @RequestParam(defaultValue = "") String niche) {
        return CreatorDTO.from(creatorService.updateNiche(id, niche));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        creatorService.delete(id);
    }

    @PostMapping("/{id}/videos")
    public IngestResult ingest(@PathVariable Long id, @RequestBody IngestRequest request) {
        return ingestionService.ingest(id, request);
    }

    @GetMapping("/{id}/stats")
    public CreatorStats stats(@PathVariable Long id) {
        return analyticsService.stats(id);
    }

    @GetMapping("/{id}/patterns")
    public PatternReport patterns(@PathVariable Long id) {
        return analyticsService.patterns(id);
    }

    @GetMapping("/{id}/top-videos")
    public List<TopVideo> topVideos(@PathVariable Long id, @RequestParam(required = false) Integer limit) {
        return analyticsService.topVideos(id, limit);
    }
}
