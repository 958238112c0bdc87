package quest.gekko.creators.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.creators.analytics.model.ComparisonReport;
import quest.gekko.creators.service.AnalyticsService;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {
    private final AnalyticsService analyticsService;

    // creatorIds is comma separated, e.g. ?creatorIds=3,1,7
    @GetMapping("/compare")
    public ComparisonReport compare(@RequestParam String creatorIds) {
        final List<Long> ids = Arrays.stream(creatorIds.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Long::valueOf)
                .toList();
        if (ids.size() < 2) {
            throw new IllegalArgumentException("Select at least 2 creators to compare");
        }
        return analyticsService.compare(ids);
    }
}
