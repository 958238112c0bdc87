package quest.gekko.creators.web.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import quest.gekko.creators.analytics.model.ComparisonReport;
import quest.gekko.creators.analytics.model.CreatorSummary;
import quest.gekko.creators.analytics.model.Insight;
import quest.gekko.creators.analytics.model.InsightCategory;
import quest.gekko.creators.service.AnalyticsService;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalyticsController.class)
class AnalyticsControllerTest {
    @Autowired
    MockMvc mockMvc;

    @MockBean
    AnalyticsService analyticsService;

    @Test
    void comparesCreatorsInRequestedOrder() throws Exception {
        CreatorSummary chef = new CreatorSummary(2L, "chef", "food", 300, 1, 10, 1, 10, 1, 0, 10.0, 1.0);
        CreatorSummary dancer = new CreatorSummary(1L, "dancer", "dance", 900, 1, 5, 1, 5, 1, 0, 20.0, 0.0);
        when(analyticsService.compare(List.of(2L, 1L, 7L))).thenReturn(new ComparisonReport(
                List.of(chef, dancer), List.of(7L),
                List.of(Insight.of(InsightCategory.LARGEST_AUDIENCE, "dancer", "900 followers"))));

        mockMvc.perform(get("/api/analytics/compare").param("creatorIds", "2, 1,7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.creators[0].handle").value("chef"))
                .andExpect(jsonPath("$.creators[1].handle").value("dancer"))
                .andExpect(jsonPath("$.skippedIds[0]").value(7))
                .andExpect(jsonPath("$.insights[0].label").value("Largest Audience"));
    }

    @Test
    void needsAtLeastTwoIds() throws Exception {
        mockMvc.perform(get("/api/analytics/compare").param("creatorIds", "1"))
                .andExpect(status().isBadRequest());

        verify(analyticsService, never()).compare(any());
    }

    @Test
    void rejectsMalformedIds() throws Exception {
        mockMvc.perform(get("/api/analytics/compare").param("creatorIds", "1,two"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/analytics/compare")).andExpect(status().isBadRequest());
    }
}
