package com.agenttracker.discovery.controller;

import com.agenttracker.discovery.dto.DiscoveryDto;
import com.agenttracker.discovery.dto.RecommendationResponse;
import com.agenttracker.discovery.dto.RecommendationResponse.SummaryGenerator;
import com.agenttracker.discovery.exception.ProjectNotFoundException;
import com.agenttracker.discovery.service.recommend.RecommendationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * RecommendationController 웹 계층 테스트
 */
@WebMvcTest(RecommendationController.class)
class RecommendationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecommendationService recommendationService;

    @Test
    @DisplayName("추천 요약과 항목 반환")
    void getRecommendations() throws Exception {
        // given
        DiscoveryDto dto = DiscoveryDto.builder()
                .id(10L)
                .title("Terrain Toolkit")
                .relevanceScore(9)
                .presented(true)
                .build();
        when(recommendationService.recommend(1L)).thenReturn(new RecommendationResponse(
                "Recommendations generated successfully", "Terrain Toolkit covers erosion.",
                SummaryGenerator.LLM, List.of(dto)));

        // when / then
        mockMvc.perform(get("/api/v1/projects/1/recommendations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("Terrain Toolkit covers erosion."))
                .andExpect(jsonPath("$.generator").value("LLM"))
                .andExpect(jsonPath("$.discoveries[0].title").value("Terrain Toolkit"))
                .andExpect(jsonPath("$.discoveries[0].presented").value(true));
    }

    @Test
    @DisplayName("제시할 항목이 없으면 summary는 null")
    void emptyRecommendations() throws Exception {
        when(recommendationService.recommend(1L)).thenReturn(RecommendationResponse.empty());

        mockMvc.perform(get("/api/v1/projects/1/recommendations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("No recent discoveries found for this project"))
                .andExpect(jsonPath("$.summary").doesNotExist())
                .andExpect(jsonPath("$.discoveries").isEmpty());
    }

    @Test
    @DisplayName("없는 프로젝트는 404")
    void unknownProject() throws Exception {
        when(recommendationService.recommend(99L)).thenThrow(new ProjectNotFoundException(99L));

        mockMvc.perform(get("/api/v1/projects/99/recommendations"))
                .andExpect(status().isNotFound());
    }
}
