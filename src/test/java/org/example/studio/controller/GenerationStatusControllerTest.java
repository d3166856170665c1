package org.example.studio.controller;

import org.example.studio.entity.ProjectStatus;
import org.example.studio.model.GenerationJobStatusResponse;
import org.example.studio.model.GenerationPipelineStatus;
import org.example.studio.service.GenerationJobStatusService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GenerationStatusController.class)
class GenerationStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GenerationJobStatusService generationJobStatusService;

    @Test
    void getProjectStatus_returnsPerKindCounts() throws Exception {
        GenerationJobStatusResponse response = new GenerationJobStatusResponse(
                "project-1",
                ProjectStatus.CHARACTER_GENERATION_FAILED,
                false,
                LocalDateTime.of(2026, 2, 14, 12, 0),
                GenerationPipelineStatus.of(0, 0, 2, 1),
                GenerationPipelineStatus.of(4, 0, 0, 0),
                GenerationPipelineStatus.of(4, 0, 2, 1)
        );
        when(generationJobStatusService.getProjectStatus("project-1")).thenReturn(response);

        mockMvc.perform(get("/api/admin/projects/project-1/generation-status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.projectStatus", is("character_generation_failed")))
                .andExpect(jsonPath("$.batchInFlight", is(false)))
                .andExpect(jsonPath("$.characters.failed", is(1)))
                .andExpect(jsonPath("$.pages.notStarted", is(4)))
                .andExpect(jsonPath("$.totals.ready", is(2)));
    }
}
