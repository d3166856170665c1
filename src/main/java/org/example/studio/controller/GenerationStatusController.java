package org.example.studio.controller;

import org.example.studio.model.GenerationJobStatusResponse;
import org.example.studio.service.GenerationJobStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/projects")
public class GenerationStatusController {

    private final GenerationJobStatusService generationJobStatusService;

    public GenerationStatusController(GenerationJobStatusService generationJobStatusService) {
        this.generationJobStatusService = generationJobStatusService;
    }

    @GetMapping("/{projectId}/generation-status")
    public GenerationJobStatusResponse getProjectStatus(@PathVariable String projectId) {
        return generationJobStatusService.getProjectStatus(projectId);
    }
}
