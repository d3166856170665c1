package org.example.studio.controller;

import org.example.studio.entity.ProjectStatus;
import org.example.studio.model.CharacterView;
import org.example.studio.model.DispatchResult;
import org.example.studio.model.GenerationScope;
import org.example.studio.model.PageView;
import org.example.studio.model.ProjectView;
import org.example.studio.model.WorkflowRequests;
import org.example.studio.service.GenerationDispatchService;
import org.example.studio.service.ProjectService;
import org.example.studio.service.ReviewWorkflowService;
import org.example.studio.workflow.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminProjectController {

    private final ProjectService projectService;
    private final GenerationDispatchService generationDispatchService;
    private final ReviewWorkflowService reviewWorkflowService;

    public AdminProjectController(
            ProjectService projectService,
            GenerationDispatchService generationDispatchService,
            ReviewWorkflowService reviewWorkflowService) {
        this.projectService = projectService;
        this.generationDispatchService = generationDispatchService;
        this.reviewWorkflowService = reviewWorkflowService;
    }

    @PostMapping("/projects")
    public ResponseEntity<ProjectView> createProject(@RequestBody WorkflowRequests.CreateProject request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(projectService.createProject(request));
    }

    @GetMapping("/projects")
    public List<ProjectView> listProjects() {
        return projectService.listProjects();
    }

    @GetMapping("/projects/{projectId}")
    public ProjectView getProject(@PathVariable String projectId) {
        return projectService.getProject(projectId);
    }

    @PostMapping("/projects/{projectId}/characters")
    public ResponseEntity<CharacterView> addCharacter(
            @PathVariable String projectId,
            @RequestBody WorkflowRequests.CharacterDetails request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(projectService.addCharacter(projectId, request));
    }

    @PatchMapping("/characters/{characterId}")
    public CharacterView updateCharacter(
            @PathVariable String characterId,
            @RequestBody WorkflowRequests.CharacterDetails request) {
        return projectService.updateCharacter(characterId, request);
    }

    @PutMapping("/characters/{characterId}/image")
    public CharacterView setCharacterImage(
            @PathVariable String characterId,
            @RequestBody WorkflowRequests.ImageReference request) {
        return projectService.setCharacterImage(characterId, request == null ? null : request.url());
    }

    @DeleteMapping("/characters/{characterId}")
    public ResponseEntity<Void> deleteCharacter(@PathVariable String characterId) {
        projectService.deleteCharacter(characterId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/projects/{projectId}/pages")
    public List<PageView> upsertPages(
            @PathVariable String projectId,
            @RequestBody WorkflowRequests.Pages request) {
        return projectService.upsertPages(projectId, request == null ? null : request.pages());
    }

    /**
     * Start generation. Answers 202 once the batch is queued; the result arrives through the
     * project status and the generation-status endpoint.
     */
    @PostMapping("/projects/{projectId}/generate")
    public ResponseEntity<DispatchResult> generate(
            @PathVariable String projectId,
            @RequestBody WorkflowRequests.Generate request) {
        if (request == null || request.kind() == null) {
            throw new ValidationException("Generation kind is required");
        }
        DispatchResult result = generationDispatchService.requestGeneration(
                projectId, new GenerationScope(request.kind(), request.itemId()));
        return dispatchResponse(result);
    }

    @PostMapping("/projects/{projectId}/retry-generation")
    public ResponseEntity<DispatchResult> retryGeneration(@PathVariable String projectId) {
        return dispatchResponse(generationDispatchService.retryCharacterGeneration(projectId));
    }

    @PostMapping("/projects/{projectId}/send-to-customer")
    public Map<String, Object> sendToCustomer(@PathVariable String projectId) {
        return statusBody(projectId, reviewWorkflowService.sendToCustomer(projectId));
    }

    @PostMapping("/projects/{projectId}/approve")
    public Map<String, Object> approve(@PathVariable String projectId) {
        return statusBody(projectId, reviewWorkflowService.adminApprove(projectId));
    }

    @PostMapping("/projects/{projectId}/complete")
    public Map<String, Object> complete(@PathVariable String projectId) {
        return statusBody(projectId, reviewWorkflowService.complete(projectId));
    }

    @PostMapping("/pages/{pageId}/reset-to-original")
    public PageView resetToOriginal(@PathVariable String pageId) {
        return reviewWorkflowService.resetToOriginal(pageId);
    }

    private ResponseEntity<DispatchResult> dispatchResponse(DispatchResult result) {
        if (!result.accepted()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
        }
        return result.dispatchedCount() > 0
                ? ResponseEntity.accepted().body(result)
                : ResponseEntity.ok(result);
    }

    private static Map<String, Object> statusBody(String projectId, ProjectStatus status) {
        return Map.of("projectId", projectId, "status", status.value());
    }
}
