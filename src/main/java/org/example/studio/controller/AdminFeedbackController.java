package org.example.studio.controller;

import org.example.studio.model.CharacterView;
import org.example.studio.model.PageView;
import org.example.studio.model.WorkflowRequests;
import org.example.studio.service.FeedbackService;
import org.example.studio.workflow.ValidationException;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
public class AdminFeedbackController {

    private final FeedbackService feedbackService;

    public AdminFeedbackController(FeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    @PostMapping("/pages/{pageId}/reply")
    public PageView reply(@PathVariable String pageId, @RequestBody WorkflowRequests.Text request) {
        return feedbackService.replyAsAdmin(pageId, request == null ? null : request.text());
    }

    @PostMapping("/pages/{pageId}/resolve")
    public PageView resolvePage(@PathVariable String pageId, @RequestBody WorkflowRequests.Resolve request) {
        return feedbackService.resolvePage(pageId, requireMode(request));
    }

    @PostMapping("/characters/{characterId}/resolve")
    public CharacterView resolveCharacter(
            @PathVariable String characterId,
            @RequestBody WorkflowRequests.Resolve request) {
        return feedbackService.resolveCharacter(characterId, requireMode(request));
    }

    private static WorkflowRequests.ResolveMode requireMode(WorkflowRequests.Resolve request) {
        if (request == null || request.mode() == null) {
            throw new ValidationException("Resolve mode is required (REGENERATION or MANUAL)");
        }
        return request.mode();
    }
}
