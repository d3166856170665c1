package org.example.studio.controller;

import org.example.studio.model.CharacterView;
import org.example.studio.model.PageView;
import org.example.studio.model.ReviewSubmissionResult;
import org.example.studio.model.ReviewView;
import org.example.studio.model.WorkflowRequests;
import org.example.studio.service.FeedbackService;
import org.example.studio.service.ProjectService;
import org.example.studio.service.ReviewWorkflowService;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Customer review endpoints. The review token in the path is the only credential.
 */
@RestController
@RequestMapping("/api/review/{token}")
public class ReviewController {

    private final ProjectService projectService;
    private final FeedbackService feedbackService;
    private final ReviewWorkflowService reviewWorkflowService;

    public ReviewController(
            ProjectService projectService,
            FeedbackService feedbackService,
            ReviewWorkflowService reviewWorkflowService) {
        this.projectService = projectService;
        this.feedbackService = feedbackService;
        this.reviewWorkflowService = reviewWorkflowService;
    }

    @GetMapping
    public ReviewView getReview(@PathVariable String token) {
        return projectService.getReview(token);
    }

    @PatchMapping("/characters/{characterId}/feedback")
    public CharacterView characterFeedback(
            @PathVariable String token,
            @PathVariable String characterId,
            @RequestBody WorkflowRequests.Text request) {
        return feedbackService.submitCharacterFeedback(token, characterId, text(request));
    }

    @PatchMapping("/pages/{pageId}/feedback")
    public PageView pageFeedback(
            @PathVariable String token,
            @PathVariable String pageId,
            @RequestBody WorkflowRequests.Text request) {
        return feedbackService.submitPageFeedback(token, pageId, text(request));
    }

    @PostMapping("/pages/{pageId}/follow-up")
    public PageView followUp(
            @PathVariable String token,
            @PathVariable String pageId,
            @RequestBody WorkflowRequests.Text request) {
        return feedbackService.followUp(token, pageId, text(request));
    }

    @PostMapping("/pages/{pageId}/accept-reply")
    public PageView acceptReply(@PathVariable String token, @PathVariable String pageId) {
        return feedbackService.acceptReply(token, pageId);
    }

    @PostMapping("/submit")
    public ReviewSubmissionResult submit(@PathVariable String token) {
        return reviewWorkflowService.submitCharacterReview(token);
    }

    @PostMapping("/approve")
    public Map<String, Object> approve(@PathVariable String token) {
        return Map.of("status", reviewWorkflowService.approve(token).value());
    }

    private static String text(WorkflowRequests.Text request) {
        return request == null ? null : request.text();
    }
}
