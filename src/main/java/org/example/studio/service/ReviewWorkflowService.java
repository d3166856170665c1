package org.example.studio.service;

import org.example.studio.entity.CharacterEntity;
import org.example.studio.entity.PageEntity;
import org.example.studio.entity.ProjectEntity;
import org.example.studio.entity.ProjectStatus;
import org.example.studio.model.DispatchResult;
import org.example.studio.model.GenerationScope;
import org.example.studio.model.PageView;
import org.example.studio.model.ReviewSubmissionResult;
import org.example.studio.notification.NotificationEvent;
import org.example.studio.notification.NotificationGateway;
import org.example.studio.workflow.FeedbackLedger;
import org.example.studio.workflow.InvalidTransitionException;
import org.example.studio.workflow.ProjectStatusMachine;
import org.example.studio.workflow.ValidationException;
import org.example.studio.workflow.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves a project between the admin and the customer: sending work out for review, taking the
 * customer's submission or approval back in, and the admin overrides.
 */
@Service
public class ReviewWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(ReviewWorkflowService.class);

    private final ArtifactStore artifactStore;
    private final GenerationDispatchService generationDispatchService;
    private final NotificationGateway notificationGateway;

    // proxied self so resolveCharacterReview runs in its own transaction
    private ReviewWorkflowService self;

    public ReviewWorkflowService(
            ArtifactStore artifactStore,
            GenerationDispatchService generationDispatchService,
            NotificationGateway notificationGateway) {
        this.artifactStore = artifactStore;
        this.generationDispatchService = generationDispatchService;
        this.notificationGateway = notificationGateway;
        this.self = this;
    }

    @Autowired
    @Lazy
    public void setSelf(ReviewWorkflowService self) {
        this.self = self;
    }

    /**
     * Send characters or sketches to the customer, depending on the phase the project is in.
     * Feedback still open is archived as handled, and the send counter moves on when there is
     * generated work to show.
     */
    @Transactional
    public ProjectStatus sendToCustomer(String projectId) {
        ProjectEntity project = artifactStore.requireProject(projectId);
        ProjectStatus status = project.getStatus();
        if (ProjectStatusMachine.canApply(status, WorkflowEvent.SEND_CHARACTERS_TO_CUSTOMER)) {
            return sendCharacters(project);
        }
        if (ProjectStatusMachine.canApply(status, WorkflowEvent.SEND_SKETCHES_TO_CUSTOMER)) {
            return sendSketches(project);
        }
        throw new InvalidTransitionException(status, WorkflowEvent.SEND_CHARACTERS_TO_CUSTOMER,
                "Nothing can be sent to the customer while project is " + status);
    }

    private ProjectStatus sendCharacters(ProjectEntity project) {
        List<CharacterEntity> characters = artifactStore.characters(project.getId());
        int round = project.getCharacterSendCount();
        for (CharacterEntity character : characters) {
            if (FeedbackLedger.resolveByRegeneration(character.getFeedback(), round)) {
                artifactStore.saveCharacter(character);
            }
        }
        boolean hasImages = characters.stream().anyMatch(c -> !c.isMain() && c.getImage().isReady());
        if (hasImages) {
            project.incrementCharacterSendCount();
            artifactStore.saveProject(project);
        }
        ProjectStatus next = artifactStore.applyEvent(project.getId(), WorkflowEvent.SEND_CHARACTERS_TO_CUSTOMER);
        notifySent(project, "characters", project.getCharacterSendCount());
        return next;
    }

    private ProjectStatus sendSketches(ProjectEntity project) {
        List<PageEntity> pages = artifactStore.pages(project.getId());
        int round = project.getIllustrationSendCount();
        for (PageEntity page : pages) {
            if (FeedbackLedger.resolveByRegeneration(page.getFeedback(), round)) {
                artifactStore.savePage(page);
            }
        }
        boolean hasImages = pages.stream()
                .anyMatch(p -> p.getIllustration().isReady() || p.getSketch().isReady());
        if (hasImages) {
            project.incrementIllustrationSendCount();
            artifactStore.saveProject(project);
        }
        ProjectStatus next = artifactStore.applyEvent(project.getId(), WorkflowEvent.SEND_SKETCHES_TO_CUSTOMER);
        notifySent(project, "sketches", project.getIllustrationSendCount());
        return next;
    }

    /**
     * Customer submits the character review. Characters still waiting for an image are
     * generated; otherwise open feedback sends the project to revision, and no feedback
     * approves it.
     */
    public ReviewSubmissionResult submitCharacterReview(String reviewToken) {
        ProjectEntity project = artifactStore.requireProjectByToken(reviewToken);
        String projectId = project.getId();
        ProjectStatus status = project.getStatus();
        if (status == ProjectStatus.CHARACTERS_APPROVED) {
            return new ReviewSubmissionResult(projectId, status, false, "Characters already approved");
        }
        if (!artifactStore.pendingCharacters(projectId).isEmpty()
                && ProjectStatusMachine.canApply(status, WorkflowEvent.START_CHARACTER_GENERATION)) {
            DispatchResult dispatch = generationDispatchService.requestGeneration(projectId, GenerationScope.characters());
            return new ReviewSubmissionResult(projectId, dispatch.status(), dispatch.accepted(), dispatch.message());
        }
        ProjectStatus next = self.resolveCharacterReview(projectId);
        String message = next == ProjectStatus.CHARACTERS_APPROVED
                ? "Characters approved"
                : "Feedback sent for revision";
        notifyCustomer(project, next == ProjectStatus.CHARACTERS_APPROVED
                ? NotificationEvent.CUSTOMER_APPROVED
                : NotificationEvent.CUSTOMER_FEEDBACK_SUBMITTED, next);
        return new ReviewSubmissionResult(projectId, next, false, message);
    }

    /**
     * Customer approval. In the character phase open feedback turns the approval into a
     * revision request; in the sketch phase the same holds for page feedback. Approving what is
     * already approved succeeds without changes.
     */
    @Transactional
    public ProjectStatus approve(String reviewToken) {
        ProjectEntity project = artifactStore.requireProjectByToken(reviewToken);
        ProjectStatus status = project.getStatus();
        String projectId = project.getId();
        ProjectStatus next;
        switch (status) {
            case CHARACTERS_APPROVED, ILLUSTRATION_APPROVED, COMPLETED -> {
                return status;
            }
            case SKETCHES_REVIEW, SKETCHES_REVISION -> {
                if (artifactStore.hasOpenPageFeedback(projectId)) {
                    next = artifactStore.applyEvent(projectId, WorkflowEvent.REQUEST_SKETCH_REVISION);
                } else {
                    artifactStore.applyEvent(projectId, WorkflowEvent.SKETCH_FEEDBACK_CLEARED);
                    next = artifactStore.applyEvent(projectId, WorkflowEvent.APPROVE_ILLUSTRATIONS);
                }
            }
            default -> next = resolveCharacterReview(projectId);
        }
        notifyCustomer(project, next == ProjectStatus.CHARACTERS_APPROVED || next == ProjectStatus.ILLUSTRATION_APPROVED
                ? NotificationEvent.CUSTOMER_APPROVED
                : NotificationEvent.CUSTOMER_FEEDBACK_SUBMITTED, next);
        return next;
    }

    @Transactional
    public ProjectStatus resolveCharacterReview(String projectId) {
        return artifactStore.hasOpenCharacterFeedback(projectId)
                ? artifactStore.applyEvent(projectId, WorkflowEvent.REQUEST_CHARACTER_REVISION)
                : artifactStore.applyEvent(projectId, WorkflowEvent.APPROVE_CHARACTERS);
    }

    /**
     * Admin override. Open feedback in the phase being approved is archived first so the
     * approved project carries no live requests.
     */
    @Transactional
    public ProjectStatus adminApprove(String projectId) {
        ProjectEntity project = artifactStore.requireProject(projectId);
        ProjectStatus status = project.getStatus();
        if (status == ProjectStatus.ILLUSTRATION_APPROVED || status == ProjectStatus.COMPLETED) {
            return status;
        }
        if (ProjectStatusMachine.canApply(status, WorkflowEvent.ADMIN_APPROVE_CHARACTERS)) {
            int round = project.getCharacterSendCount();
            for (CharacterEntity character : artifactStore.characters(projectId)) {
                if (FeedbackLedger.resolveManually(character.getFeedback(), round)) {
                    artifactStore.saveCharacter(character);
                }
            }
            return artifactStore.applyEvent(projectId, WorkflowEvent.ADMIN_APPROVE_CHARACTERS);
        }
        if (ProjectStatusMachine.canApply(status, WorkflowEvent.ADMIN_APPROVE_ILLUSTRATIONS)) {
            int round = project.getIllustrationSendCount();
            for (PageEntity page : artifactStore.pages(projectId)) {
                if (FeedbackLedger.resolveManually(page.getFeedback(), round)) {
                    artifactStore.savePage(page);
                }
            }
            return artifactStore.applyEvent(projectId, WorkflowEvent.ADMIN_APPROVE_ILLUSTRATIONS);
        }
        throw new InvalidTransitionException(status, WorkflowEvent.ADMIN_APPROVE_CHARACTERS,
                "Project cannot be approved while it is " + status);
    }

    @Transactional
    public ProjectStatus complete(String projectId) {
        ProjectEntity project = artifactStore.requireProject(projectId);
        if (project.getStatus() == ProjectStatus.COMPLETED) {
            return ProjectStatus.COMPLETED;
        }
        ProjectStatus next = artifactStore.applyEvent(projectId, WorkflowEvent.COMPLETE);
        log.info("Project {} completed", projectId);
        return next;
    }

    /**
     * Put the first illustration ever generated for the page back in place.
     */
    @Transactional
    public PageView resetToOriginal(String pageId) {
        PageEntity page = artifactStore.requirePage(pageId);
        String original = page.getOriginalIllustrationUrl();
        if (original == null || original.isBlank()) {
            throw new ValidationException("Page " + page.getPageNumber() + " has no original illustration");
        }
        page.getIllustration().markReady(original);
        artifactStore.savePage(page);
        return PageView.from(page);
    }

    private void notifySent(ProjectEntity project, String phase, int round) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("projectId", project.getId());
        payload.put("bookTitle", project.getBookTitle());
        payload.put("phase", phase);
        payload.put("round", round);
        payload.put("reviewToken", project.getReviewToken());
        payload.put("authorFirstname", project.getAuthorFirstname());
        payload.put("authorEmail", project.getAuthorEmail());
        payload.put("authorPhone", project.getAuthorPhone());
        notificationGateway.notify(NotificationEvent.SENT_TO_CUSTOMER, payload);
    }

    private void notifyCustomer(ProjectEntity project, NotificationEvent event, ProjectStatus status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("projectId", project.getId());
        payload.put("bookTitle", project.getBookTitle());
        payload.put("status", status.value());
        notificationGateway.notify(event, payload);
    }
}
