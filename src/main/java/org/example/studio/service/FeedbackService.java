package org.example.studio.service;

import org.example.studio.entity.CharacterEntity;
import org.example.studio.entity.FeedbackState;
import org.example.studio.entity.PageEntity;
import org.example.studio.entity.ProjectEntity;
import org.example.studio.entity.ProjectStatus;
import org.example.studio.model.CharacterView;
import org.example.studio.model.PageView;
import org.example.studio.model.WorkflowRequests.ResolveMode;
import org.example.studio.notification.NotificationEvent;
import org.example.studio.notification.NotificationGateway;
import org.example.studio.workflow.FeedbackLedger;
import org.example.studio.workflow.InvalidTransitionException;
import org.example.studio.workflow.ProjectStatusMachine;
import org.example.studio.workflow.ValidationException;
import org.example.studio.workflow.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Customer feedback and admin replies on characters and pages. Revision rounds come from the
 * project's send counters: characters use the character count, pages the illustration count.
 */
@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private static final Set<ProjectStatus> CHARACTER_FEEDBACK_STATUSES = EnumSet.of(
            ProjectStatus.CHARACTER_REVIEW,
            ProjectStatus.CHARACTERS_REGENERATED,
            ProjectStatus.CHARACTER_REVISION_NEEDED
    );

    private static final Set<ProjectStatus> PAGE_FEEDBACK_STATUSES = EnumSet.of(
            ProjectStatus.SKETCHES_REVIEW,
            ProjectStatus.SKETCHES_REVISION
    );

    private final ArtifactStore artifactStore;
    private final NotificationGateway notificationGateway;

    public FeedbackService(ArtifactStore artifactStore, NotificationGateway notificationGateway) {
        this.artifactStore = artifactStore;
        this.notificationGateway = notificationGateway;
    }

    @Transactional
    public CharacterView submitCharacterFeedback(String reviewToken, String characterId, String text) {
        ProjectEntity project = artifactStore.requireProjectByToken(reviewToken);
        requireStatus(project, CHARACTER_FEEDBACK_STATUSES, WorkflowEvent.REQUEST_CHARACTER_REVISION);
        CharacterEntity character = artifactStore.requireCharacterInProject(project.getId(), characterId);
        if (FeedbackLedger.replaceRequest(character.getFeedback(), text, project.getCharacterSendCount())) {
            artifactStore.saveCharacter(character);
            log.info("Customer feedback recorded on character {} of project {}", characterId, project.getId());
        }
        return CharacterView.from(character);
    }

    /**
     * A new page request puts a project under review into revision.
     */
    @Transactional
    public PageView submitPageFeedback(String reviewToken, String pageId, String text) {
        ProjectEntity project = artifactStore.requireProjectByToken(reviewToken);
        requireStatus(project, PAGE_FEEDBACK_STATUSES, WorkflowEvent.REQUEST_SKETCH_REVISION);
        PageEntity page = artifactStore.requirePageInProject(project.getId(), pageId);
        if (FeedbackLedger.replaceRequest(page.getFeedback(), text, project.getIllustrationSendCount())) {
            artifactStore.savePage(page);
            artifactStore.applyEvent(project.getId(), WorkflowEvent.REQUEST_SKETCH_REVISION);
            notifyPage(NotificationEvent.CUSTOMER_FEEDBACK_SUBMITTED, project, page);
        }
        return PageView.from(page);
    }

    @Transactional
    public PageView followUp(String reviewToken, String pageId, String text) {
        ProjectEntity project = artifactStore.requireProjectByToken(reviewToken);
        requireStatus(project, PAGE_FEEDBACK_STATUSES, WorkflowEvent.REQUEST_SKETCH_REVISION);
        PageEntity page = artifactStore.requirePageInProject(project.getId(), pageId);
        FeedbackLedger.appendFollowUp(page.getFeedback(), text);
        artifactStore.savePage(page);
        artifactStore.applyEvent(project.getId(), WorkflowEvent.REQUEST_SKETCH_REVISION);
        notifyPage(NotificationEvent.CUSTOMER_FOLLOW_UP, project, page);
        return PageView.from(page);
    }

    @Transactional
    public PageView acceptReply(String reviewToken, String pageId) {
        ProjectEntity project = artifactStore.requireProjectByToken(reviewToken);
        requireStatus(project, PAGE_FEEDBACK_STATUSES, WorkflowEvent.SKETCH_FEEDBACK_CLEARED);
        PageEntity page = artifactStore.requirePageInProject(project.getId(), pageId);
        FeedbackLedger.acceptReply(page.getFeedback(), project.getIllustrationSendCount());
        artifactStore.savePage(page);
        artifactStore.settleSketchRevision(project.getId());
        notifyPage(NotificationEvent.CUSTOMER_ACCEPTED_REPLY, project, page);
        return PageView.from(page);
    }

    @Transactional
    public PageView replyAsAdmin(String pageId, String text) {
        PageEntity page = artifactStore.requirePage(pageId);
        FeedbackLedger.replyAsAdmin(page.getFeedback(), text);
        artifactStore.savePage(page);
        notifyPage(NotificationEvent.ADMIN_REPLIED, page.getProject(), page);
        return PageView.from(page);
    }

    @Transactional
    public PageView resolvePage(String pageId, ResolveMode mode) {
        PageEntity page = artifactStore.requirePage(pageId);
        ProjectEntity project = page.getProject();
        if (resolve(page.getFeedback(), mode, project.getIllustrationSendCount())) {
            artifactStore.savePage(page);
            artifactStore.settleSketchRevision(project.getId());
            log.info("Resolved feedback on page {} ({})", pageId, mode);
        }
        return PageView.from(page);
    }

    @Transactional
    public CharacterView resolveCharacter(String characterId, ResolveMode mode) {
        CharacterEntity character = artifactStore.requireCharacter(characterId);
        if (resolve(character.getFeedback(), mode, character.getProject().getCharacterSendCount())) {
            artifactStore.saveCharacter(character);
            log.info("Resolved feedback on character {} ({})", characterId, mode);
        }
        return CharacterView.from(character);
    }

    private boolean resolve(FeedbackState state, ResolveMode mode, int round) {
        if (mode == null) {
            throw new ValidationException("Resolve mode is required");
        }
        return switch (mode) {
            case REGENERATION -> FeedbackLedger.resolveByRegeneration(state, round);
            case MANUAL -> FeedbackLedger.resolveManually(state, round);
        };
    }

    private void requireStatus(ProjectEntity project, Set<ProjectStatus> allowed, WorkflowEvent event) {
        if (!allowed.contains(project.getStatus())) {
            throw new InvalidTransitionException(project.getStatus(), event,
                    "Feedback is not accepted while project is " + project.getStatus());
        }
        if (!ProjectStatusMachine.canApply(project.getStatus(), event)) {
            throw new InvalidTransitionException(project.getStatus(), event);
        }
    }

    private void notifyPage(NotificationEvent event, ProjectEntity project, PageEntity page) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("projectId", project.getId());
        payload.put("bookTitle", project.getBookTitle());
        payload.put("pageNumber", page.getPageNumber());
        notificationGateway.notify(event, payload);
    }
}
