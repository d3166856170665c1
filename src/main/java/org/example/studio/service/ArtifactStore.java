package org.example.studio.service;

import org.example.studio.entity.ArtifactStatus;
import org.example.studio.entity.CharacterEntity;
import org.example.studio.entity.GeneratedArtifact;
import org.example.studio.entity.PageEntity;
import org.example.studio.entity.ProjectEntity;
import org.example.studio.entity.ProjectStatus;
import org.example.studio.generation.GenerationResult;
import org.example.studio.repository.CharacterRepository;
import org.example.studio.repository.PageRepository;
import org.example.studio.repository.ProjectRepository;
import org.example.studio.workflow.FeedbackLedger;
import org.example.studio.workflow.NotFoundException;
import org.example.studio.workflow.ProjectStatusMachine;
import org.example.studio.workflow.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Transactional access to projects, characters and pages. Every generation outcome is written
 * here in its own short transaction, so one item's write never waits on another's.
 */
@Service
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private static final List<ArtifactStatus> PENDING_STATUSES = List.of(ArtifactStatus.NOT_STARTED, ArtifactStatus.FAILED);

    private final ProjectRepository projectRepository;
    private final CharacterRepository characterRepository;
    private final PageRepository pageRepository;

    public ArtifactStore(
            ProjectRepository projectRepository,
            CharacterRepository characterRepository,
            PageRepository pageRepository) {
        this.projectRepository = projectRepository;
        this.characterRepository = characterRepository;
        this.pageRepository = pageRepository;
    }

    @Transactional(readOnly = true)
    public ProjectEntity requireProject(String projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> NotFoundException.of("Project", projectId));
    }

    @Transactional(readOnly = true)
    public ProjectEntity requireProjectByToken(String reviewToken) {
        if (reviewToken == null || reviewToken.isBlank()) {
            throw new NotFoundException("Review link not found");
        }
        return projectRepository.findByReviewToken(reviewToken.trim())
                .orElseThrow(() -> new NotFoundException("Review link not found"));
    }

    @Transactional(readOnly = true)
    public CharacterEntity requireCharacter(String characterId) {
        return characterRepository.findByIdWithProject(characterId)
                .orElseThrow(() -> NotFoundException.of("Character", characterId));
    }

    @Transactional(readOnly = true)
    public PageEntity requirePage(String pageId) {
        return pageRepository.findByIdWithProject(pageId)
                .orElseThrow(() -> NotFoundException.of("Page", pageId));
    }

    /**
     * @throws NotFoundException if the character does not exist or belongs to another project
     */
    @Transactional(readOnly = true)
    public CharacterEntity requireCharacterInProject(String projectId, String characterId) {
        CharacterEntity character = requireCharacter(characterId);
        if (!character.getProject().getId().equals(projectId)) {
            throw NotFoundException.of("Character", characterId);
        }
        return character;
    }

    @Transactional(readOnly = true)
    public PageEntity requirePageInProject(String projectId, String pageId) {
        PageEntity page = requirePage(pageId);
        if (!page.getProject().getId().equals(projectId)) {
            throw NotFoundException.of("Page", pageId);
        }
        return page;
    }

    @Transactional(readOnly = true)
    public List<CharacterEntity> characters(String projectId) {
        return characterRepository.findByProjectIdOrderByCreatedAt(projectId);
    }

    @Transactional(readOnly = true)
    public List<PageEntity> pages(String projectId) {
        return pageRepository.findByProjectIdOrderByPageNumber(projectId);
    }

    @Transactional(readOnly = true)
    public Optional<CharacterEntity> mainCharacter(String projectId) {
        return characterRepository.findFirstByProjectIdAndMainTrue(projectId);
    }

    /**
     * Secondary characters without a usable image, recomputed from stored state on every call.
     */
    @Transactional(readOnly = true)
    public List<CharacterEntity> pendingCharacters(String projectId) {
        return characterRepository.findSecondaryByProjectAndImageStatusIn(projectId, PENDING_STATUSES);
    }

    @Transactional(readOnly = true)
    public List<PageEntity> pendingPages(String projectId) {
        return pageRepository.findByProjectAndIllustrationStatusIn(projectId, PENDING_STATUSES);
    }

    @Transactional
    public void markCharactersGenerating(Collection<String> characterIds) {
        for (CharacterEntity character : characterRepository.findAllById(characterIds)) {
            character.getImage().markGenerating();
        }
    }

    @Transactional
    public void markPagesGenerating(Collection<String> pageIds) {
        for (PageEntity page : pageRepository.findAllById(pageIds)) {
            page.getIllustration().markGenerating();
        }
    }

    /**
     * Record a portrait outcome. When {@code feedbackRound} is given and the portrait succeeded,
     * open feedback on the character is archived as addressed by the regeneration.
     *
     * @return true if open feedback was resolved
     */
    @Transactional
    public boolean recordCharacterImage(String characterId, GenerationResult result, String prompt, Integer feedbackRound) {
        CharacterEntity character = characterRepository.findById(characterId)
                .orElseThrow(() -> NotFoundException.of("Character", characterId));
        apply(character.getImage(), result);
        if (prompt != null) {
            character.setGenerationPrompt(prompt);
        }
        boolean resolved = false;
        if (result instanceof GenerationResult.Success && feedbackRound != null) {
            resolved = FeedbackLedger.resolveByRegeneration(character.getFeedback(), feedbackRound);
        }
        characterRepository.save(character);
        return resolved;
    }

    @Transactional
    public void markCharacterSketchGenerating(String characterId) {
        characterRepository.findById(characterId).ifPresent(c -> c.getSketch().markGenerating());
    }

    @Transactional
    public void recordCharacterSketch(String characterId, GenerationResult result) {
        characterRepository.findById(characterId).ifPresent(character -> {
            apply(character.getSketch(), result);
            characterRepository.save(character);
        });
    }

    /**
     * Record an illustration outcome. The first successful illustration also becomes the page's
     * original.
     *
     * @return true if open feedback was resolved
     */
    @Transactional
    public boolean recordPageIllustration(String pageId, GenerationResult result, Integer feedbackRound) {
        PageEntity page = pageRepository.findById(pageId)
                .orElseThrow(() -> NotFoundException.of("Page", pageId));
        apply(page.getIllustration(), result);
        boolean resolved = false;
        if (result instanceof GenerationResult.Success success) {
            page.setOriginalIllustrationUrl(success.ref());
            if (feedbackRound != null) {
                resolved = FeedbackLedger.resolveByRegeneration(page.getFeedback(), feedbackRound);
            }
        }
        pageRepository.save(page);
        return resolved;
    }

    @Transactional
    public void markPageSketchGenerating(String pageId) {
        pageRepository.findById(pageId).ifPresent(p -> p.getSketch().markGenerating());
    }

    @Transactional
    public void recordPageSketch(String pageId, GenerationResult result) {
        pageRepository.findById(pageId).ifPresent(page -> {
            apply(page.getSketch(), result);
            pageRepository.save(page);
        });
    }

    /**
     * Apply a workflow event to the project's current stored status.
     *
     * @return the status after the transition
     * @throws org.example.studio.workflow.InvalidTransitionException if the table rejects it
     */
    @Transactional
    public ProjectStatus applyEvent(String projectId, WorkflowEvent event) {
        ProjectEntity project = requireProject(projectId);
        ProjectStatus current = project.getStatus();
        ProjectStatus next = ProjectStatusMachine.transition(current, event);
        if (next != current) {
            project.setStatus(next);
            projectRepository.save(project);
            log.info("Project {} moved {} -> {} on {}", projectId, current, next, event);
        }
        return next;
    }

    /**
     * Like {@link #applyEvent}, but leaves the project alone when the table has no edge.
     */
    @Transactional
    public ProjectStatus applyEventIfAllowed(String projectId, WorkflowEvent event) {
        ProjectEntity project = requireProject(projectId);
        if (!ProjectStatusMachine.canApply(project.getStatus(), event)) {
            log.info("Project {} stays {}: {} does not apply", projectId, project.getStatus(), event);
            return project.getStatus();
        }
        return applyEvent(projectId, event);
    }

    /**
     * Return a project in revision to sketch review once no page has open feedback.
     */
    @Transactional
    public ProjectStatus settleSketchRevision(String projectId) {
        ProjectEntity project = requireProject(projectId);
        if (project.getStatus() == ProjectStatus.SKETCHES_REVISION
                && pageRepository.countOpenFeedbackByProject(projectId) == 0) {
            return applyEvent(projectId, WorkflowEvent.SKETCH_FEEDBACK_CLEARED);
        }
        return project.getStatus();
    }

    @Transactional(readOnly = true)
    public boolean hasOpenCharacterFeedback(String projectId) {
        return characterRepository.countOpenFeedbackByProject(projectId) > 0;
    }

    @Transactional(readOnly = true)
    public boolean hasOpenPageFeedback(String projectId) {
        return pageRepository.countOpenFeedbackByProject(projectId) > 0;
    }

    @Transactional
    public ProjectEntity saveProject(ProjectEntity project) {
        return projectRepository.save(project);
    }

    @Transactional
    public CharacterEntity saveCharacter(CharacterEntity character) {
        return characterRepository.save(character);
    }

    @Transactional
    public PageEntity savePage(PageEntity page) {
        return pageRepository.save(page);
    }

    private static void apply(GeneratedArtifact artifact, GenerationResult result) {
        if (result instanceof GenerationResult.Success success) {
            artifact.markReady(success.ref());
        } else if (result instanceof GenerationResult.Failure failure) {
            artifact.markFailed(failure.error());
        }
    }
}
