package org.example.studio.service;

import org.example.studio.config.RequestCorrelation;
import org.example.studio.entity.CharacterEntity;
import org.example.studio.entity.PageEntity;
import org.example.studio.entity.ProjectEntity;
import org.example.studio.entity.ProjectStatus;
import org.example.studio.generation.GenerationClient;
import org.example.studio.generation.GenerationKind;
import org.example.studio.generation.GenerationPromptBuilder;
import org.example.studio.generation.GenerationResult;
import org.example.studio.model.DispatchResult;
import org.example.studio.model.GenerationScope;
import org.example.studio.notification.NotificationEvent;
import org.example.studio.notification.NotificationGateway;
import org.example.studio.workflow.InvalidTransitionException;
import org.example.studio.workflow.ProjectStatusMachine;
import org.example.studio.workflow.ValidationException;
import org.example.studio.workflow.WorkflowEvent;
import org.example.studio.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Predicate;

/**
 * Fans generation work out over the item executor and folds the outcomes back into the
 * project status.
 *
 * <p>Each item's result is stored as soon as it arrives. The batch waits for every item,
 * successful or not, before deciding between the succeeded and failed batch events; a
 * failure or exception in one item never cancels the others.
 */
@Service
public class GenerationDispatchService {

    private static final Logger log = LoggerFactory.getLogger(GenerationDispatchService.class);

    private static final Set<ProjectStatus> PAGE_GENERATION_STATUSES = EnumSet.of(
            ProjectStatus.CHARACTERS_APPROVED,
            ProjectStatus.SKETCHES_REVIEW,
            ProjectStatus.SKETCHES_REVISION
    );

    private final ArtifactStore artifactStore;
    private final GenerationClient generationClient;
    private final GenerationPromptBuilder promptBuilder;
    private final NotificationGateway notificationGateway;
    private final Executor batchExecutor;
    private final Executor itemExecutor;
    private final Executor followUpExecutor;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public GenerationDispatchService(
            ArtifactStore artifactStore,
            GenerationClient generationClient,
            GenerationPromptBuilder promptBuilder,
            NotificationGateway notificationGateway,
            @Qualifier("generationBatchExecutor") Executor batchExecutor,
            @Qualifier("generationItemExecutor") Executor itemExecutor,
            @Qualifier("generationFollowUpExecutor") Executor followUpExecutor) {
        this.artifactStore = artifactStore;
        this.generationClient = generationClient;
        this.promptBuilder = promptBuilder;
        this.notificationGateway = notificationGateway;
        this.batchExecutor = batchExecutor;
        this.itemExecutor = itemExecutor;
        this.followUpExecutor = followUpExecutor;
    }

    /**
     * Start generation for everything in {@code scope} that needs it. Returns as soon as the
     * batch is queued; a second request for the same project and kind while a batch is running
     * is answered with {@code accepted = false} and changes nothing.
     */
    public DispatchResult requestGeneration(String projectId, GenerationScope scope) {
        return switch (scope.kind()) {
            case CHARACTERS -> dispatchCharacters(projectId, scope);
            case PAGES -> dispatchPages(projectId, scope);
        };
    }

    /**
     * Retry every character without a usable image. With nothing left to generate, a project
     * parked after a failed batch is moved on to complete.
     */
    public DispatchResult retryCharacterGeneration(String projectId) {
        ProjectEntity project = artifactStore.requireProject(projectId);
        if (artifactStore.pendingCharacters(projectId).isEmpty()) {
            ProjectStatus status = completeEmptyBatch(projectId, project.getStatus());
            return DispatchResult.nothingPending(projectId, status);
        }
        return dispatchCharacters(projectId, GenerationScope.characters());
    }

    public boolean isBatchInFlight(String projectId) {
        return inFlight.contains(batchKey(projectId, GenerationScope.Kind.CHARACTERS))
                || inFlight.contains(batchKey(projectId, GenerationScope.Kind.PAGES));
    }

    private DispatchResult dispatchCharacters(String projectId, GenerationScope scope) {
        ProjectEntity project = artifactStore.requireProject(projectId);
        ProjectStatus status = project.getStatus();
        boolean firstPass = !scope.isExplicitItem()
                && ProjectStatusMachine.canApply(status, WorkflowEvent.START_CHARACTER_GENERATION);
        boolean revision = ProjectStatusMachine.canApply(status, WorkflowEvent.CHARACTER_BATCH_SUCCEEDED)
                && status != ProjectStatus.CHARACTER_GENERATION;
        if (!firstPass && !revision && !(scope.isExplicitItem() && status.isCharacterPhase())) {
            throw new InvalidTransitionException(status, WorkflowEvent.START_CHARACTER_GENERATION);
        }

        CharacterEntity main = artifactStore.mainCharacter(projectId)
                .orElseThrow(() -> new ValidationException("Project has no main character"));
        if (!main.getImage().isReady()) {
            throw new ValidationException("The main character needs an image before other characters can be generated");
        }

        List<CharacterEntity> work;
        if (scope.isExplicitItem()) {
            CharacterEntity character = artifactStore.requireCharacterInProject(projectId, scope.itemId());
            if (character.isMain()) {
                throw new ValidationException("The main character image is supplied by the customer, not generated");
            }
            work = List.of(character);
        } else {
            work = artifactStore.pendingCharacters(projectId);
        }

        if (work.isEmpty()) {
            return DispatchResult.nothingPending(projectId, completeEmptyBatch(projectId, status));
        }

        String key = batchKey(projectId, GenerationScope.Kind.CHARACTERS);
        if (!inFlight.add(key)) {
            log.info("Character batch already running for project {}, ignoring request", projectId);
            return DispatchResult.alreadyRunning(projectId, status);
        }

        try {
            List<String> ids = work.stream().map(CharacterEntity::getId).toList();
            artifactStore.markCharactersGenerating(ids);
            if (firstPass) {
                status = artifactStore.applyEvent(projectId, WorkflowEvent.START_CHARACTER_GENERATION);
            }
            Integer feedbackRound = scope.isExplicitItem() ? project.getCharacterSendCount() : null;
            String mainRef = main.getImage().getUrl();
            batchExecutor.execute(RequestCorrelation.propagate(
                    () -> runCharacterBatch(projectId, ids, mainRef, feedbackRound, key)));
            log.info("Dispatched {} character generation(s) for project {}", ids.size(), projectId);
            return DispatchResult.dispatched(projectId, status, ids.size());
        } catch (RejectedExecutionException e) {
            inFlight.remove(key);
            throw new WorkflowException("Generation queue is full, try again later", e);
        } catch (RuntimeException e) {
            inFlight.remove(key);
            throw e;
        }
    }

    private DispatchResult dispatchPages(String projectId, GenerationScope scope) {
        ProjectEntity project = artifactStore.requireProject(projectId);
        ProjectStatus status = project.getStatus();
        if (!PAGE_GENERATION_STATUSES.contains(status)) {
            throw new InvalidTransitionException(status, WorkflowEvent.SEND_SKETCHES_TO_CUSTOMER,
                    "Pages can only be generated after characters are approved (project is " + status + ")");
        }

        List<PageEntity> work = scope.isExplicitItem()
                ? List.of(artifactStore.requirePageInProject(projectId, scope.itemId()))
                : artifactStore.pendingPages(projectId);
        if (work.isEmpty()) {
            return DispatchResult.nothingPending(projectId, status);
        }

        String key = batchKey(projectId, GenerationScope.Kind.PAGES);
        if (!inFlight.add(key)) {
            log.info("Page batch already running for project {}, ignoring request", projectId);
            return DispatchResult.alreadyRunning(projectId, status);
        }

        try {
            List<String> ids = work.stream().map(PageEntity::getId).toList();
            artifactStore.markPagesGenerating(ids);
            String fallbackRef = artifactStore.mainCharacter(projectId)
                    .filter(c -> c.getImage().isReady())
                    .map(c -> c.getImage().getUrl())
                    .orElse(null);
            Integer feedbackRound = scope.isExplicitItem() ? project.getIllustrationSendCount() : null;
            batchExecutor.execute(RequestCorrelation.propagate(
                    () -> runPageBatch(projectId, ids, fallbackRef, feedbackRound, key)));
            log.info("Dispatched {} page generation(s) for project {}", ids.size(), projectId);
            return DispatchResult.dispatched(projectId, status, ids.size());
        } catch (RejectedExecutionException e) {
            inFlight.remove(key);
            throw new WorkflowException("Generation queue is full, try again later", e);
        } catch (RuntimeException e) {
            inFlight.remove(key);
            throw e;
        }
    }

    void runCharacterBatch(String projectId, List<String> characterIds, String mainRef, Integer feedbackRound, String key) {
        try {
            BatchOutcome outcome = awaitAll(characterIds, id -> generateCharacter(id, mainRef, feedbackRound));
            WorkflowEvent event = outcome.allSucceeded()
                    ? WorkflowEvent.CHARACTER_BATCH_SUCCEEDED
                    : WorkflowEvent.CHARACTER_BATCH_FAILED;
            ProjectStatus status = artifactStore.applyEventIfAllowed(projectId, event);
            if (outcome.allSucceeded() && status == ProjectStatus.CHARACTER_GENERATION_FAILED
                    && artifactStore.pendingCharacters(projectId).isEmpty()) {
                // a single regeneration cleared the last failed portrait
                status = completeEmptyBatch(projectId, status);
            }
            log.info("Character batch for project {} finished: {} generated, {} failed, status {}",
                    projectId, outcome.succeeded(), outcome.failed(), status);
            notifyBatch(NotificationEvent.CHARACTER_GENERATION_COMPLETE, projectId, outcome, status);
        } catch (Exception e) {
            log.error("Character batch for project {} could not be finalized", projectId, e);
        } finally {
            inFlight.remove(key);
        }
    }

    void runPageBatch(String projectId, List<String> pageIds, String fallbackRef, Integer feedbackRound, String key) {
        try {
            BatchOutcome outcome = awaitAll(pageIds, id -> generatePage(id, fallbackRef, feedbackRound));
            ProjectStatus status = feedbackRound != null
                    ? artifactStore.settleSketchRevision(projectId)
                    : artifactStore.requireProject(projectId).getStatus();
            log.info("Page batch for project {} finished: {} generated, {} failed",
                    projectId, outcome.succeeded(), outcome.failed());
            notifyBatch(NotificationEvent.PAGE_GENERATION_COMPLETE, projectId, outcome, status);
        } catch (Exception e) {
            log.error("Page batch for project {} could not be finalized", projectId, e);
        } finally {
            inFlight.remove(key);
        }
    }

    /**
     * Run every item and wait for all of them. Per-item exceptions are already converted to
     * failures by the workers, and {@code exceptionally} covers anything that escapes.
     */
    private BatchOutcome awaitAll(List<String> ids, Predicate<String> worker) {
        List<CompletableFuture<Boolean>> futures = new ArrayList<>();
        for (String id : ids) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> worker.test(id), RequestCorrelation.wrap(itemExecutor))
                    .exceptionally(error -> {
                        log.error("Generation worker for item {} failed unexpectedly", id, error);
                        return false;
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        int succeeded = (int) futures.stream().filter(CompletableFuture::join).count();
        return new BatchOutcome(succeeded, futures.size() - succeeded);
    }

    boolean generateCharacter(String characterId, String mainRef, Integer feedbackRound) {
        try {
            CharacterEntity character = artifactStore.requireCharacter(characterId);
            String prompt = promptBuilder.characterPortrait(character);
            GenerationResult result = generationClient.generate(
                    GenerationKind.CHARACTER_PORTRAIT, List.of(mainRef), prompt);
            artifactStore.recordCharacterImage(characterId, result, prompt, feedbackRound);
            if (result instanceof GenerationResult.Success success) {
                chainCharacterSketch(character, success.ref());
                return true;
            }
            log.warn("Portrait generation failed for character {}: {}",
                    characterId, ((GenerationResult.Failure) result).error());
            return false;
        } catch (Exception e) {
            log.error("Portrait generation threw for character {}", characterId, e);
            recordQuietly(() -> artifactStore.recordCharacterImage(
                    characterId, GenerationResult.failure(e.getMessage()), null, null));
            return false;
        }
    }

    boolean generatePage(String pageId, String fallbackRef, Integer feedbackRound) {
        try {
            PageEntity page = artifactStore.requirePage(pageId);
            String prompt = promptBuilder.pageIllustration(page);
            String anchor = page.getOriginalIllustrationUrl() != null ? page.getOriginalIllustrationUrl() : fallbackRef;
            List<String> refs = anchor == null ? List.of() : List.of(anchor);
            GenerationResult result = generationClient.generate(GenerationKind.PAGE_ILLUSTRATION, refs, prompt);
            artifactStore.recordPageIllustration(pageId, result, feedbackRound);
            if (result instanceof GenerationResult.Success success) {
                chainPageSketch(page, success.ref());
                return true;
            }
            log.warn("Illustration generation failed for page {}: {}",
                    pageId, ((GenerationResult.Failure) result).error());
            return false;
        } catch (Exception e) {
            log.error("Illustration generation threw for page {}", pageId, e);
            recordQuietly(() -> artifactStore.recordPageIllustration(
                    pageId, GenerationResult.failure(e.getMessage()), null));
            return false;
        }
    }

    // Detached: the batch does not wait for sketches and their failures stay on the sketch slot.
    private void chainCharacterSketch(CharacterEntity character, String portraitRef) {
        String characterId = character.getId();
        String prompt = promptBuilder.characterSketch(character);
        try {
            followUpExecutor.execute(RequestCorrelation.propagate(() -> {
                try {
                    artifactStore.markCharacterSketchGenerating(characterId);
                    GenerationResult result = generationClient.generate(
                            GenerationKind.CHARACTER_SKETCH, List.of(portraitRef), prompt);
                    artifactStore.recordCharacterSketch(characterId, result);
                } catch (Exception e) {
                    log.warn("Sketch generation failed for character {}", characterId, e);
                    recordQuietly(() -> artifactStore.recordCharacterSketch(
                            characterId, GenerationResult.failure(e.getMessage())));
                }
            }));
        } catch (RejectedExecutionException e) {
            log.warn("Skipped sketch for character {}: sketch queue is full", characterId);
        }
    }

    private void chainPageSketch(PageEntity page, String illustrationRef) {
        String pageId = page.getId();
        String prompt = promptBuilder.pageSketch(page);
        try {
            followUpExecutor.execute(RequestCorrelation.propagate(() -> {
                try {
                    artifactStore.markPageSketchGenerating(pageId);
                    GenerationResult result = generationClient.generate(
                            GenerationKind.PAGE_SKETCH, List.of(illustrationRef), prompt);
                    artifactStore.recordPageSketch(pageId, result);
                } catch (Exception e) {
                    log.warn("Sketch generation failed for page {}", pageId, e);
                    recordQuietly(() -> artifactStore.recordPageSketch(
                            pageId, GenerationResult.failure(e.getMessage())));
                }
            }));
        } catch (RejectedExecutionException e) {
            log.warn("Skipped sketch for page {}: sketch queue is full", pageId);
        }
    }

    /**
     * Nothing to generate: a project parked in generation or after a failed batch has in fact
     * finished, so it moves to complete. Any other status is left alone.
     */
    private ProjectStatus completeEmptyBatch(String projectId, ProjectStatus status) {
        if (status == ProjectStatus.CHARACTER_GENERATION_FAILED) {
            artifactStore.applyEvent(projectId, WorkflowEvent.START_CHARACTER_GENERATION);
            return artifactStore.applyEvent(projectId, WorkflowEvent.CHARACTER_BATCH_SUCCEEDED);
        }
        if (status == ProjectStatus.CHARACTER_GENERATION
                && !inFlight.contains(batchKey(projectId, GenerationScope.Kind.CHARACTERS))) {
            return artifactStore.applyEvent(projectId, WorkflowEvent.CHARACTER_BATCH_SUCCEEDED);
        }
        return status;
    }

    private void notifyBatch(NotificationEvent event, String projectId, BatchOutcome outcome, ProjectStatus status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("projectId", projectId);
        payload.put("generated", outcome.succeeded());
        payload.put("failed", outcome.failed());
        payload.put("status", status.value());
        notificationGateway.notify(event, payload);
    }

    private void recordQuietly(Runnable write) {
        try {
            write.run();
        } catch (Exception e) {
            log.error("Could not record generation failure", e);
        }
    }

    private static String batchKey(String projectId, GenerationScope.Kind kind) {
        return projectId + ":" + kind;
    }

    record BatchOutcome(int succeeded, int failed) {
        boolean allSucceeded() {
            return failed == 0;
        }
    }
}
