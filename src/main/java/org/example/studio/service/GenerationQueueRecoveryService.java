package org.example.studio.service;

import org.example.studio.entity.ArtifactStatus;
import org.example.studio.entity.CharacterEntity;
import org.example.studio.entity.GeneratedArtifact;
import org.example.studio.entity.PageEntity;
import org.example.studio.entity.ProjectEntity;
import org.example.studio.entity.ProjectStatus;
import org.example.studio.repository.CharacterRepository;
import org.example.studio.repository.PageRepository;
import org.example.studio.repository.ProjectRepository;
import org.example.studio.workflow.ProjectStatusMachine;
import org.example.studio.workflow.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Batches live only in memory, so anything still marked as generating at startup was cut off
 * by a restart. Those slots become failures and parked projects become retryable.
 */
@Service
public class GenerationQueueRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(GenerationQueueRecoveryService.class);

    static final String INTERRUPTED_MESSAGE = "Generation interrupted by a restart";

    private final ProjectRepository projectRepository;
    private final CharacterRepository characterRepository;
    private final PageRepository pageRepository;
    private final boolean recoveryEnabled;

    public GenerationQueueRecoveryService(
            ProjectRepository projectRepository,
            CharacterRepository characterRepository,
            PageRepository pageRepository,
            @Value("${generation.queue.recovery.enabled:true}") boolean recoveryEnabled) {
        this.projectRepository = projectRepository;
        this.characterRepository = characterRepository;
        this.pageRepository = pageRepository;
        this.recoveryEnabled = recoveryEnabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void recoverOnStartup() {
        recoverInterruptedGeneration();
    }

    RecoverySummary recoverInterruptedGeneration() {
        if (!recoveryEnabled) {
            log.info("Generation queue recovery is disabled");
            return new RecoverySummary(0, 0, 0);
        }

        int charactersFailed = 0;
        for (CharacterEntity character : characterRepository.findWithAnyArtifactInStatus(ArtifactStatus.GENERATING)) {
            boolean changed = failIfGenerating(character.getImage());
            changed |= failIfGenerating(character.getSketch());
            if (changed) {
                characterRepository.save(character);
                charactersFailed++;
            }
        }

        int pagesFailed = 0;
        for (PageEntity page : pageRepository.findWithAnyArtifactInStatus(ArtifactStatus.GENERATING)) {
            boolean changed = failIfGenerating(page.getIllustration());
            changed |= failIfGenerating(page.getSketch());
            if (changed) {
                pageRepository.save(page);
                pagesFailed++;
            }
        }

        List<ProjectEntity> stuck = projectRepository.findByStatus(ProjectStatus.CHARACTER_GENERATION);
        for (ProjectEntity project : stuck) {
            project.setStatus(ProjectStatusMachine.transition(project.getStatus(), WorkflowEvent.CHARACTER_BATCH_FAILED));
            projectRepository.save(project);
        }

        RecoverySummary summary = new RecoverySummary(charactersFailed, pagesFailed, stuck.size());
        log.info(
                "Recovered interrupted generation: characters={}, pages={}, projectsParked={}",
                summary.charactersFailed(),
                summary.pagesFailed(),
                summary.projectsParked()
        );
        return summary;
    }

    private static boolean failIfGenerating(GeneratedArtifact artifact) {
        if (artifact.getStatus() == ArtifactStatus.GENERATING) {
            artifact.markFailed(INTERRUPTED_MESSAGE);
            return true;
        }
        return false;
    }

    record RecoverySummary(int charactersFailed, int pagesFailed, int projectsParked) {
    }
}
