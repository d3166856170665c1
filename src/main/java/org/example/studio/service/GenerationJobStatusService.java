package org.example.studio.service;

import org.example.studio.entity.ArtifactStatus;
import org.example.studio.entity.ProjectEntity;
import org.example.studio.model.GenerationJobStatusResponse;
import org.example.studio.model.GenerationPipelineStatus;
import org.example.studio.repository.CharacterRepository;
import org.example.studio.repository.PageRepository;
import org.example.studio.repository.ProjectRepository;
import org.example.studio.workflow.NotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Service
public class GenerationJobStatusService {

    private final ProjectRepository projectRepository;
    private final CharacterRepository characterRepository;
    private final PageRepository pageRepository;
    private final GenerationDispatchService generationDispatchService;

    public GenerationJobStatusService(
            ProjectRepository projectRepository,
            CharacterRepository characterRepository,
            PageRepository pageRepository,
            GenerationDispatchService generationDispatchService) {
        this.projectRepository = projectRepository;
        this.characterRepository = characterRepository;
        this.pageRepository = pageRepository;
        this.generationDispatchService = generationDispatchService;
    }

    @Transactional(readOnly = true)
    public GenerationJobStatusResponse getProjectStatus(String projectId) {
        ProjectEntity project = projectRepository.findById(projectId)
                .orElseThrow(() -> NotFoundException.of("Project", projectId));
        GenerationPipelineStatus characters = characterStatus(projectId);
        GenerationPipelineStatus pages = pageStatus(projectId);

        return new GenerationJobStatusResponse(
                projectId,
                project.getStatus(),
                generationDispatchService.isBatchInFlight(projectId),
                LocalDateTime.now(),
                characters,
                pages,
                sum(characters, pages)
        );
    }

    private GenerationPipelineStatus characterStatus(String projectId) {
        return GenerationPipelineStatus.of(
                characterRepository.countSecondaryByProjectAndImageStatus(projectId, ArtifactStatus.NOT_STARTED)
                        + characterRepository.countSecondaryByProjectWithoutImageStatus(projectId),
                characterRepository.countSecondaryByProjectAndImageStatus(projectId, ArtifactStatus.GENERATING),
                characterRepository.countSecondaryByProjectAndImageStatus(projectId, ArtifactStatus.READY),
                characterRepository.countSecondaryByProjectAndImageStatus(projectId, ArtifactStatus.FAILED)
        );
    }

    private GenerationPipelineStatus pageStatus(String projectId) {
        return GenerationPipelineStatus.of(
                pageRepository.countByProjectAndIllustrationStatus(projectId, ArtifactStatus.NOT_STARTED)
                        + pageRepository.countByProjectWithoutIllustrationStatus(projectId),
                pageRepository.countByProjectAndIllustrationStatus(projectId, ArtifactStatus.GENERATING),
                pageRepository.countByProjectAndIllustrationStatus(projectId, ArtifactStatus.READY),
                pageRepository.countByProjectAndIllustrationStatus(projectId, ArtifactStatus.FAILED)
        );
    }

    private GenerationPipelineStatus sum(GenerationPipelineStatus... statuses) {
        long notStarted = 0L;
        long generating = 0L;
        long ready = 0L;
        long failed = 0L;
        for (GenerationPipelineStatus status : statuses) {
            notStarted += status.notStarted();
            generating += status.generating();
            ready += status.ready();
            failed += status.failed();
        }
        return GenerationPipelineStatus.of(notStarted, generating, ready, failed);
    }
}
