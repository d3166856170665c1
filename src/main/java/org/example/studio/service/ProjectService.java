package org.example.studio.service;

import org.example.studio.entity.CharacterEntity;
import org.example.studio.entity.PageEntity;
import org.example.studio.entity.ProjectEntity;
import org.example.studio.entity.ProjectStatus;
import org.example.studio.model.CharacterView;
import org.example.studio.model.PageView;
import org.example.studio.model.ProjectView;
import org.example.studio.model.ReviewView;
import org.example.studio.model.WorkflowRequests.CharacterDetails;
import org.example.studio.model.WorkflowRequests.CreateProject;
import org.example.studio.model.WorkflowRequests.PageDetails;
import org.example.studio.repository.CharacterRepository;
import org.example.studio.repository.PageRepository;
import org.example.studio.repository.ProjectRepository;
import org.example.studio.workflow.InvalidTransitionException;
import org.example.studio.workflow.NotFoundException;
import org.example.studio.workflow.ValidationException;
import org.example.studio.workflow.WorkflowEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Project setup: projects, their characters and their pages. The main character is created
 * with the project, cannot be removed, and keeps its description for the life of the project.
 */
@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;
    private final CharacterRepository characterRepository;
    private final PageRepository pageRepository;

    public ProjectService(
            ProjectRepository projectRepository,
            CharacterRepository characterRepository,
            PageRepository pageRepository) {
        this.projectRepository = projectRepository;
        this.characterRepository = characterRepository;
        this.pageRepository = pageRepository;
    }

    @Transactional
    public ProjectView createProject(CreateProject request) {
        if (request == null || isBlank(request.bookTitle())) {
            throw new ValidationException("Book title is required");
        }
        if (request.mainCharacter() == null || isBlank(request.mainCharacter().name())) {
            throw new ValidationException("Main character name is required");
        }
        ProjectEntity project = new ProjectEntity(request.bookTitle().trim());
        project.setAuthorFirstname(request.authorFirstname());
        project.setAuthorLastname(request.authorLastname());
        project.setAuthorEmail(request.authorEmail());
        project.setAuthorPhone(request.authorPhone());
        project = projectRepository.save(project);

        CharacterEntity main = new CharacterEntity(project, request.mainCharacter().name().trim(), true);
        applyDetails(main, request.mainCharacter());
        if (!isBlank(request.mainCharacter().imageUrl())) {
            main.getImage().markReady(request.mainCharacter().imageUrl().trim());
        }
        characterRepository.save(main);
        log.info("Created project {} for '{}'", project.getId(), project.getBookTitle());
        return view(project);
    }

    @Transactional(readOnly = true)
    public List<ProjectView> listProjects() {
        return projectRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(ProjectView::summary)
                .toList();
    }

    @Transactional(readOnly = true)
    public ProjectView getProject(String projectId) {
        return view(requireProject(projectId));
    }

    @Transactional(readOnly = true)
    public ReviewView getReview(String reviewToken) {
        ProjectEntity project = projectRepository.findByReviewToken(reviewToken)
                .orElseThrow(() -> new NotFoundException("Review link not found"));
        return ReviewView.from(view(project));
    }

    @Transactional
    public CharacterView addCharacter(String projectId, CharacterDetails details) {
        ProjectEntity project = requireProject(projectId);
        requireCharacterSetupOpen(project);
        if (details == null || isBlank(details.name())) {
            throw new ValidationException("Character name is required");
        }
        CharacterEntity character = new CharacterEntity(project, details.name().trim(), false);
        applyDetails(character, details);
        if (!isBlank(details.imageUrl())) {
            character.getImage().markReady(details.imageUrl().trim());
        }
        return CharacterView.from(characterRepository.save(character));
    }

    @Transactional
    public CharacterView updateCharacter(String characterId, CharacterDetails details) {
        CharacterEntity character = requireCharacter(characterId);
        if (character.isMain()) {
            throw new ValidationException("The main character's description cannot be changed");
        }
        requireCharacterSetupOpen(character.getProject());
        if (details == null) {
            throw new ValidationException("Character details are required");
        }
        if (!isBlank(details.name())) {
            character.setName(details.name().trim());
        }
        applyDetails(character, details);
        return CharacterView.from(characterRepository.save(character));
    }

    /**
     * Attach an image supplied by the admin or customer, typically the main character's photo.
     */
    @Transactional
    public CharacterView setCharacterImage(String characterId, String url) {
        if (isBlank(url)) {
            throw new ValidationException("Image URL is required");
        }
        CharacterEntity character = requireCharacter(characterId);
        character.getImage().markReady(url.trim());
        return CharacterView.from(characterRepository.save(character));
    }

    @Transactional
    public void deleteCharacter(String characterId) {
        CharacterEntity character = requireCharacter(characterId);
        if (character.isMain()) {
            throw new ValidationException("The main character cannot be deleted");
        }
        requireCharacterSetupOpen(character.getProject());
        characterRepository.delete(character);
        log.info("Deleted character {} from project {}", characterId, character.getProject().getId());
    }

    /**
     * Create or update pages by page number.
     */
    @Transactional
    public List<PageView> upsertPages(String projectId, List<PageDetails> pages) {
        ProjectEntity project = requireProject(projectId);
        if (pages == null || pages.isEmpty()) {
            throw new ValidationException("At least one page is required");
        }
        Set<Integer> seen = new HashSet<>();
        for (PageDetails details : pages) {
            if (details.pageNumber() < 1) {
                throw new ValidationException("Page numbers start at 1");
            }
            if (!seen.add(details.pageNumber())) {
                throw new ValidationException("Duplicate page number " + details.pageNumber());
            }
        }
        for (PageDetails details : pages) {
            PageEntity page = pageRepository.findByProjectIdAndPageNumber(projectId, details.pageNumber())
                    .orElseGet(() -> new PageEntity(project, details.pageNumber(), null));
            page.setStoryText(details.storyText());
            page.setSceneDescription(details.sceneDescription());
            pageRepository.save(page);
        }
        return pageRepository.findByProjectIdOrderByPageNumber(projectId).stream()
                .map(PageView::from)
                .toList();
    }

    private ProjectView view(ProjectEntity project) {
        List<CharacterView> characters = characterRepository.findByProjectIdOrderByCreatedAt(project.getId()).stream()
                .map(CharacterView::from)
                .toList();
        List<PageView> pages = pageRepository.findByProjectIdOrderByPageNumber(project.getId()).stream()
                .map(PageView::from)
                .toList();
        return ProjectView.of(project, characters, pages);
    }

    private void requireCharacterSetupOpen(ProjectEntity project) {
        ProjectStatus status = project.getStatus();
        if (!status.isCharacterPhase() || status == ProjectStatus.CHARACTER_GENERATION) {
            throw new InvalidTransitionException(status, WorkflowEvent.SEND_CHARACTERS_TO_CUSTOMER,
                    "Characters cannot be changed while project is " + status);
        }
    }

    private ProjectEntity requireProject(String projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> NotFoundException.of("Project", projectId));
    }

    private CharacterEntity requireCharacter(String characterId) {
        return characterRepository.findByIdWithProject(characterId)
                .orElseThrow(() -> NotFoundException.of("Character", characterId));
    }

    private static void applyDetails(CharacterEntity character, CharacterDetails details) {
        character.setRole(details.role());
        character.setStoryRole(details.storyRole());
        character.setAge(details.age());
        character.setGender(details.gender());
        character.setSkinColor(details.skinColor());
        character.setHairColor(details.hairColor());
        character.setHairStyle(details.hairStyle());
        character.setEyeColor(details.eyeColor());
        character.setClothing(details.clothing());
        character.setAccessories(details.accessories());
        character.setSpecialFeatures(details.specialFeatures());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
