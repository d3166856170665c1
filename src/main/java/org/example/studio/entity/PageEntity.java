package org.example.studio.entity;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "pages", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"project_id", "page_number"})
})
public class PageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "project_id", nullable = false)
    private ProjectEntity project;

    @Column(name = "page_number", nullable = false)
    private int pageNumber;

    @Column(length = 8000)
    private String storyText;

    @Column(length = 4000)
    private String sceneDescription;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "status", column = @Column(name = "illustration_status", length = 20)),
        @AttributeOverride(name = "url", column = @Column(name = "illustration_url", length = 1000)),
        @AttributeOverride(name = "errorMessage", column = @Column(name = "illustration_error", length = 1000)),
        @AttributeOverride(name = "updatedAt", column = @Column(name = "illustration_updated_at"))
    })
    private GeneratedArtifact illustration = new GeneratedArtifact();

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "status", column = @Column(name = "sketch_status", length = 20)),
        @AttributeOverride(name = "url", column = @Column(name = "sketch_url", length = 1000)),
        @AttributeOverride(name = "errorMessage", column = @Column(name = "sketch_error", length = 1000)),
        @AttributeOverride(name = "updatedAt", column = @Column(name = "sketch_updated_at"))
    })
    private GeneratedArtifact sketch = new GeneratedArtifact();

    @Column(length = 1000)
    private String originalIllustrationUrl;

    @Embedded
    private FeedbackState feedback = new FeedbackState();

    @Column(nullable = false)
    private LocalDateTime createdAt;

    public PageEntity() {}

    public PageEntity(ProjectEntity project, int pageNumber, String storyText) {
        this.project = project;
        this.pageNumber = pageNumber;
        this.storyText = storyText;
        this.createdAt = LocalDateTime.now();
    }

    public boolean isPendingGeneration() {
        return getIllustration().needsGeneration();
    }

    @PostLoad
    void upgradeLegacySlots() {
        illustration = GeneratedArtifact.upgradeLegacy(illustration);
        sketch = GeneratedArtifact.upgradeLegacy(sketch);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public ProjectEntity getProject() { return project; }
    public void setProject(ProjectEntity project) { this.project = project; }

    public int getPageNumber() { return pageNumber; }
    public void setPageNumber(int pageNumber) { this.pageNumber = pageNumber; }

    public String getStoryText() { return storyText; }
    public void setStoryText(String storyText) { this.storyText = storyText; }

    public String getSceneDescription() { return sceneDescription; }
    public void setSceneDescription(String sceneDescription) { this.sceneDescription = sceneDescription; }

    public GeneratedArtifact getIllustration() {
        if (illustration == null) {
            illustration = new GeneratedArtifact();
        }
        return illustration;
    }

    public GeneratedArtifact getSketch() {
        if (sketch == null) {
            sketch = new GeneratedArtifact();
        }
        return sketch;
    }

    public String getOriginalIllustrationUrl() { return originalIllustrationUrl; }

    /**
     * Write-once: only the first successful illustration is kept as the original.
     */
    public void setOriginalIllustrationUrl(String originalIllustrationUrl) {
        if (this.originalIllustrationUrl == null || this.originalIllustrationUrl.isBlank()) {
            this.originalIllustrationUrl = originalIllustrationUrl;
        }
    }

    public FeedbackState getFeedback() {
        if (feedback == null) {
            feedback = new FeedbackState();
        }
        return feedback;
    }

    public LocalDateTime getCreatedAt() { return createdAt; }
}
