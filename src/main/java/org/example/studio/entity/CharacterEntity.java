package org.example.studio.entity;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "characters")
public class CharacterEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "project_id", nullable = false)
    private ProjectEntity project;

    @Column(nullable = false)
    private String name;

    private String role;

    @Column(length = 1000)
    private String storyRole;

    @Column(length = 40)
    private String age;

    @Column(length = 40)
    private String gender;

    @Column(length = 80)
    private String skinColor;

    @Column(length = 80)
    private String hairColor;

    @Column(length = 120)
    private String hairStyle;

    @Column(length = 80)
    private String eyeColor;

    @Column(length = 1000)
    private String clothing;

    @Column(length = 1000)
    private String accessories;

    @Column(length = 1000)
    private String specialFeatures;

    @Column(name = "is_main", nullable = false)
    private boolean main;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "status", column = @Column(name = "image_status", length = 20)),
        @AttributeOverride(name = "url", column = @Column(name = "image_url", length = 1000)),
        @AttributeOverride(name = "errorMessage", column = @Column(name = "image_error", length = 1000)),
        @AttributeOverride(name = "updatedAt", column = @Column(name = "image_updated_at"))
    })
    private GeneratedArtifact image = new GeneratedArtifact();

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "status", column = @Column(name = "sketch_status", length = 20)),
        @AttributeOverride(name = "url", column = @Column(name = "sketch_url", length = 1000)),
        @AttributeOverride(name = "errorMessage", column = @Column(name = "sketch_error", length = 1000)),
        @AttributeOverride(name = "updatedAt", column = @Column(name = "sketch_updated_at"))
    })
    private GeneratedArtifact sketch = new GeneratedArtifact();

    @Column(length = 4000)
    private String generationPrompt;

    @Embedded
    private FeedbackState feedback = new FeedbackState();

    @Column(nullable = false)
    private LocalDateTime createdAt;

    public CharacterEntity() {}

    public CharacterEntity(ProjectEntity project, String name, boolean main) {
        this.project = project;
        this.name = name;
        this.main = main;
        this.createdAt = LocalDateTime.now();
    }

    /**
     * Characters waiting for a first image, or whose last attempt failed. The main character
     * is supplied by the customer and never generated.
     */
    public boolean isPendingGeneration() {
        return !main && getImage().needsGeneration();
    }

    @PostLoad
    void upgradeLegacySlots() {
        image = GeneratedArtifact.upgradeLegacy(image);
        sketch = GeneratedArtifact.upgradeLegacy(sketch);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public ProjectEntity getProject() { return project; }
    public void setProject(ProjectEntity project) { this.project = project; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public String getStoryRole() { return storyRole; }
    public void setStoryRole(String storyRole) { this.storyRole = storyRole; }

    public String getAge() { return age; }
    public void setAge(String age) { this.age = age; }

    public String getGender() { return gender; }
    public void setGender(String gender) { this.gender = gender; }

    public String getSkinColor() { return skinColor; }
    public void setSkinColor(String skinColor) { this.skinColor = skinColor; }

    public String getHairColor() { return hairColor; }
    public void setHairColor(String hairColor) { this.hairColor = hairColor; }

    public String getHairStyle() { return hairStyle; }
    public void setHairStyle(String hairStyle) { this.hairStyle = hairStyle; }

    public String getEyeColor() { return eyeColor; }
    public void setEyeColor(String eyeColor) { this.eyeColor = eyeColor; }

    public String getClothing() { return clothing; }
    public void setClothing(String clothing) { this.clothing = clothing; }

    public String getAccessories() { return accessories; }
    public void setAccessories(String accessories) { this.accessories = accessories; }

    public String getSpecialFeatures() { return specialFeatures; }
    public void setSpecialFeatures(String specialFeatures) { this.specialFeatures = specialFeatures; }

    public boolean isMain() { return main; }

    // Hibernate leaves an embedded value null when all of its columns are null
    public GeneratedArtifact getImage() {
        if (image == null) {
            image = new GeneratedArtifact();
        }
        return image;
    }

    public GeneratedArtifact getSketch() {
        if (sketch == null) {
            sketch = new GeneratedArtifact();
        }
        return sketch;
    }

    public String getGenerationPrompt() { return generationPrompt; }
    public void setGenerationPrompt(String generationPrompt) { this.generationPrompt = generationPrompt; }

    public FeedbackState getFeedback() {
        if (feedback == null) {
            feedback = new FeedbackState();
        }
        return feedback;
    }

    public LocalDateTime getCreatedAt() { return createdAt; }
}
