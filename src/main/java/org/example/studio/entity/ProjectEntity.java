package org.example.studio.entity;

import jakarta.persistence.*;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.HexFormat;

@Entity
@Table(name = "projects", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"review_token"})
})
public class ProjectEntity {

    private static final SecureRandom TOKEN_RANDOM = new SecureRandom();

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "review_token", nullable = false, length = 64)
    private String reviewToken;

    @Column(nullable = false)
    private String bookTitle;

    private String authorFirstname;

    private String authorLastname;

    private String authorEmail;

    @Column(length = 40)
    private String authorPhone;

    @Column(nullable = false, length = 60)
    private ProjectStatus status;

    @Column(nullable = false, columnDefinition = "integer default 0")
    private int characterSendCount;

    @Column(nullable = false, columnDefinition = "integer default 0")
    private int illustrationSendCount;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public ProjectEntity() {}

    public ProjectEntity(String bookTitle) {
        this.bookTitle = bookTitle;
        this.status = ProjectStatus.DRAFT;
        this.reviewToken = newReviewToken();
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    static String newReviewToken() {
        byte[] bytes = new byte[16];
        TOKEN_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    @PreUpdate
    void touch() {
        this.updatedAt = LocalDateTime.now();
    }

    public int incrementCharacterSendCount() {
        return ++characterSendCount;
    }

    public int incrementIllustrationSendCount() {
        return ++illustrationSendCount;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getReviewToken() { return reviewToken; }

    public String getBookTitle() { return bookTitle; }
    public void setBookTitle(String bookTitle) { this.bookTitle = bookTitle; }

    public String getAuthorFirstname() { return authorFirstname; }
    public void setAuthorFirstname(String authorFirstname) { this.authorFirstname = authorFirstname; }

    public String getAuthorLastname() { return authorLastname; }
    public void setAuthorLastname(String authorLastname) { this.authorLastname = authorLastname; }

    public String getAuthorEmail() { return authorEmail; }
    public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }

    public String getAuthorPhone() { return authorPhone; }
    public void setAuthorPhone(String authorPhone) { this.authorPhone = authorPhone; }

    public ProjectStatus getStatus() { return status; }
    public void setStatus(ProjectStatus status) { this.status = status; }

    public int getCharacterSendCount() { return characterSendCount; }

    public void setCharacterSendCount(int characterSendCount) {
        // counters only move forward
        this.characterSendCount = Math.max(this.characterSendCount, characterSendCount);
    }

    public int getIllustrationSendCount() { return illustrationSendCount; }

    public void setIllustrationSendCount(int illustrationSendCount) {
        this.illustrationSendCount = Math.max(this.illustrationSendCount, illustrationSendCount);
    }

    public LocalDateTime getCreatedAt() { return createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
