package org.example.studio.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Live feedback, its archived history and the admin/customer exchange on top of it.
 * Shared by characters and pages; mutated through {@code FeedbackLedger}.
 */
@Embeddable
public class FeedbackState {

    @Column(length = 4000)
    private String feedbackNotes;

    @Convert(converter = FeedbackHistoryJsonConverter.class)
    @Column(length = 100000)
    private List<FeedbackHistoryEntry> feedbackHistory = new ArrayList<>();

    @Column(nullable = false)
    private boolean resolved;

    @Column(length = 4000)
    private String adminReply;

    private LocalDateTime adminReplyAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private AdminReplyType adminReplyType;

    @Convert(converter = ConversationThreadJsonConverter.class)
    @Column(length = 100000)
    private List<ConversationMessage> conversationThread = new ArrayList<>();

    public FeedbackState() {}

    public boolean hasOpenFeedback() {
        return feedbackNotes != null && !feedbackNotes.isBlank() && !resolved;
    }

    public boolean hasAdminReply() {
        return adminReply != null && !adminReply.isBlank();
    }

    public String getFeedbackNotes() { return feedbackNotes; }
    public void setFeedbackNotes(String feedbackNotes) { this.feedbackNotes = feedbackNotes; }

    /**
     * History is append-only; the returned view cannot be modified.
     */
    public List<FeedbackHistoryEntry> getFeedbackHistory() {
        return feedbackHistory == null ? List.of() : Collections.unmodifiableList(feedbackHistory);
    }

    public void appendHistory(FeedbackHistoryEntry entry) {
        List<FeedbackHistoryEntry> next = feedbackHistory == null ? new ArrayList<>() : new ArrayList<>(feedbackHistory);
        next.add(entry);
        // new list instance so the JSON column is detected as dirty
        this.feedbackHistory = next;
    }

    public boolean isResolved() { return resolved; }
    public void setResolved(boolean resolved) { this.resolved = resolved; }

    public String getAdminReply() { return adminReply; }
    public LocalDateTime getAdminReplyAt() { return adminReplyAt; }
    public AdminReplyType getAdminReplyType() { return adminReplyType; }

    public void setAdminReply(String adminReply, LocalDateTime at, AdminReplyType type) {
        this.adminReply = adminReply;
        this.adminReplyAt = at;
        this.adminReplyType = type;
    }

    public void retypeAdminReply(AdminReplyType type) {
        this.adminReplyType = type;
    }

    public void clearAdminReply() {
        this.adminReply = null;
        this.adminReplyAt = null;
        this.adminReplyType = null;
    }

    public List<ConversationMessage> getConversationThread() {
        return conversationThread == null ? List.of() : Collections.unmodifiableList(conversationThread);
    }

    public void appendToThread(ConversationMessage message) {
        List<ConversationMessage> next = conversationThread == null ? new ArrayList<>() : new ArrayList<>(conversationThread);
        next.add(message);
        this.conversationThread = next;
    }

    public void clearThread() {
        this.conversationThread = new ArrayList<>();
    }
}
