package org.example.studio.entity;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.List;

/**
 * An archived feedback note. Entries are immutable once written.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeedbackHistoryEntry(
        String note,
        LocalDateTime createdAt,
        Integer revisionRound,
        List<ConversationMessage> conversationThread
) {
    public FeedbackHistoryEntry {
        conversationThread = (conversationThread == null || conversationThread.isEmpty())
                ? null
                : List.copyOf(conversationThread);
    }
}
