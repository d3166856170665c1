package org.example.studio.model;

import org.example.studio.entity.AdminReplyType;
import org.example.studio.entity.ConversationMessage;
import org.example.studio.entity.FeedbackHistoryEntry;
import org.example.studio.entity.FeedbackState;

import java.time.LocalDateTime;
import java.util.List;

public record FeedbackView(
        String feedbackNotes,
        boolean resolved,
        String adminReply,
        AdminReplyType adminReplyType,
        LocalDateTime adminReplyAt,
        List<ConversationMessage> conversationThread,
        List<FeedbackHistoryEntry> feedbackHistory
) {
    public static FeedbackView from(FeedbackState state) {
        return new FeedbackView(
                state.getFeedbackNotes(),
                state.isResolved(),
                state.getAdminReply(),
                state.getAdminReplyType(),
                state.getAdminReplyAt(),
                List.copyOf(state.getConversationThread()),
                List.copyOf(state.getFeedbackHistory())
        );
    }
}
