package org.example.studio.workflow;

import org.example.studio.entity.AdminReplyType;
import org.example.studio.entity.ConversationMessage;
import org.example.studio.entity.FeedbackHistoryEntry;
import org.example.studio.entity.FeedbackState;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Operations on an item's {@link FeedbackState}. History entries are only ever appended, and
 * an item marked resolved never keeps live feedback notes.
 *
 * <p>Each operation returns {@code true} when it changed the state, so callers know whether
 * the owning entity needs to be saved.
 */
public final class FeedbackLedger {

    private FeedbackLedger() {
    }

    /**
     * Archive open feedback after the artifact was regenerated. The admin reply and the thread
     * go with it; nothing is left on the item.
     */
    public static boolean resolveByRegeneration(FeedbackState state, Integer revisionRound) {
        if (!hasNote(state)) {
            return false;
        }
        archive(state, revisionRound, state.getConversationThread());
        state.setFeedbackNotes(null);
        state.clearAdminReply();
        state.clearThread();
        state.setResolved(true);
        return true;
    }

    /**
     * Resolve without regenerating. An admin reply is written into the archived thread and also
     * stays on the item as a {@link AdminReplyType#COMMENT}.
     */
    public static boolean resolveManually(FeedbackState state, Integer revisionRound) {
        if (!hasNote(state)) {
            return false;
        }
        List<ConversationMessage> thread = new ArrayList<>(state.getConversationThread());
        if (state.hasAdminReply()) {
            thread.add(ConversationMessage.admin(state.getAdminReply(), replyTime(state)));
            state.retypeAdminReply(AdminReplyType.COMMENT);
        }
        archive(state, revisionRound, thread);
        state.setFeedbackNotes(null);
        state.clearThread();
        state.setResolved(true);
        return true;
    }

    /**
     * Customer answers the admin's reply. The original request stays untouched; the exchange
     * moves into the thread and the reply slot is freed for the next answer.
     *
     * @throws ValidationException if the text is blank or there is no reply to answer
     */
    public static boolean appendFollowUp(FeedbackState state, String text) {
        String followUp = requireText(text, "Follow-up text is required");
        if (!state.hasOpenFeedback()) {
            throw new ValidationException("There is no open feedback to follow up on");
        }
        if (!state.hasAdminReply() || state.getAdminReplyType() != AdminReplyType.REPLY) {
            throw new ValidationException("There is no admin reply to follow up on");
        }
        state.appendToThread(ConversationMessage.admin(state.getAdminReply(), replyTime(state)));
        state.appendToThread(ConversationMessage.customer(followUp, LocalDateTime.now()));
        state.clearAdminReply();
        return true;
    }

    /**
     * Install a customer request. Editing a note that is still open rewrites it in place; the
     * reply and thread stay with it. A new request after resolution starts a clean exchange.
     *
     * @throws ValidationException if the text is blank
     */
    public static boolean replaceRequest(FeedbackState state, String text, Integer revisionRound) {
        String note = requireText(text, "Feedback text is required");
        if (state.hasOpenFeedback()) {
            if (note.equals(state.getFeedbackNotes().trim())) {
                return false;
            }
            state.setFeedbackNotes(note);
            return true;
        }
        // rows written before resolution cleared the note
        if (hasNote(state)) {
            archive(state, revisionRound, state.getConversationThread());
        }
        state.clearAdminReply();
        state.clearThread();
        state.setFeedbackNotes(note);
        state.setResolved(false);
        return true;
    }

    /**
     * Customer accepts the admin's reply instead of asking for a change.
     *
     * @throws ValidationException if there is no open reply to accept
     */
    public static boolean acceptReply(FeedbackState state, Integer revisionRound) {
        if (!state.hasOpenFeedback()) {
            throw new ValidationException("There is no open feedback to accept");
        }
        if (!state.hasAdminReply() || state.getAdminReplyType() != AdminReplyType.REPLY) {
            throw new ValidationException("There is no admin reply to accept");
        }
        List<ConversationMessage> thread = new ArrayList<>(state.getConversationThread());
        thread.add(ConversationMessage.admin(state.getAdminReply(), replyTime(state)));
        archive(state, revisionRound, thread);
        state.setFeedbackNotes(null);
        state.clearAdminReply();
        state.clearThread();
        state.setResolved(true);
        return true;
    }

    /**
     * @throws ValidationException if the text is blank or the item has no open feedback
     */
    public static boolean replyAsAdmin(FeedbackState state, String text) {
        String reply = requireText(text, "Reply text is required");
        if (!state.hasOpenFeedback()) {
            throw new ValidationException("There is no open feedback to reply to");
        }
        state.setAdminReply(reply, LocalDateTime.now(), AdminReplyType.REPLY);
        return true;
    }

    public static boolean hasUnresolvedFeedback(Collection<FeedbackState> states) {
        if (states == null || states.isEmpty()) {
            return false;
        }
        return states.stream().anyMatch(FeedbackState::hasOpenFeedback);
    }

    private static void archive(FeedbackState state, Integer revisionRound, List<ConversationMessage> thread) {
        state.appendHistory(new FeedbackHistoryEntry(
                state.getFeedbackNotes(),
                LocalDateTime.now(),
                revisionRound,
                thread
        ));
    }

    private static boolean hasNote(FeedbackState state) {
        return state.getFeedbackNotes() != null && !state.getFeedbackNotes().isBlank();
    }

    private static LocalDateTime replyTime(FeedbackState state) {
        return state.getAdminReplyAt() != null ? state.getAdminReplyAt() : LocalDateTime.now();
    }

    private static String requireText(String text, String message) {
        if (text == null || text.isBlank()) {
            throw new ValidationException(message);
        }
        return text.trim();
    }
}
