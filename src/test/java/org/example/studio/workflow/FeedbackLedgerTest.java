package org.example.studio.workflow;

import org.example.studio.entity.AdminReplyType;
import org.example.studio.entity.ConversationMessage;
import org.example.studio.entity.FeedbackHistoryEntry;
import org.example.studio.entity.FeedbackState;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedbackLedgerTest {

    @Test
    void resolveManually_withAdminReply_archivesNoteAndKeepsReplyAsComment() {
        FeedbackState state = openFeedback("fix hat color");
        LocalDateTime repliedAt = LocalDateTime.of(2026, 3, 1, 10, 0);
        state.setAdminReply("We'll use red", repliedAt, AdminReplyType.REPLY);

        assertTrue(FeedbackLedger.resolveManually(state, 2));

        assertTrue(state.isResolved());
        assertFalse(state.hasOpenFeedback());
        assertNull(state.getFeedbackNotes());
        assertEquals("We'll use red", state.getAdminReply());
        assertEquals(AdminReplyType.COMMENT, state.getAdminReplyType());

        FeedbackHistoryEntry archived = state.getFeedbackHistory().get(0);
        assertEquals("fix hat color", archived.note());
        assertEquals(2, archived.revisionRound());
        assertEquals(List.of(ConversationMessage.admin("We'll use red", repliedAt)), archived.conversationThread());
    }

    @Test
    void appendFollowUp_movesReplyIntoThreadAndKeepsNote() {
        FeedbackState state = openFeedback("fix hat color");
        LocalDateTime repliedAt = LocalDateTime.of(2026, 3, 1, 10, 0);
        state.setAdminReply("Is blue fine?", repliedAt, AdminReplyType.REPLY);

        FeedbackLedger.appendFollowUp(state, "still wrong");

        List<ConversationMessage> thread = state.getConversationThread();
        assertEquals(2, thread.size());
        assertEquals(ConversationMessage.Author.ADMIN, thread.get(0).author());
        assertEquals("Is blue fine?", thread.get(0).text());
        assertEquals(repliedAt, thread.get(0).at());
        assertEquals(ConversationMessage.Author.CUSTOMER, thread.get(1).author());
        assertEquals("still wrong", thread.get(1).text());
        assertNull(state.getAdminReply());
        assertEquals("fix hat color", state.getFeedbackNotes());
        assertTrue(state.hasOpenFeedback());
        assertTrue(state.getFeedbackHistory().isEmpty());
    }

    @Test
    void appendFollowUp_withoutReply_isRejected() {
        FeedbackState state = openFeedback("fix hat color");

        assertThrows(ValidationException.class, () -> FeedbackLedger.appendFollowUp(state, "hello?"));
        assertThrows(ValidationException.class, () -> FeedbackLedger.appendFollowUp(state, "  "));
    }

    @Test
    void resolveByRegeneration_clearsEverythingAndArchivesThread() {
        FeedbackState state = openFeedback("bigger smile");
        state.setAdminReply("Sure", LocalDateTime.now(), AdminReplyType.REPLY);
        FeedbackLedger.appendFollowUp(state, "thanks, and brown shoes");
        state.setAdminReply("Noted", LocalDateTime.now(), AdminReplyType.REPLY);

        assertTrue(FeedbackLedger.resolveByRegeneration(state, 3));

        assertTrue(state.isResolved());
        assertNull(state.getFeedbackNotes());
        assertNull(state.getAdminReply());
        assertTrue(state.getConversationThread().isEmpty());
        FeedbackHistoryEntry archived = state.getFeedbackHistory().get(0);
        assertEquals("bigger smile", archived.note());
        assertEquals(3, archived.revisionRound());
        assertEquals(2, archived.conversationThread().size());
    }

    @Test
    void resolveByRegeneration_withoutNote_changesNothing() {
        FeedbackState state = new FeedbackState();

        assertFalse(FeedbackLedger.resolveByRegeneration(state, 1));
        assertFalse(FeedbackLedger.resolveManually(state, 1));
        assertTrue(state.getFeedbackHistory().isEmpty());
        assertFalse(state.isResolved());
    }

    @Test
    void replaceRequest_editingOpenNote_rewritesInPlace() {
        FeedbackState state = new FeedbackState();
        FeedbackLedger.replaceRequest(state, "fix hat", 1);
        state.setAdminReply("Working on it", LocalDateTime.now(), AdminReplyType.REPLY);

        assertTrue(FeedbackLedger.replaceRequest(state, "fix hat color", 1));

        assertEquals("fix hat color", state.getFeedbackNotes());
        assertFalse(state.isResolved());
        assertEquals("Working on it", state.getAdminReply());
        assertTrue(state.getFeedbackHistory().isEmpty());
    }

    @Test
    void replaceRequest_afterRegeneration_startsNewExchange() {
        FeedbackState state = openFeedback("first");
        FeedbackLedger.resolveByRegeneration(state, 1);

        assertTrue(FeedbackLedger.replaceRequest(state, "second", 2));

        assertEquals("second", state.getFeedbackNotes());
        assertFalse(state.isResolved());
        assertEquals(1, state.getFeedbackHistory().size());
        assertEquals("first", state.getFeedbackHistory().get(0).note());
    }

    @Test
    void replaceRequest_onResolvedRowStillCarryingNote_archivesIt() {
        FeedbackState state = openFeedback("old note");
        state.setResolved(true);

        FeedbackLedger.replaceRequest(state, "new note", 3);

        assertEquals("new note", state.getFeedbackNotes());
        assertEquals(1, state.getFeedbackHistory().size());
        assertEquals("old note", state.getFeedbackHistory().get(0).note());
        assertEquals(3, state.getFeedbackHistory().get(0).revisionRound());
    }

    @Test
    void replaceRequest_withSameOpenText_isNoOp() {
        FeedbackState state = openFeedback("same");

        assertFalse(FeedbackLedger.replaceRequest(state, "  same ", 1));
        assertTrue(state.getFeedbackHistory().isEmpty());
    }

    @Test
    void replaceRequest_afterManualResolve_dropsRetainedComment() {
        FeedbackState state = openFeedback("first");
        state.setAdminReply("Kept as is", LocalDateTime.now(), AdminReplyType.REPLY);
        FeedbackLedger.resolveManually(state, 1);

        FeedbackLedger.replaceRequest(state, "new request", 2);

        assertNull(state.getAdminReply());
        assertEquals("new request", state.getFeedbackNotes());
        assertEquals(1, state.getFeedbackHistory().size());
    }

    @Test
    void history_isAppendOnlyAcrossRounds() {
        FeedbackState state = new FeedbackState();
        FeedbackLedger.replaceRequest(state, "round one", 1);
        FeedbackLedger.resolveByRegeneration(state, 1);
        FeedbackHistoryEntry first = state.getFeedbackHistory().get(0);

        FeedbackLedger.replaceRequest(state, "round two", 2);
        FeedbackLedger.resolveManually(state, 2);

        assertEquals(2, state.getFeedbackHistory().size());
        assertEquals(first, state.getFeedbackHistory().get(0));
        assertEquals(2, state.getFeedbackHistory().get(1).revisionRound());
        assertThrows(UnsupportedOperationException.class, () -> state.getFeedbackHistory().clear());
    }

    @Test
    void acceptReply_resolvesWithReplyInThread() {
        FeedbackState state = openFeedback("can the dog be bigger?");
        state.setAdminReply("It would cover the text", LocalDateTime.now(), AdminReplyType.REPLY);

        FeedbackLedger.acceptReply(state, 1);

        assertTrue(state.isResolved());
        assertNull(state.getFeedbackNotes());
        assertNull(state.getAdminReply());
        assertEquals("It would cover the text",
                state.getFeedbackHistory().get(0).conversationThread().get(0).text());
    }

    @Test
    void replyAsAdmin_requiresOpenFeedback() {
        FeedbackState state = new FeedbackState();

        assertThrows(ValidationException.class, () -> FeedbackLedger.replyAsAdmin(state, "hi"));

        FeedbackLedger.replaceRequest(state, "note", 1);
        FeedbackLedger.replyAsAdmin(state, " hi ");
        assertEquals("hi", state.getAdminReply());
        assertEquals(AdminReplyType.REPLY, state.getAdminReplyType());
    }

    @Test
    void hasUnresolvedFeedback_detectsAnyOpenItem() {
        assertFalse(FeedbackLedger.hasUnresolvedFeedback(List.of()));
        assertFalse(FeedbackLedger.hasUnresolvedFeedback(List.of(new FeedbackState())));
        assertTrue(FeedbackLedger.hasUnresolvedFeedback(List.of(new FeedbackState(), openFeedback("x"))));
    }

    private static FeedbackState openFeedback(String note) {
        FeedbackState state = new FeedbackState();
        FeedbackLedger.replaceRequest(state, note, 1);
        return state;
    }
}
