package org.example.studio.workflow;

import org.example.studio.entity.ProjectStatus;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectStatusMachineTest {

    @Test
    void characterPhase_firstPassRunsThroughGeneration() {
        ProjectStatus status = ProjectStatus.DRAFT;
        status = ProjectStatusMachine.transition(status, WorkflowEvent.SEND_CHARACTERS_TO_CUSTOMER);
        assertEquals(ProjectStatus.CHARACTER_REVIEW, status);
        status = ProjectStatusMachine.transition(status, WorkflowEvent.START_CHARACTER_GENERATION);
        assertEquals(ProjectStatus.CHARACTER_GENERATION, status);
        status = ProjectStatusMachine.transition(status, WorkflowEvent.CHARACTER_BATCH_SUCCEEDED);
        assertEquals(ProjectStatus.CHARACTER_GENERATION_COMPLETE, status);
    }

    @Test
    void failedBatch_isParkedAndRetryable() {
        ProjectStatus failed = ProjectStatusMachine.transition(
                ProjectStatus.CHARACTER_GENERATION, WorkflowEvent.CHARACTER_BATCH_FAILED);

        assertEquals(ProjectStatus.CHARACTER_GENERATION_FAILED, failed);
        assertEquals(ProjectStatus.CHARACTER_GENERATION,
                ProjectStatusMachine.transition(failed, WorkflowEvent.START_CHARACTER_GENERATION));
    }

    @Test
    void revisionRegeneration_movesToRegeneratedOrStaysOnFailure() {
        assertEquals(ProjectStatus.CHARACTERS_REGENERATED, ProjectStatusMachine.transition(
                ProjectStatus.CHARACTER_REVISION_NEEDED, WorkflowEvent.CHARACTER_BATCH_SUCCEEDED));
        assertEquals(ProjectStatus.CHARACTER_REVISION_NEEDED, ProjectStatusMachine.transition(
                ProjectStatus.CHARACTER_REVISION_NEEDED, WorkflowEvent.CHARACTER_BATCH_FAILED));
    }

    @Test
    void illustrationPhase_togglesBetweenReviewAndRevision() {
        ProjectStatus status = ProjectStatusMachine.transition(
                ProjectStatus.CHARACTERS_APPROVED, WorkflowEvent.SEND_SKETCHES_TO_CUSTOMER);
        assertEquals(ProjectStatus.SKETCHES_REVIEW, status);
        status = ProjectStatusMachine.transition(status, WorkflowEvent.REQUEST_SKETCH_REVISION);
        assertEquals(ProjectStatus.SKETCHES_REVISION, status);
        status = ProjectStatusMachine.transition(status, WorkflowEvent.SKETCH_FEEDBACK_CLEARED);
        assertEquals(ProjectStatus.SKETCHES_REVIEW, status);
        status = ProjectStatusMachine.transition(status, WorkflowEvent.APPROVE_ILLUSTRATIONS);
        assertEquals(ProjectStatus.ILLUSTRATION_APPROVED, status);
        assertEquals(ProjectStatus.COMPLETED, ProjectStatusMachine.transition(status, WorkflowEvent.COMPLETE));
    }

    @Test
    void transition_rejectsPairsMissingFromTable() {
        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> ProjectStatusMachine.transition(ProjectStatus.CHARACTER_GENERATION,
                        WorkflowEvent.SEND_CHARACTERS_TO_CUSTOMER));

        assertEquals(ProjectStatus.CHARACTER_GENERATION, ex.getCurrentStatus());
        assertEquals(WorkflowEvent.SEND_CHARACTERS_TO_CUSTOMER, ex.getEvent());
        assertThrows(InvalidTransitionException.class,
                () -> ProjectStatusMachine.transition(ProjectStatus.COMPLETED, WorkflowEvent.COMPLETE));
        assertThrows(InvalidTransitionException.class,
                () -> ProjectStatusMachine.transition(ProjectStatus.SKETCHES_REVISION, WorkflowEvent.APPROVE_ILLUSTRATIONS));
    }

    @Test
    void customerApproval_requiresReviewStatus() {
        assertTrue(ProjectStatusMachine.canApply(ProjectStatus.CHARACTER_REVIEW, WorkflowEvent.APPROVE_CHARACTERS));
        assertTrue(ProjectStatusMachine.canApply(ProjectStatus.CHARACTERS_REGENERATED, WorkflowEvent.APPROVE_CHARACTERS));
        assertFalse(ProjectStatusMachine.canApply(ProjectStatus.CHARACTER_GENERATION_FAILED, WorkflowEvent.APPROVE_CHARACTERS));
        assertTrue(ProjectStatusMachine.canApply(
                ProjectStatus.CHARACTER_GENERATION_FAILED, WorkflowEvent.ADMIN_APPROVE_CHARACTERS));
    }

    @Test
    void next_isEmptyForNullInputs() {
        assertEquals(Optional.empty(), ProjectStatusMachine.next(null, WorkflowEvent.COMPLETE));
        assertEquals(Optional.empty(), ProjectStatusMachine.next(ProjectStatus.DRAFT, null));
    }

    @Test
    void transition_rejectionNamesStatusesThatAcceptTheEvent() {
        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> ProjectStatusMachine.transition(ProjectStatus.DRAFT, WorkflowEvent.COMPLETE));

        assertEquals("Cannot apply COMPLETE while project is draft; allowed from: illustration_approved",
                ex.getMessage());
    }

    @Test
    void sourcesOf_listsEveryStatusAcceptingEvent() {
        assertEquals(1, ProjectStatusMachine.sourcesOf(WorkflowEvent.COMPLETE).size());
        assertTrue(ProjectStatusMachine.sourcesOf(WorkflowEvent.START_CHARACTER_GENERATION)
                .contains(ProjectStatus.CHARACTER_GENERATION));
        assertThrows(UnsupportedOperationException.class,
                () -> ProjectStatusMachine.sourcesOf(WorkflowEvent.COMPLETE).clear());
    }
}
