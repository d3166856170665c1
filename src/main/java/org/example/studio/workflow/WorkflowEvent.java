package org.example.studio.workflow;

public enum WorkflowEvent {
    SEND_CHARACTERS_TO_CUSTOMER,
    START_CHARACTER_GENERATION,
    CHARACTER_BATCH_SUCCEEDED,
    CHARACTER_BATCH_FAILED,
    APPROVE_CHARACTERS,
    ADMIN_APPROVE_CHARACTERS,
    REQUEST_CHARACTER_REVISION,
    SEND_SKETCHES_TO_CUSTOMER,
    REQUEST_SKETCH_REVISION,
    SKETCH_FEEDBACK_CLEARED,
    APPROVE_ILLUSTRATIONS,
    ADMIN_APPROVE_ILLUSTRATIONS,
    COMPLETE
}
