package org.example.studio.workflow;

import org.example.studio.entity.ProjectStatus;

public class InvalidTransitionException extends WorkflowException {

    private final ProjectStatus currentStatus;
    private final WorkflowEvent event;

    public InvalidTransitionException(ProjectStatus currentStatus, WorkflowEvent event) {
        super("Cannot apply " + event + " while project is " + currentStatus);
        this.currentStatus = currentStatus;
        this.event = event;
    }

    public InvalidTransitionException(ProjectStatus currentStatus, WorkflowEvent event, String message) {
        super(message);
        this.currentStatus = currentStatus;
        this.event = event;
    }

    public ProjectStatus getCurrentStatus() {
        return currentStatus;
    }

    public WorkflowEvent getEvent() {
        return event;
    }
}
