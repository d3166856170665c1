package org.example.studio.workflow;

public class NotFoundException extends WorkflowException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String type, String id) {
        return new NotFoundException(type + " not found: " + id);
    }
}
