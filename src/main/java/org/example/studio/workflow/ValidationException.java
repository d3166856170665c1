package org.example.studio.workflow;

public class ValidationException extends WorkflowException {

    public ValidationException(String message) {
        super(message);
    }
}
