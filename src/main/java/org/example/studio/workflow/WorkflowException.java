package org.example.studio.workflow;

/**
 * Base type for rejected workflow operations. Generation failures are recorded on the
 * artifact and never surface as this exception.
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
