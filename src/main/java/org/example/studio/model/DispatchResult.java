package org.example.studio.model;

import org.example.studio.entity.ProjectStatus;

public record DispatchResult(
        boolean accepted,
        String projectId,
        ProjectStatus status,
        int dispatchedCount,
        String message
) {
    public static DispatchResult dispatched(String projectId, ProjectStatus status, int count) {
        return new DispatchResult(true, projectId, status, count,
                "Generation started for " + count + (count == 1 ? " item" : " items"));
    }

    public static DispatchResult nothingPending(String projectId, ProjectStatus status) {
        return new DispatchResult(true, projectId, status, 0, "Nothing needs generation");
    }

    public static DispatchResult alreadyRunning(String projectId, ProjectStatus status) {
        return new DispatchResult(false, projectId, status, 0, "Generation already in progress");
    }
}
