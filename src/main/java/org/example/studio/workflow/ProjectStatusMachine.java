package org.example.studio.workflow;

import org.example.studio.entity.ProjectStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.example.studio.entity.ProjectStatus.*;

/**
 * The project transition table. Every status change made by the workflow services goes
 * through {@link #transition}; pairs missing from the table are rejected.
 */
public final class ProjectStatusMachine {

    private static final Map<WorkflowEvent, Map<ProjectStatus, ProjectStatus>> TABLE =
            new EnumMap<>(WorkflowEvent.class);

    static {
        rule(WorkflowEvent.SEND_CHARACTERS_TO_CUSTOMER, CHARACTER_REVIEW,
                DRAFT, AWAITING_CUSTOMER_INPUT, CHARACTER_REVIEW, CHARACTER_GENERATION_COMPLETE,
                CHARACTER_GENERATION_FAILED, CHARACTER_REVISION_NEEDED, CHARACTERS_REGENERATED);
        rule(WorkflowEvent.START_CHARACTER_GENERATION, CHARACTER_GENERATION,
                CHARACTER_REVIEW, CHARACTER_REVISION_NEEDED, CHARACTER_GENERATION_FAILED, CHARACTER_GENERATION);

        rule(WorkflowEvent.CHARACTER_BATCH_SUCCEEDED, CHARACTER_GENERATION_COMPLETE, CHARACTER_GENERATION);
        rule(WorkflowEvent.CHARACTER_BATCH_SUCCEEDED, CHARACTERS_REGENERATED,
                CHARACTER_REVISION_NEEDED, CHARACTERS_REGENERATED, CHARACTER_GENERATION_COMPLETE);

        rule(WorkflowEvent.CHARACTER_BATCH_FAILED, CHARACTER_GENERATION_FAILED, CHARACTER_GENERATION);
        // a failed regeneration during revision keeps the project where it was
        unchanged(WorkflowEvent.CHARACTER_BATCH_FAILED,
                CHARACTER_REVISION_NEEDED, CHARACTERS_REGENERATED, CHARACTER_GENERATION_COMPLETE);

        rule(WorkflowEvent.APPROVE_CHARACTERS, CHARACTERS_APPROVED, CHARACTER_REVIEW, CHARACTERS_REGENERATED);
        rule(WorkflowEvent.ADMIN_APPROVE_CHARACTERS, CHARACTERS_APPROVED,
                CHARACTER_REVIEW, CHARACTERS_REGENERATED, CHARACTER_REVISION_NEEDED,
                CHARACTER_GENERATION_COMPLETE, CHARACTER_GENERATION_FAILED);
        rule(WorkflowEvent.REQUEST_CHARACTER_REVISION, CHARACTER_REVISION_NEEDED,
                CHARACTER_REVIEW, CHARACTERS_REGENERATED, CHARACTER_REVISION_NEEDED);

        rule(WorkflowEvent.SEND_SKETCHES_TO_CUSTOMER, SKETCHES_REVIEW,
                CHARACTERS_APPROVED, SKETCHES_REVIEW, SKETCHES_REVISION);
        rule(WorkflowEvent.REQUEST_SKETCH_REVISION, SKETCHES_REVISION, SKETCHES_REVIEW, SKETCHES_REVISION);
        rule(WorkflowEvent.SKETCH_FEEDBACK_CLEARED, SKETCHES_REVIEW, SKETCHES_REVISION, SKETCHES_REVIEW);
        rule(WorkflowEvent.APPROVE_ILLUSTRATIONS, ILLUSTRATION_APPROVED, SKETCHES_REVIEW);
        rule(WorkflowEvent.ADMIN_APPROVE_ILLUSTRATIONS, ILLUSTRATION_APPROVED,
                CHARACTERS_APPROVED, SKETCHES_REVIEW, SKETCHES_REVISION);

        rule(WorkflowEvent.COMPLETE, COMPLETED, ILLUSTRATION_APPROVED);
    }

    private ProjectStatusMachine() {
    }

    private static void rule(WorkflowEvent event, ProjectStatus to, ProjectStatus... from) {
        Map<ProjectStatus, ProjectStatus> edges = TABLE.computeIfAbsent(event, e -> new EnumMap<>(ProjectStatus.class));
        for (ProjectStatus status : from) {
            edges.put(status, to);
        }
    }

    private static void unchanged(WorkflowEvent event, ProjectStatus... from) {
        Map<ProjectStatus, ProjectStatus> edges = TABLE.computeIfAbsent(event, e -> new EnumMap<>(ProjectStatus.class));
        for (ProjectStatus status : from) {
            edges.put(status, status);
        }
    }

    public static Optional<ProjectStatus> next(ProjectStatus current, WorkflowEvent event) {
        if (current == null || event == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TABLE.getOrDefault(event, Map.of()).get(current));
    }

    public static boolean canApply(ProjectStatus current, WorkflowEvent event) {
        return next(current, event).isPresent();
    }

    /**
     * @throws InvalidTransitionException if {@code event} is not accepted from {@code current}
     */
    public static ProjectStatus transition(ProjectStatus current, WorkflowEvent event) {
        return next(current, event).orElseThrow(() -> new InvalidTransitionException(current, event,
                "Cannot apply " + event + " while project is " + current + "; allowed from: " + describeSources(event)));
    }

    public static Set<ProjectStatus> sourcesOf(WorkflowEvent event) {
        return Collections.unmodifiableSet(TABLE.getOrDefault(event, Map.of()).keySet());
    }

    private static String describeSources(WorkflowEvent event) {
        Set<ProjectStatus> sources = event == null ? Set.of() : sourcesOf(event);
        if (sources.isEmpty()) {
            return "none";
        }
        return sources.stream().map(ProjectStatus::value).collect(Collectors.joining(", "));
    }
}
