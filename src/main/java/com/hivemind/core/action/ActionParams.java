package com.hivemind.core.action;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parameters of an agent action. Each action kind reads only the fields it needs;
 * absent fields are {@code null} and absent lists are empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionParams(
        String path,
        String content,
        String search,
        String replace,
        String command,
        String title,
        String description,
        String assignee,
        List<String> dependencies,
        List<String> tags,
        String priority,
        @JsonProperty("requires_review") Boolean requiresReview,
        @JsonProperty("requires_testing") Boolean requiresTesting,
        List<TaskDraft> tasks,
        @JsonProperty("task_id") String taskId,
        String status,
        String reason,
        String verdict,
        @JsonProperty("files_touched") List<String> filesTouched,
        @JsonProperty("commands_run") List<String> commandsRun,
        @JsonProperty("known_risks") List<String> knownRisks,
        @JsonProperty("next_role") String nextRole,
        List<String> reviewers,
        List<String> files,
        String target,
        String question,
        String context,
        String insight,
        String approach,
        List<String> alternatives
) {

    public static final ActionParams EMPTY = new ActionParams(null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null);

    public ActionParams {
        dependencies = nonNull(dependencies);
        tags = nonNull(tags);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        filesTouched = nonNull(filesTouched);
        commandsRun = nonNull(commandsRun);
        knownRisks = nonNull(knownRisks);
        reviewers = nonNull(reviewers);
        files = nonNull(files);
        alternatives = nonNull(alternatives);
    }

    /** One entry of a {@code create_tasks} batch. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskDraft(
            String title,
            String description,
            String assignee,
            List<String> dependencies,
            List<String> tags,
            String priority,
            @JsonProperty("requires_review") Boolean requiresReview,
            @JsonProperty("requires_testing") Boolean requiresTesting
    ) {
        public TaskDraft {
            dependencies = nonNull(dependencies);
            tags = nonNull(tags);
        }
    }

    private static List<String> nonNull(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(v -> v != null && !v.isBlank()).toList();
    }
}
