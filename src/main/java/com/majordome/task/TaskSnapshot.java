package com.majordome.task;

import com.majordome.exception.InvalidTaskException;

import java.util.Objects;

/**
 * A resolved task together with the whole local days elapsed since its last completion.
 *
 * @param task                    Resolved task
 * @param daysSinceLastCompletion Days since the most recent completion, null if never done
 */
public record TaskSnapshot(
        Task task,
        Integer daysSinceLastCompletion
) {
    public TaskSnapshot {
        Objects.requireNonNull(task, "task cannot be null");
        if (daysSinceLastCompletion != null && daysSinceLastCompletion < 0) {
            throw new InvalidTaskException("Days since last completion cannot be negative for task "
                    + task.id() + ": " + daysSinceLastCompletion);
        }
    }

    public static TaskSnapshot neverDone(Task task) {
        return new TaskSnapshot(task, null);
    }
}
