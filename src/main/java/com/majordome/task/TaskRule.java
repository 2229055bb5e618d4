package com.majordome.task;

import java.time.DayOfWeek;

/**
 * Scheduling rule attached to a task.
 * A task without a stored rule resolves to {@link #DEFAULT}, so a resolved task always
 * carries concrete values.
 *
 * @param priorityBase  Base priority added to every score
 * @param targetWeekday Weekday the task is pinned to, or null
 * @param active        Awake/asleep flag; a completed one-off task goes to sleep
 */
public record TaskRule(
        int priorityBase,
        DayOfWeek targetWeekday,
        boolean active
) {
    public static final int DEFAULT_PRIORITY_BASE = 50;

    public static final TaskRule DEFAULT = new TaskRule(DEFAULT_PRIORITY_BASE, null, true);

    public TaskRule withActive(boolean newActive) {
        return new TaskRule(priorityBase, targetWeekday, newActive);
    }
}
