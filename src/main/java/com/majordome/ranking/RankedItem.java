package com.majordome.ranking;

import com.majordome.policy.Verdict;
import com.majordome.task.Task;

import java.util.Comparator;
import java.util.Objects;

/**
 * A task with its verdict, as produced by the ranker.
 *
 * @param task    Evaluated task
 * @param verdict Verdict for the task in the ranking context
 */
public record RankedItem(
        Task task,
        Verdict verdict
) {
    /**
     * Score descending, then room name and task name ascending.
     */
    public static final Comparator<RankedItem> ORDER = Comparator
            .comparingInt((RankedItem item) -> item.verdict().score()).reversed()
            .thenComparing(item -> item.task().roomName())
            .thenComparing(item -> item.task().name());

    public RankedItem {
        Objects.requireNonNull(task, "task cannot be null");
        Objects.requireNonNull(verdict, "verdict cannot be null");
    }

    public int score() {
        return verdict.score();
    }

    public boolean visible() {
        return verdict.visible();
    }
}
