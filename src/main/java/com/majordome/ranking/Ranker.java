package com.majordome.ranking;

import com.majordome.context.EnvironmentContext;
import com.majordome.task.TaskSnapshot;

import java.util.List;

/**
 * Evaluates a task collection and orders the tasks worth surfacing.
 */
public interface Ranker {

    /**
     * Rank the visible tasks.
     *
     * @param tasks   Task snapshots to evaluate
     * @param context Evaluation context shared by all tasks
     * @param limit   Maximum number of results, null for no limit
     * @return Visible tasks, most urgent first
     */
    List<RankedItem> rank(List<TaskSnapshot> tasks, EnvironmentContext context, Integer limit);

    /**
     * Evaluate every task, visible or not, in ranking order.
     */
    List<RankedItem> audit(List<TaskSnapshot> tasks, EnvironmentContext context);
}
