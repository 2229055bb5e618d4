package com.majordome.policy;

import com.majordome.context.EnvironmentContext;
import com.majordome.task.Task;
import com.majordome.task.TaskSnapshot;

/**
 * Decides whether a task deserves attention now and how urgent it is.
 * Implementations are pure: the same task and context always yield the same verdict.
 */
public interface EligibilityEvaluator {

    /**
     * Evaluate one task in one context.
     *
     * @param task                    Validated task snapshot
     * @param daysSinceLastCompletion Whole local days since the last completion, null if never done
     * @param context                 Evaluation context
     * @return Verdict for this task
     */
    Verdict evaluate(Task task, Integer daysSinceLastCompletion, EnvironmentContext context);

    default Verdict evaluate(TaskSnapshot snapshot, EnvironmentContext context) {
        return evaluate(snapshot.task(), snapshot.daysSinceLastCompletion(), context);
    }
}
