package com.majordome.ranking;

import com.majordome.context.EnvironmentContext;
import com.majordome.policy.EligibilityEvaluator;
import com.majordome.task.TaskSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Default implementation of Ranker.
 * Each task is evaluated independently; the ranker keeps no state between calls.
 */
public class DefaultRanker implements Ranker {

    private static final Logger log = LoggerFactory.getLogger(DefaultRanker.class);

    private final EligibilityEvaluator evaluator;

    public DefaultRanker(EligibilityEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator cannot be null");
    }

    @Override
    public List<RankedItem> rank(List<TaskSnapshot> tasks, EnvironmentContext context, Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative: " + limit);
        }

        Stream<RankedItem> visible = evaluateAll(tasks, context)
                .filter(RankedItem::visible)
                .sorted(RankedItem.ORDER);
        if (limit != null) {
            visible = visible.limit(limit);
        }
        List<RankedItem> ranked = visible.collect(Collectors.toList());

        log.debug("Ranked {} of {} tasks (limit {})", ranked.size(), tasks.size(),
                limit != null ? limit : "none");
        return ranked;
    }

    @Override
    public List<RankedItem> audit(List<TaskSnapshot> tasks, EnvironmentContext context) {
        return evaluateAll(tasks, context)
                .sorted(RankedItem.ORDER)
                .collect(Collectors.toList());
    }

    private Stream<RankedItem> evaluateAll(List<TaskSnapshot> tasks, EnvironmentContext context) {
        Objects.requireNonNull(context, "context cannot be null");
        return tasks.stream()
                .map(snapshot -> new RankedItem(snapshot.task(), evaluator.evaluate(snapshot, context)));
    }
}
