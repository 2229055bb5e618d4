package com.majordome.policy;

import java.util.Objects;

/**
 * Outcome of evaluating one task against one context.
 * Built fresh per evaluation and never persisted.
 *
 * @param visible Whether the task should be surfaced now
 * @param score   Urgency score, meaningful only when visible (0 for hidden tasks)
 * @param reason  Why the task is hidden or surfaced
 * @param nextDue When the task is expected to become eligible
 */
public record Verdict(
        boolean visible,
        int score,
        Reason reason,
        NextDue nextDue
) {
    public Verdict {
        Objects.requireNonNull(reason, "reason cannot be null");
        Objects.requireNonNull(nextDue, "nextDue cannot be null");
        if (visible != reason.code().isSurfacing()) {
            throw new IllegalArgumentException("Reason " + reason.code() + " cannot back a "
                    + (visible ? "visible" : "hidden") + " verdict");
        }
    }

    public static Verdict visible(int score, Reason reason, NextDue nextDue) {
        return new Verdict(true, score, reason, nextDue);
    }

    public static Verdict hidden(Reason reason, NextDue nextDue) {
        return new Verdict(false, 0, reason, nextDue);
    }

    public ReasonCode code() {
        return reason.code();
    }
}
