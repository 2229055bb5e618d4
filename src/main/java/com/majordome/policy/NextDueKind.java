package com.majordome.policy;

/**
 * Coarse estimate of when a task becomes eligible.
 */
public enum NextDueKind {
    NOW,
    TODAY,
    AS_SOON_AS_POSSIBLE,
    IN_DAYS,
    TOMORROW_MORNING,
    WHEN_CLEAR,
    NEXT_SPRING,
    ON_DEMAND
}
