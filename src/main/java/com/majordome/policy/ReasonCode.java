package com.majordome.policy;

/**
 * Why a task was hidden or surfaced.
 */
public enum ReasonCode {
    DORMANT(false),
    NIGHT(false),
    WINTER(false),
    RAIN(false),
    WIND(false),
    FROST(false),
    WRONG_WEEKDAY(false),
    NOT_YET_DUE(false),
    DONE_TODAY(false),
    OVERDUE(true),
    NEVER_DONE(true),
    WEEKDAY_MATCH(true),
    REACTIVATED(true);

    private final boolean surfacing;

    ReasonCode(boolean surfacing) {
        this.surfacing = surfacing;
    }

    /**
     * Whether verdicts carrying this code are visible.
     */
    public boolean isSurfacing() {
        return surfacing;
    }
}
