package com.majordome.policy;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * Tagged reason with its structured parameters.
 * Human text is rendered by a {@link ReasonFormatter}.
 *
 * @param code    Reason code
 * @param days    Overdue delay for {@link ReasonCode#OVERDUE}, 0 otherwise
 * @param weekday Pinned weekday for {@link ReasonCode#WRONG_WEEKDAY}, null otherwise
 */
public record Reason(
        ReasonCode code,
        int days,
        DayOfWeek weekday
) {
    public Reason {
        Objects.requireNonNull(code, "code cannot be null");
        if (code == ReasonCode.WRONG_WEEKDAY && weekday == null) {
            throw new IllegalArgumentException("WRONG_WEEKDAY requires a weekday");
        }
    }

    /**
     * Reason without parameters. OVERDUE and WRONG_WEEKDAY carry parameters and have their own factories.
     */
    public static Reason of(ReasonCode code) {
        if (code == ReasonCode.OVERDUE || code == ReasonCode.WRONG_WEEKDAY) {
            throw new IllegalArgumentException(code + " needs its parameters, use overdue() or scheduledFor()");
        }
        return new Reason(code, 0, null);
    }

    public static Reason overdue(int delayDays) {
        return new Reason(ReasonCode.OVERDUE, delayDays, null);
    }

    public static Reason scheduledFor(DayOfWeek weekday) {
        return new Reason(ReasonCode.WRONG_WEEKDAY, 0, Objects.requireNonNull(weekday));
    }
}
