package com.majordome.policy;

import java.util.Objects;

/**
 * Next-eligible estimate.
 *
 * @param kind Estimate kind
 * @param days Day count for {@link NextDueKind#IN_DAYS}, 0 otherwise
 */
public record NextDue(
        NextDueKind kind,
        int days
) {
    public static final NextDue NOW = of(NextDueKind.NOW);
    public static final NextDue TODAY = of(NextDueKind.TODAY);
    public static final NextDue AS_SOON_AS_POSSIBLE = of(NextDueKind.AS_SOON_AS_POSSIBLE);
    public static final NextDue TOMORROW_MORNING = of(NextDueKind.TOMORROW_MORNING);
    public static final NextDue WHEN_CLEAR = of(NextDueKind.WHEN_CLEAR);
    public static final NextDue NEXT_SPRING = of(NextDueKind.NEXT_SPRING);
    public static final NextDue ON_DEMAND = of(NextDueKind.ON_DEMAND);

    public NextDue {
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    private static NextDue of(NextDueKind kind) {
        return new NextDue(kind, 0);
    }

    public static NextDue inDays(int days) {
        return new NextDue(NextDueKind.IN_DAYS, days);
    }
}
