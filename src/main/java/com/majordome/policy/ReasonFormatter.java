package com.majordome.policy;

/**
 * Renders reasons and next-due estimates as human text.
 */
public interface ReasonFormatter {

    String format(Reason reason);

    String format(NextDue nextDue);
}
