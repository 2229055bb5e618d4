package com.majordome.policy;

import com.majordome.task.Weekdays;

/**
 * English rendering of reasons and next-due estimates.
 */
public class EnglishReasonFormatter implements ReasonFormatter {

    public static final EnglishReasonFormatter INSTANCE = new EnglishReasonFormatter();

    @Override
    public String format(Reason reason) {
        return switch (reason.code()) {
            case DORMANT -> "dormant one-off task";
            case NIGHT -> "deferred: nighttime";
            case WINTER -> "deferred: winter season";
            case RAIN -> "deferred: raining";
            case WIND -> "deferred: too windy";
            case FROST -> "deferred: frost risk";
            case WRONG_WEEKDAY -> "scheduled for " + Weekdays.displayName(reason.weekday());
            case NOT_YET_DUE -> "not yet due";
            case DONE_TODAY -> "already done today";
            case OVERDUE -> "overdue by " + reason.days() + " days";
            case NEVER_DONE -> "never done (one-off)";
            case WEEKDAY_MATCH -> "today is the day";
            case REACTIVATED -> "reactivated one-off task";
        };
    }

    @Override
    public String format(NextDue nextDue) {
        return switch (nextDue.kind()) {
            case NOW -> "now";
            case TODAY -> "today";
            case AS_SOON_AS_POSSIBLE -> "as soon as possible";
            case IN_DAYS -> "in " + nextDue.days() + " days";
            case TOMORROW_MORNING -> "tomorrow morning";
            case WHEN_CLEAR -> "as soon as it clears";
            case NEXT_SPRING -> "next spring";
            case ON_DEMAND -> "on demand";
        };
    }
}
