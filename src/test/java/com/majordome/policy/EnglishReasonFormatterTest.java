package com.majordome.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;

import static org.junit.jupiter.api.Assertions.*;

class EnglishReasonFormatterTest {

    private final ReasonFormatter formatter = EnglishReasonFormatter.INSTANCE;

    @Test
    @DisplayName("Parameterized reasons render their parameters")
    void parameterizedReasons() {
        assertEquals("overdue by 12 days", formatter.format(Reason.overdue(12)));
        assertEquals("scheduled for sunday", formatter.format(Reason.scheduledFor(DayOfWeek.SUNDAY)));
        assertEquals("in 3 days", formatter.format(NextDue.inDays(3)));
    }

    @Test
    @DisplayName("Every reason code and hint kind renders to non-blank text")
    void everyCodeRenders() {
        for (ReasonCode code : ReasonCode.values()) {
            Reason reason = code == ReasonCode.WRONG_WEEKDAY
                    ? Reason.scheduledFor(DayOfWeek.MONDAY)
                    : new Reason(code, 1, null);
            assertFalse(formatter.format(reason).isBlank(), code.name());
        }
        for (NextDueKind kind : NextDueKind.values()) {
            assertFalse(formatter.format(new NextDue(kind, 1)).isBlank(), kind.name());
        }
    }
}
