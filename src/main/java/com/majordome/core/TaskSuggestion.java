package com.majordome.core;

import com.majordome.policy.ReasonCode;
import com.majordome.policy.ReasonFormatter;
import com.majordome.ranking.RankedItem;

/**
 * A ranked task rendered for display.
 *
 * @param taskId     Task identifier
 * @param taskName   Task name
 * @param roomName   Room name
 * @param visible    Whether the task is surfaced now
 * @param score      Urgency score
 * @param reasonCode Tagged reason
 * @param reason     Rendered reason
 * @param nextDue    Rendered next-due estimate
 */
public record TaskSuggestion(
        long taskId,
        String taskName,
        String roomName,
        boolean visible,
        int score,
        ReasonCode reasonCode,
        String reason,
        String nextDue
) {
    public static TaskSuggestion from(RankedItem item, ReasonFormatter formatter) {
        return new TaskSuggestion(
                item.task().id(),
                item.task().name(),
                item.task().roomName(),
                item.verdict().visible(),
                item.verdict().score(),
                item.verdict().code(),
                formatter.format(item.verdict().reason()),
                formatter.format(item.verdict().nextDue()));
    }
}
