package com.majordome.repository;

import java.time.Instant;

/**
 * One entry of the append-only completion history.
 *
 * @param id          Entry identifier
 * @param taskId      Completed task
 * @param roomId      Room of the completed task
 * @param memberId    Performing member, null when unknown
 * @param completedAt Completion instant (UTC)
 * @param status      Entry status, always "done" for completions
 * @param comment     Free comment, may be null
 * @param origin      Which client recorded the entry
 */
public record CompletionRecord(
        long id,
        long taskId,
        long roomId,
        Long memberId,
        Instant completedAt,
        String status,
        String comment,
        String origin
) {
    public static final String STATUS_DONE = "done";
    public static final String ORIGIN = "MAJORDOME";
}
