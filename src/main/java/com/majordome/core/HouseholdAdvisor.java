package com.majordome.core;

import com.majordome.context.EnvironmentContext;
import com.majordome.exception.RepositoryException;
import com.majordome.exception.TaskNotFoundException;
import com.majordome.repository.CompletionRecord;
import com.majordome.task.Room;

import java.util.List;

/**
 * Entry point of the household butler: what to do now, and bookkeeping of what was done.
 * <p>
 * Every ranking request reads the catalog once and fetches the weather once.
 * A weather failure degrades to fair weather; a catalog failure aborts the request
 * with a {@link RepositoryException}.
 */
public interface HouseholdAdvisor {

    /**
     * Most urgent tasks across the whole household, limited to the configured window.
     */
    List<TaskSuggestion> suggestions();

    /**
     * Every surfaced task of one room, unlimited.
     *
     * @throws TaskNotFoundException if the room is unknown
     */
    List<TaskSuggestion> suggestions(String roomName);

    /**
     * Every task with its verdict, surfaced or not, in ranking order.
     */
    List<TaskSuggestion> catalog();

    /**
     * Record that a task was done.
     */
    CompletionRecord recordCompletion(long taskId, String performer, String comment);

    /**
     * Record that a task, named within a room, was done.
     */
    CompletionRecord recordCompletion(String roomName, String taskName, String performer, String comment);

    /**
     * Wake or put to sleep a task.
     */
    void setActive(long taskId, boolean active);

    List<Room> rooms();

    /**
     * Weather advisories for today.
     */
    AlertReport alerts();

    /**
     * Context a ranking request issued now would use.
     */
    EnvironmentContext currentContext();
}
