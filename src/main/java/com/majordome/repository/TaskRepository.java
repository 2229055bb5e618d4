package com.majordome.repository;

import com.majordome.exception.RepositoryException;
import com.majordome.exception.TaskNotFoundException;
import com.majordome.task.Member;
import com.majordome.task.Room;
import com.majordome.task.Task;
import com.majordome.task.TaskRule;
import com.majordome.task.TaskSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Owner of rooms, tasks, rules and completion history.
 * <p>
 * Catalog reads resolve every task against its rule (defaults when none is stored) and
 * reduce the latest completion to whole days in the household's local calendar.
 * Implementations throw {@link RepositoryException} when the store cannot be reached.
 */
public interface TaskRepository {

    /**
     * One snapshot per task, rule resolved, days since last completion computed.
     */
    List<TaskSnapshot> fetchCatalog();

    /**
     * Snapshots of the tasks in one room.
     *
     * @throws TaskNotFoundException if the room is unknown
     */
    List<TaskSnapshot> fetchRoom(String roomName);

    /**
     * Append a completion for a task. Completing a one-off task also deactivates it.
     *
     * @param taskId    Completed task
     * @param performer Member display name, may be null or unknown
     * @param comment   Free comment, may be null
     * @return The appended history entry
     * @throws TaskNotFoundException if the task is unknown
     */
    CompletionRecord recordCompletion(long taskId, String performer, String comment);

    /**
     * Append a completion for a task named within a room.
     *
     * @throws TaskNotFoundException if the room, or the task within it, is unknown
     */
    default CompletionRecord recordCompletion(String roomName, String taskName,
                                              String performer, String comment) {
        Task task = findTask(roomName, taskName)
                .orElseThrow(() -> new TaskNotFoundException(
                        "Unknown task '" + taskName + "' for room '" + roomName + "'"));
        return recordCompletion(task.id(), performer, comment);
    }

    /**
     * Wake or put to sleep a task.
     *
     * @throws TaskNotFoundException if the task is unknown
     */
    void setActive(long taskId, boolean active);

    /**
     * Resolved task by id.
     */
    Optional<Task> findTask(long taskId);

    /**
     * Resolved task by room name and task name.
     *
     * @throws TaskNotFoundException if the room is unknown
     */
    Optional<Task> findTask(String roomName, String taskName);

    /**
     * Rooms ordered by name.
     */
    List<Room> rooms();

    /**
     * Completion history of a task, oldest first.
     */
    List<CompletionRecord> history(long taskId);

    /**
     * Insert a room, or update the room with the same name. The id of the draft is ignored.
     */
    Room saveRoom(Room draft);

    /**
     * Insert a task, or update the task with the same name in the same room.
     * The id of the draft is ignored and its room id must name a known room.
     *
     * @param draft Task definition
     * @param rule  Rule to store, or null to keep the current rule (if any)
     * @return The stored task, rule resolved
     */
    Task saveTask(Task draft, TaskRule rule);

    /**
     * Insert a member unless one with the same name exists.
     */
    Member saveMember(String name);
}
