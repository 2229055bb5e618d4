package com.majordome.repository;

import com.majordome.exception.TaskNotFoundException;
import com.majordome.task.Member;
import com.majordome.task.Room;
import com.majordome.task.Task;
import com.majordome.task.TaskRule;
import com.majordome.task.TaskSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory TaskRepository.
 * <p>
 * Reads run without locking. Writes that look up by name are synchronized so that
 * two concurrent imports cannot create the same room or task twice.
 */
public class InMemoryTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskRepository.class);

    private final Clock clock;
    private final ZoneId zone;

    private final Map<Long, Room> rooms = new ConcurrentHashMap<>();
    private final Map<Long, Task> tasks = new ConcurrentHashMap<>();
    private final Map<Long, TaskRule> rules = new ConcurrentHashMap<>();
    private final Map<Long, Member> members = new ConcurrentHashMap<>();
    private final Map<Long, List<CompletionRecord>> history = new ConcurrentHashMap<>();

    private final AtomicLong roomIds = new AtomicLong();
    private final AtomicLong taskIds = new AtomicLong();
    private final AtomicLong memberIds = new AtomicLong();
    private final AtomicLong completionIds = new AtomicLong();

    public InMemoryTaskRepository(Clock clock, ZoneId zone) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.zone = Objects.requireNonNull(zone, "zone cannot be null");
    }

    @Override
    public List<TaskSnapshot> fetchCatalog() {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        return tasks.values().stream()
                .sorted(Comparator.comparingLong(Task::id))
                .map(task -> snapshot(task, today))
                .collect(Collectors.toList());
    }

    @Override
    public List<TaskSnapshot> fetchRoom(String roomName) {
        Room room = requireRoom(roomName);
        LocalDate today = LocalDate.now(clock.withZone(zone));
        return tasks.values().stream()
                .filter(task -> task.roomId() == room.id())
                .sorted(Comparator.comparingLong(Task::id))
                .map(task -> snapshot(task, today))
                .collect(Collectors.toList());
    }

    @Override
    public CompletionRecord recordCompletion(long taskId, String performer, String comment) {
        Task task = requireTask(taskId);
        Long memberId = findMember(performer).map(Member::id).orElse(null);
        if (performer != null && memberId == null) {
            log.debug("Unknown performer '{}' for task {}, recording without member", performer, taskId);
        }

        CompletionRecord record = new CompletionRecord(
                completionIds.incrementAndGet(),
                taskId,
                task.roomId(),
                memberId,
                clock.instant(),
                CompletionRecord.STATUS_DONE,
                comment,
                CompletionRecord.ORIGIN);
        history.computeIfAbsent(taskId, id -> new CopyOnWriteArrayList<>()).add(record);

        if (task.isOneOff()) {
            rules.compute(taskId, (id, rule) -> (rule != null ? rule : TaskRule.DEFAULT).withActive(false));
            log.info("One-off task {} '{}' completed and put to sleep", taskId, task.name());
        } else {
            log.info("Task {} '{}' completed", taskId, task.name());
        }
        return record;
    }

    @Override
    public void setActive(long taskId, boolean active) {
        Task task = requireTask(taskId);
        rules.compute(taskId, (id, rule) -> (rule != null ? rule : TaskRule.DEFAULT).withActive(active));
        log.info("Task {} '{}' set {}", taskId, task.name(), active ? "active" : "inactive");
    }

    @Override
    public Optional<Task> findTask(long taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(this::resolve);
    }

    @Override
    public Optional<Task> findTask(String roomName, String taskName) {
        Room room = requireRoom(roomName);
        return tasks.values().stream()
                .filter(task -> task.roomId() == room.id() && task.name().equals(taskName))
                .findFirst()
                .map(this::resolve);
    }

    @Override
    public List<Room> rooms() {
        return rooms.values().stream()
                .sorted(Comparator.comparing(Room::name))
                .collect(Collectors.toList());
    }

    @Override
    public List<CompletionRecord> history(long taskId) {
        requireTask(taskId);
        return List.copyOf(history.getOrDefault(taskId, List.of()));
    }

    @Override
    public synchronized Room saveRoom(Room draft) {
        Optional<Room> existing = findRoom(draft.name());
        long id = existing.map(Room::id).orElseGet(roomIds::incrementAndGet);
        Room room = new Room(id, draft.name(), draft.areaM2(), draft.floor(), draft.exposure(), draft.floorType());
        rooms.put(id, room);
        log.debug("{} room {} '{}'", existing.isPresent() ? "Updated" : "Created", id, room.name());
        return room;
    }

    @Override
    public synchronized Task saveTask(Task draft, TaskRule rule) {
        Room room = rooms.get(draft.roomId());
        if (room == null) {
            throw new TaskNotFoundException("Unknown room id " + draft.roomId() + " for task '" + draft.name() + "'");
        }
        Optional<Task> existing = tasks.values().stream()
                .filter(task -> task.roomId() == room.id() && task.name().equals(draft.name()))
                .findFirst();
        long id = existing.map(Task::id).orElseGet(taskIds::incrementAndGet);

        Task task = draft.toBuilder()
                .id(id)
                .room(room.id(), room.name())
                .build();
        tasks.put(id, task);
        if (rule != null) {
            rules.put(id, rule);
        }
        log.debug("{} task {} '{}' in room '{}'", existing.isPresent() ? "Updated" : "Created",
                id, task.name(), room.name());
        return resolve(task);
    }

    @Override
    public synchronized Member saveMember(String name) {
        Optional<Member> existing = findMember(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Member member = new Member(memberIds.incrementAndGet(), name, true);
        members.put(member.id(), member);
        return member;
    }

    private TaskSnapshot snapshot(Task task, LocalDate today) {
        return new TaskSnapshot(resolve(task), daysSinceLastCompletion(task.id(), today));
    }

    private Task resolve(Task task) {
        return task.withRule(rules.getOrDefault(task.id(), TaskRule.DEFAULT));
    }

    private Integer daysSinceLastCompletion(long taskId, LocalDate today) {
        List<CompletionRecord> records = history.get(taskId);
        if (records == null || records.isEmpty()) {
            return null;
        }
        Instant latest = records.stream()
                .map(CompletionRecord::completedAt)
                .max(Comparator.naturalOrder())
                .orElseThrow();
        long days = ChronoUnit.DAYS.between(latest.atZone(zone).toLocalDate(), today);
        if (days < 0) {
            log.warn("Task {} has a completion in the future ({}), counting it as today", taskId, latest);
            return 0;
        }
        return Math.toIntExact(days);
    }

    private Optional<Room> findRoom(String name) {
        return rooms.values().stream()
                .filter(room -> room.name().equals(name))
                .findFirst();
    }

    private Optional<Member> findMember(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return members.values().stream()
                .filter(member -> member.name().equals(name))
                .findFirst();
    }

    private Room requireRoom(String roomName) {
        return findRoom(roomName)
                .orElseThrow(() -> new TaskNotFoundException("Unknown room: '" + roomName + "'"));
    }

    private Task requireTask(long taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException("Unknown task id: " + taskId);
        }
        return task;
    }
}
