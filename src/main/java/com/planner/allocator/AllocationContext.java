package com.planner.allocator;

import com.planner.core.Task;
import com.planner.core.TimeWindow;
import com.planner.grid.TimeSlot;
import com.planner.grid.WeeklySlotGrid;
import com.planner.priority.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Mutable state of exactly one allocation run: the slot grid, the task arena,
 * the completed-set, the ordered result list and per-task failure reports.
 * <p>
 * Tasks are addressed on the grid by integer handles (their position in the arena),
 * so slot occupants and search states are plain values. Not thread-safe; one run
 * owns one context.
 */
public class AllocationContext {

    private static final Logger log = LoggerFactory.getLogger(AllocationContext.class);

    private final WeeklySlotGrid grid;
    private final DependencyGraph graph;
    private final List<Task> arena;
    private final Map<String, Integer> handles;
    private final SlotSpan[] spans;

    private final Set<String> completed = new HashSet<>();
    private final List<Task> placed = new ArrayList<>();
    private final Map<String, UnplacedTask> failures = new LinkedHashMap<>();

    public AllocationContext(WeeklySlotGrid grid, DependencyGraph graph) {
        this.grid = grid;
        this.graph = graph;
        this.arena = List.copyOf(graph.getTasks());
        this.handles = new HashMap<>();
        for (int i = 0; i < arena.size(); i++) {
            handles.put(arena.get(i).getId(), i);
        }
        this.spans = new SlotSpan[arena.size()];
    }

    public WeeklySlotGrid getGrid() {
        return grid;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public List<Task> getTasks() {
        return arena;
    }

    public int handleOf(Task task) {
        Integer handle = handles.get(task.getId());
        if (handle == null) {
            throw new IllegalArgumentException("Task not part of this run: " + task.getId());
        }
        return handle;
    }

    public Task taskAt(int handle) {
        return arena.get(handle);
    }

    public int getBreakDuration() {
        return grid.getConfig().breakDuration();
    }

    // =====================================================================
    // Completed-set and results
    // =====================================================================

    public boolean isCompleted(Task task) {
        return completed.contains(task.getId());
    }

    public Set<String> getCompletedIds() {
        return Collections.unmodifiableSet(completed);
    }

    /**
     * Placed tasks in placement order.
     */
    public List<Task> getPlaced() {
        return Collections.unmodifiableList(placed);
    }

    public Optional<SlotSpan> spanOf(Task task) {
        return Optional.ofNullable(spans[handleOf(task)]);
    }

    /**
     * Tasks still worth trying: not placed and not failed for a reason intrinsic to the task.
     */
    public List<Task> pendingTasks() {
        List<Task> pending = new ArrayList<>();
        for (Task task : arena) {
            if (!isCompleted(task) && !isTerminallyFailed(task)) {
                pending.add(task);
            }
        }
        return pending;
    }

    // =====================================================================
    // Failure reports
    // =====================================================================

    public void reportFailure(Task task, UnplacedReason reason, String detail) {
        failures.put(task.getId(), new UnplacedTask(task.getId(), reason, detail));
        log.debug("Task {} unplaced: {} ({})", task.getId(), reason, detail);
    }

    public Optional<UnplacedTask> failureOf(Task task) {
        return Optional.ofNullable(failures.get(task.getId()));
    }

    public boolean isTerminallyFailed(Task task) {
        UnplacedTask failure = failures.get(task.getId());
        return failure != null && failure.reason().isTerminal();
    }

    // =====================================================================
    // Feasibility
    // =====================================================================

    /**
     * Span a task would claim when started at the given index, if its task slots are
     * consecutive minutes of one working block. Occupancy is not checked.
     */
    public Optional<SlotSpan> spanAt(Task task, int startIndex) {
        OptionalInt minutes = task.requiredMinutes();
        if (minutes.isEmpty() || startIndex < 0) {
            return Optional.empty();
        }
        int taskEnd = startIndex + minutes.getAsInt();
        if (!grid.isContiguous(startIndex, taskEnd)) {
            return Optional.empty();
        }
        int end = Math.min(taskEnd + getBreakDuration(), grid.blockEnd(startIndex));
        return Optional.of(new SlotSpan(startIndex, taskEnd, end));
    }

    /**
     * Minute-of-week at which the task slots of a span end (exclusive).
     */
    public int endMinute(SlotSpan span) {
        return grid.minuteAt(span.taskEnd() - 1) + 1;
    }

    /**
     * Minute-of-week at which the span ends, trailing break included (exclusive).
     */
    public int spanEndMinute(SlotSpan span) {
        return grid.minuteAt(span.end() - 1) + 1;
    }

    /**
     * True when every dependency of the task is in the completed-set.
     * Unknown dependencies never complete.
     */
    public boolean dependenciesReady(Task task) {
        for (String depId : task.getDependencies()) {
            if (!completed.contains(depId)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Identifiers of dependencies not yet in the completed-set.
     */
    public List<String> missingDependencies(Task task) {
        List<String> missing = new ArrayList<>();
        for (String depId : task.getDependencies()) {
            if (!completed.contains(depId)) {
                missing.add(depId);
            }
        }
        return missing;
    }

    /**
     * First start index allowed by the placed dependencies: the slot after the latest
     * dependency end, or 0 without dependencies.
     */
    public int earliestStartIndex(Task task) {
        int latestEnd = 0;
        for (Task dep : graph.dependenciesOf(task)) {
            Optional<TimeWindow> window = dep.getAssignedWindow();
            if (window.isPresent()) {
                latestEnd = Math.max(latestEnd, window.get().end());
            }
        }
        return grid.firstIndexAtOrAfter(latestEnd);
    }

    /**
     * Latest minute the task slots may end at: the start of every placed dependent.
     */
    public int dependentsCeiling(Task task) {
        int ceiling = WeeklySlotGrid.MINUTES_PER_WEEK;
        for (Task dependent : graph.dependentsOf(task)) {
            Optional<TimeWindow> window = dependent.getAssignedWindow();
            if (window.isPresent()) {
                ceiling = Math.min(ceiling, window.get().start());
            }
        }
        return ceiling;
    }

    /**
     * Whether the span ends too late: task slots past the dependents ceiling, or task and
     * trailing break past the deadline.
     */
    public boolean endsTooLate(Task task, SlotSpan span, int dependentsCeiling) {
        if (endMinute(span) > dependentsCeiling) {
            return true;
        }
        OptionalInt deadline = task.getDeadline();
        return deadline.isPresent() && spanEndMinute(span) > deadline.getAsInt();
    }

    /**
     * Whether the span is free and respects the dependency floor, the placed dependents
     * and the deadline.
     */
    public boolean fitsAt(Task task, SlotSpan span) {
        return span.start() >= earliestStartIndex(task)
                && !endsTooLate(task, span, dependentsCeiling(task))
                && grid.isFree(span.start(), span.end());
    }

    // =====================================================================
    // Mutation
    // =====================================================================

    /**
     * Occupy the span: task slots get the task as occupant, trailing slots become breaks.
     * Records the assigned window, appends to the result list and completes the task.
     */
    public void commit(Task task, SlotSpan span) {
        int handle = handleOf(task);
        if (spans[handle] != null) {
            throw new IllegalStateException("Task " + task.getId() + " is already placed at " + spans[handle]);
        }
        for (int i = span.start(); i < span.taskEnd(); i++) {
            grid.occupy(i, handle);
        }
        for (int i = span.taskEnd(); i < span.end(); i++) {
            grid.reserveBreak(i);
        }
        spans[handle] = span;
        task.assign(new TimeWindow(grid.minuteAt(span.start()), endMinute(span)));
        placed.add(task);
        completed.add(task.getId());
        failures.remove(task.getId());
        log.debug("Placed {} at {} (priority={}, break={})",
                task.getId(), task.getAssignedWindow().orElseThrow(), task.getPriority(), span.breakLength());
    }

    /**
     * Free the task's slots and trailing breaks and drop it from the results and the completed-set.
     *
     * @return the span the task held
     */
    public SlotSpan release(Task task) {
        int handle = handleOf(task);
        SlotSpan span = spans[handle];
        if (span == null) {
            throw new IllegalStateException("Task " + task.getId() + " is not placed");
        }
        for (int i = span.start(); i < span.end(); i++) {
            grid.release(i);
        }
        spans[handle] = null;
        task.unassign();
        placed.remove(task);
        completed.remove(task.getId());
        log.trace("Released {} from slots [{}, {})", task.getId(), span.start(), span.end());
        return span;
    }

    /**
     * Distinct tasks occupying task slots in {@code [from, to)}.
     *
     * @return occupants, or empty if the range contains a break
     */
    public Optional<Set<Task>> occupantsIn(int from, int to) {
        Set<Task> occupants = new LinkedHashSet<>();
        for (int i = from; i < to; i++) {
            TimeSlot slot = grid.slot(i);
            if (slot.isBreak()) {
                return Optional.empty();
            }
            OptionalInt occupant = slot.getOccupant();
            if (occupant.isPresent()) {
                occupants.add(arena.get(occupant.getAsInt()));
            }
        }
        return Optional.of(occupants);
    }

    /**
     * The given placed tasks plus every placed task that transitively depends on them.
     */
    public Set<Task> withPlacedDependents(Collection<Task> roots) {
        Set<Task> closure = new LinkedHashSet<>();
        List<Task> worklist = new ArrayList<>(roots);
        while (!worklist.isEmpty()) {
            Task task = worklist.remove(worklist.size() - 1);
            if (!isCompleted(task) || !closure.add(task)) {
                continue;
            }
            worklist.addAll(graph.dependentsOf(task));
        }
        return closure;
    }

    /**
     * Snapshot of the run's outcome. Tasks without a placement and without a recorded
     * reason are reported as having no feasible window.
     */
    public AllocationResult toResult() {
        List<UnplacedTask> unplaced = new ArrayList<>();
        for (Task task : arena) {
            if (!isCompleted(task)) {
                UnplacedTask failure = failures.get(task.getId());
                unplaced.add(failure != null ? failure
                        : new UnplacedTask(task.getId(), UnplacedReason.NO_FEASIBLE_WINDOW,
                        "no strategy found a window"));
            }
        }
        return new AllocationResult(arena, List.copyOf(placed), unplaced, grid);
    }
}
