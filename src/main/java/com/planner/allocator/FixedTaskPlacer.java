package com.planner.allocator;

import com.planner.core.Task;
import com.planner.core.TimeWindow;
import com.planner.grid.WeeklySlotGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Inserts tasks with caller-supplied windows before any flexible placement.
 * <p>
 * For each fixed task, in processing order:
 * - Window outside working hours: left unscheduled
 * - Window plus trailing break past the deadline, or overlapping a break: handed to
 *   greedy placement
 * - Window blocked by tasks this task may evict, together with their placed dependents:
 *   they are evicted, the task is pinned, the evicted tasks are re-placed and marked
 *   rescheduled
 * - Window blocked otherwise: handed to greedy placement
 * Tasks handed to greedy placement whose dependencies are not placed yet are left for
 * the flexible phase.
 */
public class FixedTaskPlacer {

    private static final Logger log = LoggerFactory.getLogger(FixedTaskPlacer.class);

    private final AllocationContext context;
    private final SlotPlacer placer;
    private final WeeklySlotGrid grid;

    public FixedTaskPlacer(SlotPlacer placer) {
        this.placer = placer;
        this.context = placer.getContext();
        this.grid = context.getGrid();
    }

    public AllocationContext getContext() {
        return context;
    }

    /**
     * Insert the fixed tasks in the given order. Flexible tasks in the list are ignored.
     *
     * @return number of tasks pinned at their own window
     */
    public int placeAll(List<Task> ordered) {
        int pinned = 0;
        for (Task task : ordered) {
            if (!task.isFixed() || context.isCompleted(task) || context.isTerminallyFailed(task)) {
                continue;
            }
            if (insert(task)) {
                pinned++;
            }
        }
        log.debug("Fixed-task insertion pinned {} task(s)", pinned);
        return pinned;
    }

    /**
     * Insert one fixed task.
     *
     * @return true if the task now sits at its own fixed window
     */
    public boolean insert(Task task) {
        TimeWindow window = task.getFixedWindow().orElseThrow();

        Optional<SlotSpan> located = locate(task, window);
        if (located.isEmpty()) {
            context.reportFailure(task, UnplacedReason.OUTSIDE_WORKING_HOURS,
                    "fixed window " + window + " is not inside working hours");
            log.warn("Fixed task {} window {} lies outside working hours", task.getId(), window);
            return false;
        }
        SlotSpan span = located.get();

        OptionalInt deadline = task.getDeadline();
        if (deadline.isPresent() && context.spanEndMinute(span) > deadline.getAsInt()) {
            log.debug("Fixed task {} and its break end after its deadline {}, relocating",
                    task.getId(), deadline.getAsInt());
            relocate(task);
            return false;
        }

        Optional<Set<Task>> occupants = context.occupantsIn(span.start(), span.end());
        if (occupants.isEmpty()) {
            log.debug("Fixed task {} window {} overlaps a break, relocating", task.getId(), window);
            relocate(task);
            return false;
        }

        Set<Task> conflicts = new LinkedHashSet<>(occupants.get());
        conflicts.addAll(misorderedNeighbours(task, window));
        if (conflicts.isEmpty()) {
            context.commit(task, span);
            return true;
        }

        if (placer.allEvictable(task, true, conflicts)) {
            placer.evictAndCommit(task, span, conflicts);
            return true;
        }

        log.debug("Fixed task {} window {} held by {}, relocating", task.getId(), window,
                conflicts.stream().map(Task::getId).toList());
        relocate(task);
        return false;
    }

    /**
     * Grid span of a fixed window, if every minute of it is a working minute of one block.
     */
    private Optional<SlotSpan> locate(Task task, TimeWindow window) {
        OptionalInt first = grid.indexOf(window.start());
        OptionalInt last = grid.indexOf(window.end() - 1);
        if (first.isEmpty() || last.isEmpty()) {
            return Optional.empty();
        }
        if (last.getAsInt() - first.getAsInt() != window.length() - 1) {
            return Optional.empty();
        }
        return context.spanAt(task, first.getAsInt());
    }

    /**
     * Placed dependencies ending after the window starts, and placed dependents starting
     * before it ends.
     */
    private Set<Task> misorderedNeighbours(Task task, TimeWindow window) {
        Set<Task> result = new LinkedHashSet<>();
        for (Task dep : context.getGraph().dependenciesOf(task)) {
            dep.getAssignedWindow()
                    .filter(w -> w.end() > window.start())
                    .ifPresent(w -> result.add(dep));
        }
        for (Task dependent : context.getGraph().dependentsOf(task)) {
            dependent.getAssignedWindow()
                    .filter(w -> w.start() < window.end())
                    .ifPresent(w -> result.add(dependent));
        }
        return result;
    }

    private void relocate(Task task) {
        if (!context.dependenciesReady(task)) {
            log.debug("Fixed task {} waits for {} before relocation", task.getId(),
                    context.missingDependencies(task));
            return;
        }
        if (placer.place(task, true)) {
            task.markRescheduled();
            log.info("Fixed task {} relocated from {} to {}", task.getId(),
                    task.getFixedWindow().orElseThrow(), task.getAssignedWindow().orElseThrow());
        }
    }
}
