package com.planner.allocator;

import com.planner.core.Task;
import com.planner.grid.WeeklySlotGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Places flexible tasks into the earliest feasible window and resolves conflicts by eviction.
 * <p>
 * Rules:
 * - A window is the task slots (one working block) plus the trailing break slots
 * - Start must not precede the end of any dependency; task slots must end by the start
 *   of every placed dependent, and the whole window, break included, by the deadline
 * - Start indices are scanned in ascending order; the first window that is free, or
 *   whose occupants may all be evicted, is taken
 * - Breaks are never evicted
 * - A task held at its fixed window can only be evicted by a fixed task of strictly
 *   higher priority; other placements yield to fixed tasks and to strictly higher priorities
 * - Evicted tasks take their placed dependents with them, and the rule above applies
 *   to every task leaving the grid
 * - Evicted tasks are re-placed in dependency order; fixed ones try their own window first
 */
public class SlotPlacer {

    private static final Logger log = LoggerFactory.getLogger(SlotPlacer.class);

    private final AllocationContext context;
    private final WeeklySlotGrid grid;

    public SlotPlacer(AllocationContext context) {
        this.context = context;
        this.grid = context.getGrid();
    }

    public AllocationContext getContext() {
        return context;
    }

    /**
     * Place a flexible task at the earliest feasible window.
     *
     * @param task          Task to place; must not be placed already
     * @param allowEviction Whether lower-priority occupants may be moved out of the way
     * @return true if placed; otherwise a failure is recorded in the context
     */
    public boolean place(Task task, boolean allowEviction) {
        if (task.requiredMinutes().isEmpty()) {
            context.reportFailure(task, UnplacedReason.NO_DURATION, "no duration or estimate");
            return false;
        }
        if (!context.dependenciesReady(task)) {
            context.reportFailure(task, UnplacedReason.DEPENDENCY_UNSATISFIED,
                    "waiting on " + context.missingDependencies(task));
            return false;
        }

        int floor = context.earliestStartIndex(task);
        int ceiling = context.dependentsCeiling(task);

        Optional<Conflict> window = allowEviction
                ? findWindow(task, floor, ceiling)
                : findFreeWindow(task, floor, ceiling).map(span -> new Conflict(span, Set.of()));
        if (window.isEmpty()) {
            String detail = "no window from slot " + floor + " ending by minute " + ceiling;
            if (task.getDeadline().isPresent()) {
                detail += ", break included by deadline " + task.getDeadline().getAsInt();
            }
            context.reportFailure(task, UnplacedReason.NO_FEASIBLE_WINDOW, detail);
            return false;
        }

        Conflict found = window.get();
        if (found.occupants().isEmpty()) {
            context.commit(task, found.span());
        } else {
            evictAndCommit(task, found.span(), found.occupants());
        }
        return true;
    }

    /**
     * Earliest free span in the feasible window, scanning start indices in ascending order.
     *
     * @param ceiling latest end of the task slots, from {@link AllocationContext#dependentsCeiling}
     */
    public Optional<SlotSpan> findFreeWindow(Task task, int floor, int ceiling) {
        int start = floor;
        while (start < grid.size()) {
            Optional<SlotSpan> candidate = context.spanAt(task, start);
            if (candidate.isEmpty()) {
                start = grid.blockEnd(start);
                continue;
            }
            SlotSpan span = candidate.get();
            if (context.endsTooLate(task, span, ceiling)) {
                break;
            }
            int lastOccupied = lastOccupied(span.start(), span.end());
            if (lastOccupied < 0) {
                return Optional.of(span);
            }
            start = lastOccupied + 1;
        }
        return Optional.empty();
    }

    /**
     * Left-justified free spans in the feasible window: starts at the floor, at the start of
     * a working block, or right after an occupied slot.
     */
    public List<SlotSpan> candidateSpans(Task task) {
        List<SlotSpan> result = new ArrayList<>();
        if (task.requiredMinutes().isEmpty()) {
            return result;
        }
        int floor = context.earliestStartIndex(task);
        int ceiling = context.dependentsCeiling(task);
        int start = floor;
        while (start < grid.size()) {
            Optional<SlotSpan> free = findFreeWindow(task, start, ceiling);
            if (free.isEmpty()) {
                break;
            }
            SlotSpan span = free.get();
            result.add(span);
            // skip to the end of this free run
            int next = span.start() + 1;
            while (next < grid.size() && next < grid.blockEnd(span.start()) && grid.slot(next).isFree()) {
                next++;
            }
            start = next;
        }
        return result;
    }

    private int lastOccupied(int from, int to) {
        for (int i = to - 1; i >= from; i--) {
            if (grid.slot(i).isOccupied()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Earliest span that is free or whose occupants the requester may all evict.
     * Free spans come back with no occupants.
     */
    Optional<Conflict> findWindow(Task task, int floor, int ceiling) {
        for (int start = floor; start < grid.size(); start++) {
            Optional<SlotSpan> candidate = context.spanAt(task, start);
            if (candidate.isEmpty()) {
                start = grid.blockEnd(start) - 1;
                continue;
            }
            SlotSpan span = candidate.get();
            if (context.endsTooLate(task, span, ceiling)) {
                break;
            }
            Optional<Set<Task>> occupants = context.occupantsIn(span.start(), span.end());
            if (occupants.isEmpty()) {
                continue;
            }
            Set<Task> blocking = occupants.get();
            if (blocking.isEmpty()) {
                return Optional.of(new Conflict(span, blocking));
            }
            if (allEvictable(task, false, blocking)) {
                log.trace("Evictable window for {} at slot {}: {}", task.getId(), start, ids(blocking));
                return Optional.of(new Conflict(span, blocking));
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the requester may evict the occupants together with their placed dependents.
     */
    boolean allEvictable(Task requester, boolean requesterPinned, Collection<Task> occupants) {
        for (Task victim : context.withPlacedDependents(occupants)) {
            if (!canEvict(requester, requesterPinned, victim)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether the requester may move the occupant out of its current placement.
     */
    public static boolean canEvict(Task requester, boolean requesterPinned, Task occupant) {
        if (occupant == requester) {
            return false;
        }
        if (occupant.isPinned()) {
            return requesterPinned && requester.getPriority() > occupant.getPriority();
        }
        return requesterPinned || requester.getPriority() > occupant.getPriority();
    }

    /**
     * Evict the occupants (with their placed dependents), commit the requester in the freed
     * span, then re-place the evicted tasks.
     */
    void evictAndCommit(Task requester, SlotSpan span, Collection<Task> occupants) {
        Map<Task, SlotSpan> previous = new HashMap<>();
        List<Task> evicted = evict(occupants, previous);
        log.debug("{} evicted {} to take slots [{}, {})",
                requester.getId(), ids(evicted), span.start(), span.end());

        if (!grid.isFree(span.start(), span.end())) {
            throw new IllegalStateException("Span [" + span.start() + ", " + span.end()
                    + ") still occupied after evicting " + ids(evicted));
        }
        context.commit(requester, span);
        replaceEvicted(evicted, previous);
    }

    /**
     * Release the victims and every placed task depending on them.
     *
     * @param victims  tasks to evict
     * @param previous receives the span each evicted task held
     * @return evicted tasks, dependencies before dependents
     */
    List<Task> evict(Collection<Task> victims, Map<Task, SlotSpan> previous) {
        Set<Task> closure = context.withPlacedDependents(victims);
        List<Task> ordered = context.getGraph().topologicalOrder(closure);
        for (Task task : ordered) {
            previous.put(task, context.release(task));
        }
        return ordered;
    }

    /**
     * Re-place evicted tasks. A fixed task first tries its own window; a task that fits
     * nowhere goes back to its old span if that is still valid, otherwise it is reported as
     * an eviction deadlock and its slots stay free.
     */
    void replaceEvicted(List<Task> evicted, Map<Task, SlotSpan> previous) {
        for (Task task : evicted) {
            if (context.isCompleted(task)) {
                continue;
            }
            if (task.isFixed()) {
                if (new FixedTaskPlacer(this).insert(task)) {
                    log.debug("Returned {} to its fixed window {}", task.getId(), task.getAssignedWindow().orElseThrow());
                    continue;
                }
                if (context.isCompleted(task)) {
                    continue;
                }
                if (!context.dependenciesReady(task)) {
                    context.reportFailure(task, UnplacedReason.DEPENDENCY_UNSATISFIED,
                            "waiting on " + context.missingDependencies(task));
                }
            } else if (place(task, true)) {
                task.markRescheduled();
                log.debug("Rescheduled {} to {}", task.getId(), task.getAssignedWindow().orElseThrow());
                continue;
            }
            SlotSpan old = previous.get(task);
            if (old != null && context.dependenciesReady(task) && context.fitsAt(task, old)) {
                context.commit(task, old);
                log.debug("Restored {} to its previous window {}", task.getId(), task.getAssignedWindow().orElseThrow());
                continue;
            }
            UnplacedReason cause = context.failureOf(task).map(UnplacedTask::reason).orElse(null);
            if (cause == UnplacedReason.DEPENDENCY_UNSATISFIED) {
                log.warn("Evicted task {} lost its dependency and was not re-placed", task.getId());
            } else {
                context.reportFailure(task, UnplacedReason.EVICTION_DEADLOCK,
                        "evicted from slots [" + (old != null ? old.start() + ", " + old.end() : "?")
                                + ") and no other window fits");
                log.warn("Eviction deadlock: {} could not be re-placed or restored", task.getId());
            }
        }
    }

    private static List<String> ids(Collection<Task> tasks) {
        return tasks.stream().map(Task::getId).toList();
    }

    /**
     * A span and the tasks that must leave it; empty when the span is free.
     */
    record Conflict(SlotSpan span, Set<Task> occupants) {}
}
