package com.planner.strategy;

import com.planner.allocator.AllocationContext;
import com.planner.allocator.SlotPlacer;
import com.planner.allocator.SlotSpan;
import com.planner.allocator.UnplacedReason;
import com.planner.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first search over the tasks no earlier phase could place.
 * <p>
 * At each node every ready remaining task is tried at every left-justified free start
 * in its feasible window. A state is the set of tentative (task, start slot) placements;
 * states proven unable to complete are memoized. When the search fails or runs out of
 * steps, all tentative placements are undone and the largest consistent partial
 * assignment seen is applied instead.
 */
public class BacktrackingStrategy implements AllocationStrategy {

    private static final Logger log = LoggerFactory.getLogger(BacktrackingStrategy.class);

    /**
     * Search order: priority descending, earliest deadline first (none last),
     * longest task first.
     */
    static final Comparator<Task> SEARCH_ORDER = Comparator
            .comparingInt(Task::getPriority).reversed()
            .thenComparingInt((Task t) -> t.getDeadline().orElse(Integer.MAX_VALUE))
            .thenComparing(Comparator.comparingInt((Task t) -> t.requiredMinutes().orElse(0)).reversed());

    private final int maxSteps;

    public BacktrackingStrategy(int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    @Override
    public String getName() {
        return StrategyType.BACKTRACKING.name();
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    @Override
    public void allocate(AllocationContext context) {
        List<Task> remaining = new ArrayList<>();
        for (Task task : context.pendingTasks()) {
            if (task.requiredMinutes().isPresent()) {
                remaining.add(task);
            }
        }
        if (remaining.isEmpty()) {
            return;
        }
        remaining = withoutHopeless(context, remaining);
        if (remaining.isEmpty()) {
            return;
        }
        remaining.sort(SEARCH_ORDER);
        remaining = context.getGraph().topologicalOrder(remaining);

        Search search = new Search(context, remaining);
        boolean complete = search.run();
        if (complete) {
            markMovedFixedTasks(search.current.keySet());
            log.debug("Backtracking placed all {} remaining task(s) in {} step(s)", remaining.size(), search.steps);
            return;
        }

        for (Map.Entry<Task, SlotSpan> entry : search.best.entrySet()) {
            context.commit(entry.getKey(), entry.getValue());
        }
        markMovedFixedTasks(search.best.keySet());
        log.debug("Backtracking {} after {} step(s); applied best partial assignment of {} task(s)",
                search.budgetHit ? "ran out of steps" : "exhausted the search space",
                search.steps, search.best.size());

        for (Task task : remaining) {
            if (context.isCompleted(task)) {
                continue;
            }
            if (!context.dependenciesReady(task)) {
                context.reportFailure(task, UnplacedReason.DEPENDENCY_UNSATISFIED,
                        "waiting on " + context.missingDependencies(task));
            } else {
                context.reportFailure(task, UnplacedReason.SEARCH_EXHAUSTED,
                        search.budgetHit
                                ? "search stopped after " + maxSteps + " steps"
                                : "no combination of windows fits");
            }
        }
    }

    private static void markMovedFixedTasks(Collection<Task> placed) {
        for (Task task : placed) {
            if (task.isFixed() && !task.isPinned()) {
                task.markRescheduled();
            }
        }
    }

    /**
     * Drop tasks that cannot be placed whatever the search does: ready tasks without any
     * free window (free space only shrinks during the search), and tasks depending on a
     * task that is neither placed nor searched.
     */
    private static List<Task> withoutHopeless(AllocationContext context, List<Task> tasks) {
        SlotPlacer placer = new SlotPlacer(context);
        Set<Task> searchable = new LinkedHashSet<>(tasks);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Task task : List.copyOf(searchable)) {
                if (context.dependenciesReady(task)) {
                    if (placer.candidateSpans(task).isEmpty()) {
                        searchable.remove(task);
                        if (context.failureOf(task).isEmpty()) {
                            context.reportFailure(task, UnplacedReason.NO_FEASIBLE_WINDOW,
                                    "no free window from slot " + context.earliestStartIndex(task)
                                            + " that meets its ceiling and deadline");
                        }
                        changed = true;
                    }
                    continue;
                }
                for (Task dep : context.getGraph().dependenciesOf(task)) {
                    if (!context.isCompleted(dep) && !searchable.contains(dep)) {
                        searchable.remove(task);
                        context.reportFailure(task, UnplacedReason.DEPENDENCY_UNSATISFIED,
                                "waiting on " + context.missingDependencies(task));
                        changed = true;
                        break;
                    }
                }
            }
        }
        return new ArrayList<>(searchable);
    }

    /**
     * State of one search.
     */
    private final class Search {

        private final AllocationContext context;
        private final SlotPlacer placer;
        private final List<Task> tasks;
        private final Set<List<Long>> failedStates = new HashSet<>();
        private final LinkedHashMap<Task, SlotSpan> current = new LinkedHashMap<>();

        private Map<Task, SlotSpan> best = new LinkedHashMap<>();
        private int steps;
        private boolean budgetHit;

        Search(AllocationContext context, List<Task> tasks) {
            this.context = context;
            this.placer = new SlotPlacer(context);
            this.tasks = tasks;
        }

        boolean run() {
            boolean complete = descend();
            if (!complete) {
                // unwinding released every tentative placement
                current.clear();
            }
            return complete;
        }

        private boolean descend() {
            if (current.size() == tasks.size()) {
                return true;
            }
            if (++steps > maxSteps) {
                budgetHit = true;
                return false;
            }
            List<Long> state = stateKey();
            if (failedStates.contains(state)) {
                return false;
            }

            for (Task task : tasks) {
                if (current.containsKey(task) || !context.dependenciesReady(task)) {
                    continue;
                }
                for (SlotSpan span : placer.candidateSpans(task)) {
                    context.commit(task, span);
                    current.put(task, span);
                    if (current.size() > best.size()) {
                        best = new LinkedHashMap<>(current);
                    }
                    if (descend()) {
                        return true;
                    }
                    current.remove(task);
                    context.release(task);
                    if (budgetHit) {
                        return false;
                    }
                }
            }

            failedStates.add(state);
            log.trace("Dead end with {} tentative placement(s)", current.size());
            return false;
        }

        private List<Long> stateKey() {
            List<Long> key = new ArrayList<>(current.size());
            for (Map.Entry<Task, SlotSpan> entry : current.entrySet()) {
                key.add(((long) context.handleOf(entry.getKey()) << 32) | entry.getValue().start());
            }
            Collections.sort(key);
            return key;
        }
    }
}
