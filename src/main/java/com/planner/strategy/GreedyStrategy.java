package com.planner.strategy;

import com.planner.allocator.AllocationContext;
import com.planner.allocator.FixedTaskPlacer;
import com.planner.allocator.SlotPlacer;
import com.planner.allocator.UnplacedReason;
import com.planner.core.Task;
import com.planner.priority.TaskOrderer;
import com.planner.priority.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy placement over the processing queue.
 * <p>
 * The highest-priority task is taken from the queue. If some dependency is not placed
 * yet, the task goes to the back of the queue; otherwise it is placed at its earliest
 * feasible window, evicting lower-priority tasks when nothing is free. A fixed task whose
 * insertion was postponed gets its own window first. The loop ends when the queue is
 * empty or a full pass over it made no progress.
 */
public class GreedyStrategy implements AllocationStrategy {

    private static final Logger log = LoggerFactory.getLogger(GreedyStrategy.class);

    private final TaskOrderer orderer;

    public GreedyStrategy(TaskOrderer orderer) {
        this.orderer = orderer != null ? orderer : new TaskOrderer();
    }

    @Override
    public String getName() {
        return StrategyType.GREEDY.name();
    }

    @Override
    public void allocate(AllocationContext context) {
        SlotPlacer placer = new SlotPlacer(context);
        FixedTaskPlacer fixedPlacer = new FixedTaskPlacer(placer);
        TaskQueue queue = orderer.order(context.pendingTasks());

        int placed = 0;
        int stalled = 0;
        while (!queue.isEmpty() && stalled < queue.size()) {
            Task task = queue.pollHighest().orElseThrow();
            if (context.isCompleted(task) || context.isTerminallyFailed(task)) {
                stalled = 0;
                continue;
            }
            if (!context.dependenciesReady(task)) {
                queue.defer(task);
                stalled++;
                continue;
            }
            stalled = 0;

            boolean ok = task.isFixed() ? insertFixed(fixedPlacer, context, task) : placer.place(task, true);
            if (ok) {
                placed++;
            }
        }

        for (Task waiting : queue.remaining()) {
            if (!context.isCompleted(waiting) && !context.isTerminallyFailed(waiting)) {
                context.reportFailure(waiting, UnplacedReason.DEPENDENCY_UNSATISFIED,
                        "waiting on " + context.missingDependencies(waiting));
            }
        }
        log.debug("Greedy placed {} task(s), {} left waiting on dependencies", placed, queue.size());
    }

    private static boolean insertFixed(FixedTaskPlacer fixedPlacer, AllocationContext context, Task task) {
        fixedPlacer.insert(task);
        return context.isCompleted(task);
    }
}
