package com.planner.allocator;

import com.planner.config.PlannerConfig;
import com.planner.core.Task;
import com.planner.core.TimeWindow;
import com.planner.grid.WeeklySlotGrid;
import com.planner.priority.DependencyGraph;
import com.planner.priority.DependencyPriorityPropagator;
import com.planner.priority.TaskOrderer;
import com.planner.strategy.AllocationStrategy;
import com.planner.strategy.AllocationStrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Allocator running the full pipeline on a fresh grid per call:
 * propagation, screening, fixed-task insertion, the configured strategies,
 * and a dependency consistency sweep after each strategy.
 */
public class DefaultSlotAllocator implements SlotAllocator {

    private static final Logger log = LoggerFactory.getLogger(DefaultSlotAllocator.class);

    private final PlannerConfig config;
    private final DependencyPriorityPropagator propagator;
    private final TaskOrderer orderer;
    private final List<AllocationStrategy> pipeline;

    public DefaultSlotAllocator(PlannerConfig config) {
        this(config, new DependencyPriorityPropagator(), new TaskOrderer());
    }

    public DefaultSlotAllocator(PlannerConfig config, DependencyPriorityPropagator propagator, TaskOrderer orderer) {
        this.config = config != null ? config : PlannerConfig.defaults();
        this.config.grid().validate();
        this.propagator = propagator;
        this.orderer = orderer;
        this.pipeline = AllocationStrategyFactory.createPipeline(this.config.allocation(), orderer);
        log.info("DefaultSlotAllocator '{}' initialized with pipeline {}", this.config.name(),
                pipeline.stream().map(AllocationStrategy::getName).toList());
    }

    public PlannerConfig getConfig() {
        return config;
    }

    @Override
    public AllocationResult allocate(Collection<Task> tasks) {
        Objects.requireNonNull(tasks, "Tasks cannot be null");
        for (Task task : tasks) {
            task.reset();
        }

        DependencyGraph graph = new DependencyGraph(tasks);
        int boosted = propagator.propagate(graph);

        WeeklySlotGrid grid = WeeklySlotGrid.build(config.grid());
        AllocationContext context = new AllocationContext(grid, graph);
        SlotPlacer placer = new SlotPlacer(context);

        screen(context);

        List<Task> fixed = orderer.sort(tasks).stream().filter(Task::isFixed).toList();
        int pinned = new FixedTaskPlacer(placer).placeAll(fixed);

        for (AllocationStrategy strategy : pipeline) {
            if (context.pendingTasks().isEmpty()) {
                break;
            }
            strategy.allocate(context);
            int swept = sweepDependencies(placer);
            log.debug("Strategy {} done: {} placed, {} pending, {} swept",
                    strategy.getName(), context.getPlaced().size(), context.pendingTasks().size(), swept);
        }

        AllocationResult result = context.toResult();
        log.info("Allocated {} of {} task(s) ({} pinned, {} priority boost(s), {} unplaced)",
                result.getPlaced().size(), result.getTasks().size(), pinned, boosted, result.getUnplaced().size());
        for (UnplacedTask unplaced : result.getUnplaced()) {
            log.warn("Task {} not placed: {} - {}", unplaced.taskId(), unplaced.reason(), unplaced.detail());
        }
        return result;
    }

    /**
     * Record the failures decidable before any placement.
     */
    private void screen(AllocationContext context) {
        WeeklySlotGrid grid = context.getGrid();
        int blockLength = grid.getConfig().workingMinutesPerDay();
        for (Task task : context.getTasks()) {
            Set<String> unknown = context.getGraph().unknownDependencies(task);
            if (!unknown.isEmpty()) {
                context.reportFailure(task, UnplacedReason.MISSING_DEPENDENCY, "unknown dependencies " + unknown);
                continue;
            }
            OptionalInt minutes = task.requiredMinutes();
            if (minutes.isEmpty()) {
                context.reportFailure(task, UnplacedReason.NO_DURATION, "no duration or estimate");
                continue;
            }
            if (minutes.getAsInt() > blockLength) {
                context.reportFailure(task, UnplacedReason.NO_FEASIBLE_WINDOW,
                        minutes.getAsInt() + " minutes do not fit a " + blockLength + " minute working day");
                continue;
            }
            OptionalInt deadline = task.getDeadline();
            // first slot of the week, trailing break included
            int earliestSpanEnd = Math.min(minutes.getAsInt() + context.getBreakDuration(), blockLength);
            int earliestEnd = grid.minuteAt(earliestSpanEnd - 1) + 1;
            if (deadline.isPresent() && deadline.getAsInt() < earliestEnd) {
                context.reportFailure(task, UnplacedReason.DEADLINE_UNREACHABLE,
                        "deadline " + deadline.getAsInt() + " precedes the earliest possible end " + earliestEnd
                                + " of the task and its break");
            }
        }
    }

    /**
     * Evict placed tasks whose dependencies are unplaced or end after they start,
     * together with their placed dependents.
     *
     * @return number of tasks evicted
     */
    private int sweepDependencies(SlotPlacer placer) {
        AllocationContext context = placer.getContext();
        List<Task> violators = new ArrayList<>();
        for (Task task : context.getPlaced()) {
            TimeWindow window = task.getAssignedWindow().orElseThrow();
            for (Task dep : context.getGraph().dependenciesOf(task)) {
                Optional<TimeWindow> depWindow = dep.getAssignedWindow();
                if (depWindow.isEmpty() || depWindow.get().end() > window.start()) {
                    violators.add(task);
                    break;
                }
            }
        }
        if (violators.isEmpty()) {
            return 0;
        }
        Map<Task, SlotSpan> previous = new HashMap<>();
        List<Task> evicted = placer.evict(violators, previous);
        for (Task task : evicted) {
            context.reportFailure(task, UnplacedReason.DEPENDENCY_UNSATISFIED,
                    "dependency order violated, waiting on " + context.missingDependencies(task));
            log.warn("Removed {} from {}: dependency order violated", task.getId(), previous.get(task));
        }
        return evicted.size();
    }
}
