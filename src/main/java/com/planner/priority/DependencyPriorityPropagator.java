package com.planner.priority;

import com.planner.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Raises the priority of every dependency to at least the priority of its dependents,
 * transitively.
 * <p>
 * Each task starts one walk over its dependency closure with its current priority as
 * the floor. The walk is an explicit worklist with its own visited set, and the graph
 * is checked for cycles before any priority changes, so a cyclic input fails fast
 * instead of looping.
 */
public class DependencyPriorityPropagator {

    private static final Logger log = LoggerFactory.getLogger(DependencyPriorityPropagator.class);

    /**
     * Propagate priorities in place.
     *
     * @param graph dependency graph of the run
     * @return number of tasks whose priority was raised
     * @throws com.planner.exception.DependencyCycleException if the graph has a cycle
     */
    public int propagate(DependencyGraph graph) {
        graph.checkAcyclic();

        int boosted = 0;
        for (Task task : graph.getTasks()) {
            Set<String> unknown = graph.unknownDependencies(task);
            if (!unknown.isEmpty()) {
                log.warn("Task {} depends on unknown task(s) {}, ignoring them for propagation",
                        task.getId(), unknown);
            }
            boosted += raiseClosure(graph, task);
        }

        log.debug("Priority propagation raised {} task priorities across {} tasks",
                boosted, graph.getTasks().size());
        return boosted;
    }

    private int raiseClosure(DependencyGraph graph, Task root) {
        int floor = root.getPriority();
        int boosted = 0;
        Deque<Task> worklist = new ArrayDeque<>(graph.dependenciesOf(root));
        Set<String> visited = new HashSet<>();

        while (!worklist.isEmpty()) {
            Task dep = worklist.poll();
            if (!visited.add(dep.getId())) {
                continue;
            }
            if (dep.getPriority() < floor) {
                log.debug("Boosting {} priority {} -> {} (required by {})",
                        dep.getId(), dep.getPriority(), floor, root.getId());
                dep.setPriority(floor);
                boosted++;
            }
            for (Task next : graph.dependenciesOf(dep)) {
                if (!visited.contains(next.getId())) {
                    worklist.add(next);
                }
            }
        }
        return boosted;
    }
}
