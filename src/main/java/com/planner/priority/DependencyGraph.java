package com.planner.priority;

import com.planner.core.Task;
import com.planner.exception.DependencyCycleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency edges between the tasks of one run.
 * <p>
 * Edges point from a task to the tasks it depends on. Identifiers that do not name a
 * task in the set are kept aside as unknown dependencies and never traversed.
 */
public class DependencyGraph {

    private final Map<String, Task> tasksById;
    private final Map<String, List<Task>> dependents;

    public DependencyGraph(Collection<Task> tasks) {
        this.tasksById = new LinkedHashMap<>();
        for (Task task : tasks) {
            if (tasksById.putIfAbsent(task.getId(), task) != null) {
                throw new IllegalArgumentException("Duplicate task id: " + task.getId());
            }
        }
        this.dependents = new HashMap<>();
        for (Task task : tasksById.values()) {
            for (String depId : task.getDependencies()) {
                if (tasksById.containsKey(depId)) {
                    dependents.computeIfAbsent(depId, k -> new ArrayList<>()).add(task);
                }
            }
        }
    }

    public Collection<Task> getTasks() {
        return Collections.unmodifiableCollection(tasksById.values());
    }

    public Task get(String id) {
        return tasksById.get(id);
    }

    public boolean contains(String id) {
        return tasksById.containsKey(id);
    }

    /**
     * Direct dependencies of a task that exist in the set.
     */
    public List<Task> dependenciesOf(Task task) {
        List<Task> result = new ArrayList<>(task.getDependencies().size());
        for (String depId : task.getDependencies()) {
            Task dep = tasksById.get(depId);
            if (dep != null) {
                result.add(dep);
            }
        }
        return result;
    }

    /**
     * Tasks that list the given task as a direct dependency.
     */
    public List<Task> dependentsOf(Task task) {
        return dependents.getOrDefault(task.getId(), List.of());
    }

    /**
     * Dependency identifiers of the task that name no task in the set.
     */
    public Set<String> unknownDependencies(Task task) {
        Set<String> unknown = new LinkedHashSet<>();
        for (String depId : task.getDependencies()) {
            if (!tasksById.containsKey(depId)) {
                unknown.add(depId);
            }
        }
        return unknown;
    }

    /**
     * Verify the graph is acyclic.
     *
     * @throws DependencyCycleException naming the first cycle found
     */
    public void checkAcyclic() {
        Set<String> visited = new HashSet<>();
        for (Task task : tasksById.values()) {
            if (!visited.contains(task.getId())) {
                List<String> cycle = findCycle(task, visited);
                if (cycle != null) {
                    throw new DependencyCycleException(cycle);
                }
            }
        }
    }

    /**
     * Depth-first walk from the root with an explicit stack; the path holds the tasks
     * currently on the stack.
     */
    private List<String> findCycle(Task root, Set<String> visited) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();

        visited.add(root.getId());
        onPath.add(root.getId());
        path.add(root.getId());
        stack.push(new Frame(root, dependenciesOf(root).iterator()));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.dependencies().hasNext()) {
                stack.pop();
                path.remove(path.size() - 1);
                onPath.remove(frame.task().getId());
                continue;
            }
            Task dep = frame.dependencies().next();
            String depId = dep.getId();
            if (onPath.contains(depId)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(depId), path.size()));
                cycle.add(depId);
                return cycle;
            }
            if (visited.add(depId)) {
                onPath.add(depId);
                path.add(depId);
                stack.push(new Frame(dep, dependenciesOf(dep).iterator()));
            }
        }
        return null;
    }

    /**
     * Order a subset so that dependencies come before their dependents.
     * Edges leaving the subset are ignored; otherwise the given order is kept.
     * The graph must be acyclic.
     */
    public List<Task> topologicalOrder(Collection<Task> subset) {
        Set<String> members = new HashSet<>();
        for (Task task : subset) {
            members.add(task.getId());
        }
        List<Task> ordered = new ArrayList<>(subset.size());
        Set<String> emitted = new HashSet<>();
        for (Task task : subset) {
            emit(task, members, emitted, ordered);
        }
        return ordered;
    }

    private void emit(Task root, Set<String> members, Set<String> emitted, List<Task> ordered) {
        if (!emitted.add(root.getId())) {
            return;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, dependenciesOf(root).iterator()));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.dependencies().hasNext()) {
                ordered.add(stack.pop().task());
                continue;
            }
            Task dep = frame.dependencies().next();
            if (members.contains(dep.getId()) && emitted.add(dep.getId())) {
                stack.push(new Frame(dep, dependenciesOf(dep).iterator()));
            }
        }
    }

    /**
     * A task on the walk stack and its dependencies still to visit.
     */
    private record Frame(Task task, Iterator<Task> dependencies) {}
}
