package com.planner.priority;

import com.planner.core.Task;
import com.planner.exception.DependencyCycleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DependencyPriorityPropagator.
 */
class DependencyPriorityPropagatorTest {

    private DependencyPriorityPropagator propagator;

    @BeforeEach
    void setUp() {
        propagator = new DependencyPriorityPropagator();
    }

    @Test
    @DisplayName("Dependency is raised to its dependent's priority")
    void dependencyRaised() {
        Task a = Task.builder("A").priority(3).build();
        Task b = Task.builder("B").priority(5).dependsOn("A").build();

        int boosted = propagator.propagate(new DependencyGraph(List.of(a, b)));

        assertEquals(5, a.getPriority());
        assertEquals(5, b.getPriority());
        assertEquals(1, boosted);
    }

    @Test
    @DisplayName("Higher-priority dependency is left alone")
    void higherDependencyUnchanged() {
        Task a = Task.builder("A").priority(9).build();
        Task b = Task.builder("B").priority(5).dependsOn("A").build();

        assertEquals(0, propagator.propagate(new DependencyGraph(List.of(a, b))));
        assertEquals(9, a.getPriority());
        assertEquals(5, b.getPriority());
    }

    @Test
    @DisplayName("Propagation is transitive")
    void transitive() {
        Task a = Task.builder("A").priority(2).build();
        Task b = Task.builder("B").priority(1).dependsOn("A").build();
        Task c = Task.builder("C").priority(8).dependsOn("B").build();

        propagator.propagate(new DependencyGraph(List.of(a, b, c)));

        assertEquals(8, a.getPriority());
        assertEquals(8, b.getPriority());
    }

    @Test
    @DisplayName("Diamond takes the maximum over all dependents")
    void diamond() {
        Task a = Task.builder("A").priority(0).build();
        Task b = Task.builder("B").priority(4).dependsOn("A").build();
        Task c = Task.builder("C").priority(6).dependsOn("A").build();
        Task d = Task.builder("D").priority(1).dependsOn("B", "C").build();

        propagator.propagate(new DependencyGraph(List.of(a, b, c, d)));

        assertEquals(6, a.getPriority());
        assertEquals(4, b.getPriority());
        assertEquals(6, c.getPriority());
        assertEquals(1, d.getPriority());
    }

    @Test
    @DisplayName("Second propagation changes nothing")
    void idempotent() {
        List<Task> tasks = List.of(
                Task.builder("A").priority(1).build(),
                Task.builder("B").priority(7).dependsOn("A").build(),
                Task.builder("C").priority(3).dependsOn("B").build());
        DependencyGraph graph = new DependencyGraph(tasks);

        assertTrue(propagator.propagate(graph) > 0);
        List<Integer> first = tasks.stream().map(Task::getPriority).toList();

        assertEquals(0, propagator.propagate(graph));
        assertEquals(first, tasks.stream().map(Task::getPriority).toList());
    }

    @Test
    @DisplayName("Cycle fails before any priority changes")
    void cycleFailsFast() {
        Task a = Task.builder("A").priority(1).dependsOn("B").build();
        Task b = Task.builder("B").priority(9).dependsOn("A").build();

        assertThrows(DependencyCycleException.class,
                () -> propagator.propagate(new DependencyGraph(List.of(a, b))));
        assertEquals(1, a.getPriority());
        assertEquals(9, b.getPriority());
    }

    @Test
    @DisplayName("Unknown dependencies are ignored")
    void unknownIgnored() {
        Task a = Task.builder("A").priority(4).dependsOn("ghost").build();

        assertEquals(0, propagator.propagate(new DependencyGraph(List.of(a))));
        assertEquals(4, a.getPriority());
    }
}
