package com.planner.strategy;

import com.planner.allocator.AllocationResult;
import com.planner.allocator.DefaultSlotAllocator;
import com.planner.allocator.UnplacedReason;
import com.planner.config.AllocationConfig;
import com.planner.config.GridConfig;
import com.planner.config.PlannerConfig;
import com.planner.core.Task;
import com.planner.core.TimeWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BacktrackingStrategy on a 09:00-11:00 grid without breaks.
 */
class BacktrackingStrategyTest {

    private static final GridConfig TWO_HOURS = GridConfig.withoutBreaks(540, 660);

    private static AllocationResult allocate(int maxSteps, List<Task> tasks) {
        AllocationConfig allocation = new AllocationConfig(
                List.of(StrategyType.BACKTRACKING), new AllocationConfig.BacktrackingConfig(maxSteps));
        return new DefaultSlotAllocator(PlannerConfig.of(TWO_HOURS).withAllocation(allocation)).allocate(tasks);
    }

    private static List<Task> competingDeadlines() {
        return List.of(
                Task.builder("A").priority(5).duration(60).deadline(660).build(),
                Task.builder("B").priority(3).duration(60).deadline(600).build());
    }

    @Test
    @DisplayName("Search finds the order that fits both deadlines")
    void searchFindsFeasibleOrder() {
        AllocationResult result = allocate(100_000, competingDeadlines());

        assertTrue(result.isComplete());
        assertEquals(new TimeWindow(540, 600), result.find("B").orElseThrow().getAssignedWindow().orElseThrow());
        assertEquals(new TimeWindow(600, 660), result.find("A").orElseThrow().getAssignedWindow().orElseThrow());
    }

    @Test
    @DisplayName("Step budget keeps the best partial assignment")
    void budgetKeepsBestPartial() {
        AllocationResult result = allocate(1, competingDeadlines());

        assertEquals(List.of("A"), result.getPlaced().stream().map(Task::getId).toList());
        assertEquals(UnplacedReason.SEARCH_EXHAUSTED, result.unplacedReport("B").orElseThrow().reason());
    }

    @Test
    @DisplayName("Dependencies are placed before their dependents")
    void dependenciesFirst() {
        List<Task> tasks = List.of(
                Task.builder("report").priority(1).duration(30).dependsOn("data").build(),
                Task.builder("data").duration(30).build());

        AllocationResult result = allocate(1_000, tasks);

        assertTrue(result.isComplete());
        assertEquals(new TimeWindow(540, 570), result.find("data").orElseThrow().getAssignedWindow().orElseThrow());
        assertEquals(new TimeWindow(570, 600), result.find("report").orElseThrow().getAssignedWindow().orElseThrow());
    }

    @Test
    @DisplayName("Tasks without any window are left out of the search")
    void hopelessTaskDoesNotBlockOthers() {
        List<Task> tasks = List.of(
                Task.builder("blocker").fixed(540, 560).build(),
                Task.builder("huge").priority(9).duration(90).deadline(640).build(),
                Task.builder("small").duration(30).build());

        AllocationResult result = allocate(1_000, tasks);

        assertEquals(List.of("blocker", "small"), result.getPlaced().stream().map(Task::getId).toList());
        assertEquals(new TimeWindow(560, 590), result.find("small").orElseThrow().getAssignedWindow().orElseThrow());
        assertEquals(UnplacedReason.NO_FEASIBLE_WINDOW, result.unplacedReport("huge").orElseThrow().reason());
    }

    @Test
    @DisplayName("Search order: priority, then earliest deadline, then longest")
    void searchOrder() {
        Task low = Task.builder("low").priority(1).duration(10).build();
        Task noDeadline = Task.builder("noDeadline").priority(5).duration(10).build();
        Task late = Task.builder("late").priority(5).duration(10).deadline(900).build();
        Task soonShort = Task.builder("soonShort").priority(5).duration(10).deadline(700).build();
        Task soonLong = Task.builder("soonLong").priority(5).duration(40).deadline(700).build();

        List<Task> sorted = new ArrayList<>(List.of(low, noDeadline, late, soonShort, soonLong));
        sorted.sort(BacktrackingStrategy.SEARCH_ORDER);

        assertEquals(List.of(soonLong, soonShort, late, noDeadline, low), sorted);
    }

    @Test
    @DisplayName("Step budget must be positive")
    void invalidBudget() {
        assertThrows(IllegalArgumentException.class, () -> new BacktrackingStrategy(0));
        assertEquals(10, new BacktrackingStrategy(10).getMaxSteps());
    }
}
