package com.planner.allocator;

import com.planner.config.AllocationConfig;
import com.planner.config.GridConfig;
import com.planner.config.PlannerConfig;
import com.planner.core.Task;
import com.planner.core.TaskSetReader;
import com.planner.core.TimeWindow;
import com.planner.exception.DependencyCycleException;
import com.planner.grid.WeeklySlotGrid;
import com.planner.strategy.StrategyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultSlotAllocator: the full pipeline from propagation to the result report.
 */
class DefaultSlotAllocatorTest {

    /**
     * 09:00-17:00 every day, no breaks.
     */
    private static final GridConfig NINE_TO_FIVE = GridConfig.withoutBreaks(540, 1020);

    private static DefaultSlotAllocator allocator(GridConfig grid) {
        return new DefaultSlotAllocator(PlannerConfig.of(grid));
    }

    private static TimeWindow windowOf(AllocationResult result, String id) {
        return result.find(id).orElseThrow().getAssignedWindow().orElseThrow();
    }

    // =====================================================================
    // Placement invariants
    // =====================================================================

    @Test
    @DisplayName("Sample week satisfies every placement invariant")
    void sampleWeekInvariants() throws Exception {
        List<Task> tasks;
        try (InputStream in = getClass().getResourceAsStream("/sample-tasks.json")) {
            tasks = TaskSetReader.read(in);
        }

        AllocationResult result = allocator(GridConfig.defaults()).allocate(tasks);

        assertEquals(tasks.size(), result.getPlaced().size() + result.getUnplaced().size());
        assertEquals(UnplacedReason.NO_DURATION, result.unplacedReport("inbox-zero").orElseThrow().reason());
        assertEquals(tasks.size() - 1, result.getPlaced().size());
        assertTrue(result.find("team-sync").orElseThrow().isPinned());
        assertTrue(result.find("gym").orElseThrow().isPinned());

        assertInvariants(result);
    }

    @Test
    @DisplayName("Dependencies end before dependents start")
    void dependencyOrder() {
        Task a = Task.builder("A").priority(1).duration(60).build();
        Task b = Task.builder("B").priority(9).duration(30).dependsOn("A").build();

        AllocationResult result = allocator(GridConfig.defaults()).allocate(List.of(b, a));

        assertEquals(9, a.getPriority());
        assertEquals(new TimeWindow(480, 540), windowOf(result, "A"));
        // the 15 minute break after A comes first
        assertEquals(new TimeWindow(555, 585), windowOf(result, "B"));
        assertInvariants(result);
    }

    @Test
    @DisplayName("Breaks follow every task and are truncated at the end of the day")
    void breaksFollowTasks() {
        Task late = Task.builder("late").priority(2).fixed(1140, 1200).build();
        Task early = Task.builder("early").priority(1).duration(60).build();

        AllocationResult result = allocator(GridConfig.defaults()).allocate(List.of(late, early));
        WeeklySlotGrid grid = result.getGrid();

        int afterEarly = grid.indexOf(540).getAsInt();
        for (int i = afterEarly; i < afterEarly + 15; i++) {
            assertTrue(grid.slot(i).isBreak(), "slot " + i + " should be a break");
        }
        assertTrue(grid.slot(afterEarly + 15).isFree());
        // the fixed task ends with the working day, so no break follows on Monday
        assertTrue(grid.slot(720).isFree());
        assertInvariants(result);
    }

    @Test
    @DisplayName("Rerunning the same tasks gives the same schedule")
    void rerunIsStable() {
        List<Task> tasks = List.of(
                Task.builder("x").fixed(540, 600).build(),
                Task.builder("y").fixed(570, 630).build(),
                Task.builder("z").priority(3).duration(45).build());
        DefaultSlotAllocator allocator = allocator(NINE_TO_FIVE);

        Map<String, TimeWindow> first = snapshot(allocator.allocate(tasks));
        Map<String, TimeWindow> second = snapshot(allocator.allocate(tasks));

        assertEquals(first, second);
        assertTrue(tasks.get(1).isRescheduled());
    }

    // =====================================================================
    // Fixed tasks
    // =====================================================================

    @Test
    @DisplayName("Fixed task is placed exactly; an overlapping fixed task is relocated")
    void fixedTaskScenario() {
        Task x = Task.builder("x").duration(60).fixed(540, 600).build();
        Task y = Task.builder("y").fixed(570, 630).build();

        AllocationResult result = allocator(NINE_TO_FIVE).allocate(List.of(x, y));

        assertTrue(result.isComplete());
        assertEquals(new TimeWindow(540, 600), windowOf(result, "x"));
        assertFalse(x.isRescheduled());
        assertEquals(new TimeWindow(600, 660), windowOf(result, "y"));
        assertTrue(y.isRescheduled());
    }

    @Test
    @DisplayName("Fixed task whose dependency cannot precede it moves after the dependency")
    void fixedTaskAfterDependency() {
        Task meeting = Task.builder("meeting").fixed(540, 600).dependsOn("prep").build();
        Task prep = Task.builder("prep").duration(60).build();

        AllocationResult result = allocator(NINE_TO_FIVE).allocate(List.of(meeting, prep));

        assertTrue(result.isComplete());
        assertEquals(new TimeWindow(540, 600), windowOf(result, "prep"));
        assertEquals(new TimeWindow(600, 660), windowOf(result, "meeting"));
        assertTrue(meeting.isRescheduled());
    }

    @Test
    @DisplayName("Low-priority fixed task does not drag a pinned dependent off its window")
    void pinnedDependentStaysPut() {
        Task anchor = Task.builder("A").priority(9).fixed(540, 570).build();
        Task prep = Task.builder("R").priority(8).fixed(540, 570).build();
        Task review = Task.builder("F").priority(8).fixed(700, 760).dependsOn("R").build();
        Task call = Task.builder("G").priority(1).fixed(570, 600).build();

        AllocationResult result = allocator(NINE_TO_FIVE).allocate(List.of(anchor, prep, review, call));

        assertTrue(result.isComplete());
        assertEquals(new TimeWindow(540, 570), windowOf(result, "A"));
        assertEquals(new TimeWindow(570, 600), windowOf(result, "R"));
        assertEquals(new TimeWindow(700, 760), windowOf(result, "F"));
        assertTrue(review.isPinned());
        assertFalse(review.isRescheduled());
        assertEquals(new TimeWindow(600, 630), windowOf(result, "G"));
        assertTrue(call.isRescheduled());
        assertInvariants(result);
    }

    @Test
    @DisplayName("Fixed window outside working hours is reported")
    void fixedOutsideWorkingHours() {
        Task night = Task.builder("night").fixed(60, 120).build();

        AllocationResult result = allocator(NINE_TO_FIVE).allocate(List.of(night));

        assertEquals(UnplacedReason.OUTSIDE_WORKING_HOURS, result.unplacedReport("night").orElseThrow().reason());
        assertFalse(night.isPlaced());
    }

    // =====================================================================
    // Eviction
    // =====================================================================

    @Test
    @DisplayName("Deferred high-priority task evicts a lower-priority one")
    void deferredTaskEvicts() {
        Task high = Task.builder("H").priority(5).duration(60).deadline(720).dependsOn("D").build();
        Task dep = Task.builder("D").priority(5).duration(60).dependsOn("E").build();
        Task root = Task.builder("E").duration(60).build();
        Task low = Task.builder("L").priority(1).duration(60).build();

        AllocationResult result = allocator(NINE_TO_FIVE).allocate(List.of(high, dep, root, low));

        assertTrue(result.isComplete());
        assertEquals(new TimeWindow(540, 600), windowOf(result, "E"));
        assertEquals(new TimeWindow(600, 660), windowOf(result, "D"));
        assertEquals(new TimeWindow(660, 720), windowOf(result, "H"));
        assertEquals(new TimeWindow(720, 780), windowOf(result, "L"));
        assertTrue(low.isRescheduled());
        assertFalse(high.isRescheduled());
    }

    @Test
    @DisplayName("Evicted task with nowhere to go is reported as an eviction deadlock")
    void evictionDeadlockReported() {
        Task high = Task.builder("H").priority(5).duration(60).deadline(720).dependsOn("D").build();
        Task dep = Task.builder("D").priority(5).duration(60).dependsOn("E").build();
        Task root = Task.builder("E").duration(60).build();
        Task low = Task.builder("L").priority(1).duration(60).deadline(720).build();

        AllocationResult result = allocator(NINE_TO_FIVE).allocate(List.of(high, dep, root, low));

        assertEquals(3, result.getPlaced().size());
        assertEquals(UnplacedReason.EVICTION_DEADLOCK, result.unplacedReport("L").orElseThrow().reason());
        assertEquals(List.of(result.unplacedReport("L").orElseThrow()),
                result.getUnplaced(UnplacedReason.EVICTION_DEADLOCK));
    }

    // =====================================================================
    // Unschedulable tasks
    // =====================================================================

    @Test
    @DisplayName("Three 120 minute tasks in 240 minutes: two placed, one reported")
    void capacityExhausted() {
        GridConfig fourHours = GridConfig.withoutBreaks(540, 780);
        List<Task> tasks = List.of(
                Task.builder("A").priority(3).duration(120).deadline(780).build(),
                Task.builder("B").priority(2).duration(120).deadline(780).build(),
                Task.builder("C").priority(1).duration(120).deadline(780).build());

        AllocationResult result = allocator(fourHours).allocate(tasks);

        assertEquals(List.of("A", "B"), result.getPlaced().stream().map(Task::getId).toList());
        assertEquals(1, result.getUnplaced().size());
        assertEquals(UnplacedReason.NO_FEASIBLE_WINDOW, result.unplacedReport("C").orElseThrow().reason());
    }

    @Test
    @DisplayName("Deadline before working hours is unreachable")
    void deadlineBeforeWorkingHours() {
        Task task = Task.builder("early").duration(30).deadline(500).build();

        AllocationResult result = allocator(NINE_TO_FIVE).allocate(List.of(task));

        UnplacedTask report = result.unplacedReport("early").orElseThrow();
        assertEquals(UnplacedReason.DEADLINE_UNREACHABLE, report.reason());
        assertTrue(report.reason().isTerminal());
    }

    @Test
    @DisplayName("Deadline leaving no room for the trailing break is unreachable")
    void deadlineLeavesNoRoomForBreak() {
        GridConfig withBreak = new GridConfig(540, 1020, 0, 15, false);
        Task tight = Task.builder("tight").duration(60).deadline(600).build();
        Task roomy = Task.builder("roomy").duration(60).deadline(615).build();

        AllocationResult result = allocator(withBreak).allocate(List.of(tight, roomy));

        assertEquals(UnplacedReason.DEADLINE_UNREACHABLE, result.unplacedReport("tight").orElseThrow().reason());
        assertFalse(tight.isPlaced());
        assertEquals(new TimeWindow(540, 600), windowOf(result, "roomy"));
        assertInvariants(result);
    }

    @Test
    @DisplayName("Missing duration, unknown dependency and over-long task are reported")
    void unschedulableReasons() {
        List<Task> tasks = List.of(
                Task.builder("vague").build(),
                Task.builder("orphan").duration(30).dependsOn("ghost").build(),
                Task.builder("marathon").duration(600).build(),
                Task.builder("fine").duration(30).build());

        AllocationResult result = allocator(NINE_TO_FIVE).allocate(tasks);

        assertEquals(UnplacedReason.NO_DURATION, result.unplacedReport("vague").orElseThrow().reason());
        assertEquals(UnplacedReason.MISSING_DEPENDENCY, result.unplacedReport("orphan").orElseThrow().reason());
        assertEquals(UnplacedReason.NO_FEASIBLE_WINDOW, result.unplacedReport("marathon").orElseThrow().reason());
        assertEquals(List.of("fine"), result.getPlaced().stream().map(Task::getId).toList());
    }

    @Test
    @DisplayName("Dependent of an unplaceable task is reported as waiting")
    void dependentOfUnplaceable() {
        List<Task> tasks = List.of(
                Task.builder("vague").priority(2).build(),
                Task.builder("next").duration(30).dependsOn("vague").build());

        AllocationResult result = allocator(NINE_TO_FIVE).allocate(tasks);

        UnplacedTask report = result.unplacedReport("next").orElseThrow();
        assertEquals(UnplacedReason.DEPENDENCY_UNSATISFIED, report.reason());
        assertTrue(report.detail().contains("vague"));
    }

    @Test
    @DisplayName("Reserved periodic breaks shorten the usable runs")
    void reservedPeriodicBreaks() {
        GridConfig reserved = new GridConfig(540, 1020, 90, 10, true);
        Task fits = Task.builder("fits").priority(1).duration(70).build();
        Task tooLong = Task.builder("tooLong").duration(80).build();

        AllocationResult result = allocator(reserved).allocate(List.of(fits, tooLong));

        assertEquals(new TimeWindow(540, 610), windowOf(result, "fits"));
        assertEquals(UnplacedReason.NO_FEASIBLE_WINDOW, result.unplacedReport("tooLong").orElseThrow().reason());
    }

    // =====================================================================
    // Structural failures
    // =====================================================================

    @Test
    @DisplayName("Cyclic dependencies abort the run")
    void cycleAborts() {
        List<Task> tasks = List.of(
                Task.builder("A").duration(10).dependsOn("B").build(),
                Task.builder("B").duration(10).dependsOn("A").build());

        assertThrows(DependencyCycleException.class, () -> allocator(NINE_TO_FIVE).allocate(tasks));
    }

    @Test
    @DisplayName("Duplicate ids and null input are rejected")
    void invalidInput() {
        DefaultSlotAllocator allocator = allocator(NINE_TO_FIVE);

        assertThrows(NullPointerException.class, () -> allocator.allocate(null));
        assertThrows(IllegalArgumentException.class, () -> allocator.allocate(List.of(
                Task.builder("A").duration(10).build(), Task.builder("A").duration(20).build())));
    }

    @Test
    @DisplayName("Empty input gives an empty, complete result")
    void emptyInput() {
        AllocationResult result = allocator(NINE_TO_FIVE).allocate(List.of());

        assertTrue(result.isComplete());
        assertTrue(result.getPlaced().isEmpty());
    }

    @Test
    @DisplayName("Lateness DP only runs when configured")
    void latenessDpIsOptIn() {
        assertFalse(AllocationConfig.defaults().strategies().contains(StrategyType.LATENESS_DP));
        DefaultSlotAllocator allocator = new DefaultSlotAllocator(
                PlannerConfig.of(NINE_TO_FIVE).withAllocation(AllocationConfig.of(StrategyType.LATENESS_DP)));
        assertEquals(List.of(StrategyType.LATENESS_DP), allocator.getConfig().allocation().strategies());
    }

    // =====================================================================
    // Helper Methods
    // =====================================================================

    private static Map<String, TimeWindow> snapshot(AllocationResult result) {
        return result.getPlaced().stream()
                .collect(Collectors.toMap(Task::getId, t -> t.getAssignedWindow().orElseThrow()));
    }

    private static void assertInvariants(AllocationResult result) {
        WeeklySlotGrid grid = result.getGrid();
        int breakDuration = grid.getConfig().breakDuration();
        List<TimeWindow> windows = new ArrayList<>();

        for (Task task : result.getPlaced()) {
            TimeWindow window = task.getAssignedWindow().orElseThrow();
            String id = task.getId();

            assertEquals(task.requiredMinutes().getAsInt(), window.length(), id + " length");

            for (String depId : task.getDependencies()) {
                TimeWindow dep = result.find(depId).orElseThrow().getAssignedWindow()
                        .orElseThrow(() -> new AssertionError(id + " placed before unplaced " + depId));
                assertTrue(dep.end() <= window.start(), id + " starts before " + depId + " ends");
            }
            for (TimeWindow other : windows) {
                assertFalse(other.overlaps(window), id + " overlaps " + other);
            }
            windows.add(window);

            int first = grid.indexOf(window.start()).orElseThrow();
            int last = grid.indexOf(window.end() - 1).orElseThrow();
            assertEquals(window.length() - 1, last - first, id + " crosses a day boundary");
            for (int i = first; i <= last; i++) {
                assertTrue(grid.slot(i).getOccupant().isPresent(), id + " slot " + i + " not held");
            }
            int breakEnd = Math.min(last + 1 + breakDuration, grid.blockEnd(last));
            for (int i = last + 1; i < breakEnd; i++) {
                assertTrue(grid.slot(i).isBreak(), id + " missing break at slot " + i);
            }
            int spanEndMinute = grid.minuteAt(breakEnd - 1) + 1;
            task.getDeadline().ifPresent(deadline ->
                    assertTrue(spanEndMinute <= deadline, id + " ends, break included, after its deadline"));
        }
    }
}
