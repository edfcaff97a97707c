package com.planner.allocator;

import com.planner.core.Task;
import com.planner.grid.WeeklySlotGrid;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one allocation run: every input task, the placed ones in placement order,
 * and a report for each task left without a placement.
 */
public class AllocationResult {

    private final List<Task> tasks;
    private final List<Task> placed;
    private final List<UnplacedTask> unplaced;
    private final WeeklySlotGrid grid;

    public AllocationResult(List<Task> tasks, List<Task> placed, List<UnplacedTask> unplaced, WeeklySlotGrid grid) {
        this.tasks = List.copyOf(tasks);
        this.placed = List.copyOf(placed);
        this.unplaced = List.copyOf(unplaced);
        this.grid = grid;
    }

    public List<Task> getTasks() {
        return tasks;
    }

    public List<Task> getPlaced() {
        return placed;
    }

    public List<UnplacedTask> getUnplaced() {
        return unplaced;
    }

    /**
     * The grid as left by the run, for inspecting slots and breaks.
     */
    public WeeklySlotGrid getGrid() {
        return grid;
    }

    public boolean isComplete() {
        return unplaced.isEmpty();
    }

    public Optional<Task> find(String taskId) {
        return tasks.stream().filter(t -> t.getId().equals(taskId)).findFirst();
    }

    public Optional<UnplacedTask> unplacedReport(String taskId) {
        return unplaced.stream().filter(u -> u.taskId().equals(taskId)).findFirst();
    }

    public List<UnplacedTask> getUnplaced(UnplacedReason reason) {
        return unplaced.stream().filter(u -> u.reason() == reason).toList();
    }

    @Override
    public String toString() {
        return "AllocationResult{" +
                "placed=" + placed.size() +
                ", unplaced=" + unplaced.size() +
                ", total=" + tasks.size() +
                '}';
    }
}
