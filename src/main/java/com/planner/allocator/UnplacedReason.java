package com.planner.allocator;

/**
 * Why a task ended a run without a placement.
 */
public enum UnplacedReason {

    /**
     * Neither a positive duration nor a positive estimate.
     */
    NO_DURATION(true),

    /**
     * Depends on an identifier that is not part of the task set.
     */
    MISSING_DEPENDENCY(true),

    /**
     * Fixed window lies outside working hours.
     */
    OUTSIDE_WORKING_HOURS(true),

    /**
     * Deadline falls before the earliest end any placement in the grid can reach.
     */
    DEADLINE_UNREACHABLE(true),

    /**
     * No free window between the dependency floor and the deadline, even after eviction.
     */
    NO_FEASIBLE_WINDOW(false),

    /**
     * A dependency was never placed, or was removed after this task was placed.
     */
    DEPENDENCY_UNSATISFIED(false),

    /**
     * Backtracking search ran out of candidates or steps.
     */
    SEARCH_EXHAUSTED(false),

    /**
     * Evicted by another task and could neither be re-placed nor restored.
     */
    EVICTION_DEADLOCK(false);

    private final boolean terminal;

    UnplacedReason(boolean terminal) {
        this.terminal = terminal;
    }

    /**
     * Terminal reasons depend only on the task itself; later phases do not retry such tasks.
     */
    public boolean isTerminal() {
        return terminal;
    }
}
