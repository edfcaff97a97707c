package com.planner.strategy;

/**
 * Available allocation strategies, run in the configured order after fixed-task insertion.
 */
public enum StrategyType {
    /**
     * Greedy: pop the highest-priority ready task, place it at the earliest feasible
     * window, evicting lower-priority tasks when no free window exists.
     * Tasks waiting on dependencies are deferred to the back of the queue.
     */
    GREEDY,

    /**
     * Lateness DP: place ready deadline-bearing tasks so that cumulative lateness is
     * minimal, committing only the on-time placements. Never part of the default pipeline.
     */
    LATENESS_DP,

    /**
     * Backtracking: exhaustive depth-first search with memoized failed states for the
     * tasks still unplaced. Bounded by a step budget.
     */
    BACKTRACKING
}
