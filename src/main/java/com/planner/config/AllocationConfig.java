package com.planner.config;

import com.planner.strategy.StrategyType;

import java.util.List;

/**
 * Configuration for the allocation pipeline.
 *
 * @param strategies  Strategies run after fixed-task insertion, in order
 * @param backtracking Settings for the BACKTRACKING strategy
 */
public record AllocationConfig(
        List<StrategyType> strategies,
        BacktrackingConfig backtracking
) {
    public AllocationConfig {
        strategies = strategies == null || strategies.isEmpty()
                ? List.of(StrategyType.GREEDY, StrategyType.BACKTRACKING)
                : List.copyOf(strategies);
        backtracking = backtracking != null ? backtracking : BacktrackingConfig.defaults();
    }

    /**
     * Greedy placement followed by backtracking for whatever is left.
     */
    public static AllocationConfig defaults() {
        return new AllocationConfig(List.of(StrategyType.GREEDY, StrategyType.BACKTRACKING),
                BacktrackingConfig.defaults());
    }

    public static AllocationConfig of(StrategyType... strategies) {
        return new AllocationConfig(List.of(strategies), BacktrackingConfig.defaults());
    }

    /**
     * Configuration for the BACKTRACKING strategy.
     *
     * @param maxSteps Search nodes visited before the search gives up and keeps its best partial result
     */
    public record BacktrackingConfig(
            int maxSteps
    ) {
        public static BacktrackingConfig defaults() {
            return new BacktrackingConfig(100_000);
        }
    }
}
