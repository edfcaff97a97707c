package com.planner.config;

/**
 * Root configuration for the planner.
 *
 * @param name       Planner name identifier
 * @param grid       Weekly slot grid configuration
 * @param allocation Allocation pipeline configuration
 */
public record PlannerConfig(
        String name,
        GridConfig grid,
        AllocationConfig allocation
) {
    public PlannerConfig {
        grid = grid != null ? grid : GridConfig.defaults();
        allocation = allocation != null ? allocation : AllocationConfig.defaults();
    }

    /**
     * Default configuration: 08:00-20:00, 15 minute breaks, greedy then backtracking.
     */
    public static PlannerConfig defaults() {
        return new PlannerConfig("default-planner", GridConfig.defaults(), AllocationConfig.defaults());
    }

    /**
     * Create a configuration for the given grid with the default pipeline.
     */
    public static PlannerConfig of(GridConfig grid) {
        return new PlannerConfig("default-planner", grid, AllocationConfig.defaults());
    }

    public PlannerConfig withAllocation(AllocationConfig allocation) {
        return new PlannerConfig(name, grid, allocation);
    }
}
