package com.planner.strategy;

import com.planner.config.AllocationConfig;
import com.planner.priority.TaskOrderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory for creating AllocationStrategy instances.
 */
public class AllocationStrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(AllocationStrategyFactory.class);

    /**
     * Create an AllocationStrategy of the given type.
     *
     * @param type    Strategy type; null means GREEDY
     * @param config  Allocation configuration
     * @param orderer Processing order for strategies that walk a queue
     * @return AllocationStrategy instance
     */
    public static AllocationStrategy create(StrategyType type, AllocationConfig config, TaskOrderer orderer) {
        if (type == null) {
            log.info("No strategy type provided, defaulting to GREEDY");
            type = StrategyType.GREEDY;
        }
        AllocationConfig effective = config != null ? config : AllocationConfig.defaults();

        log.debug("Creating AllocationStrategy: {}", type);

        return switch (type) {
            case GREEDY -> new GreedyStrategy(orderer);
            case LATENESS_DP -> new LatenessMinimizingStrategy();
            case BACKTRACKING -> new BacktrackingStrategy(effective.backtracking().maxSteps());
        };
    }

    /**
     * Create the configured pipeline, in order.
     */
    public static List<AllocationStrategy> createPipeline(AllocationConfig config, TaskOrderer orderer) {
        AllocationConfig effective = config != null ? config : AllocationConfig.defaults();
        List<AllocationStrategy> pipeline = new ArrayList<>();
        for (StrategyType type : effective.strategies()) {
            pipeline.add(create(type, effective, orderer));
        }
        return pipeline;
    }
}
