package com.planner.adapter.spring;

import com.planner.allocator.DefaultSlotAllocator;
import com.planner.allocator.SlotAllocator;
import com.planner.config.ConfigLoader;
import com.planner.config.PlannerConfig;
import com.planner.priority.DependencyPriorityPropagator;
import com.planner.priority.TaskOrderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the planner.
 */
@Configuration
@ConditionalOnProperty(prefix = "planner", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PlannerProperties.class)
public class PlannerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PlannerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PlannerConfig plannerConfig(PlannerProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskOrderer taskOrderer() {
        return new TaskOrderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public SlotAllocator slotAllocator(PlannerConfig config, TaskOrderer taskOrderer) {
        log.info("Creating SlotAllocator: {}", config.name());
        return new DefaultSlotAllocator(config, new DependencyPriorityPropagator(), taskOrderer);
    }
}
