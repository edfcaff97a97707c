package com.planner.adapter.spring;

import com.planner.allocator.AllocationResult;
import com.planner.allocator.SlotAllocator;
import com.planner.config.PlannerConfig;
import com.planner.core.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PlannerAutoConfiguration.
 */
class PlannerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PlannerAutoConfiguration.class));

    @Test
    @DisplayName("Allocator bean is built from the configured file")
    void allocatorFromConfiguredFile() {
        runner.withPropertyValues("planner.config-path=classpath:planner-test.yaml")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertEquals("test-planner", context.getBean(PlannerConfig.class).name());

                    SlotAllocator allocator = context.getBean(SlotAllocator.class);
                    AllocationResult result = allocator.allocate(List.of(Task.builder("A").duration(30).build()));
                    assertTrue(result.isComplete());
                    assertEquals(540, result.getPlaced().get(0).getAssignedWindow().orElseThrow().start());
                });
    }

    @Test
    @DisplayName("Default path loads the bundled configuration")
    void defaultPath() {
        runner.run(context -> assertEquals("weekly-planner", context.getBean(PlannerConfig.class).name()));
    }

    @Test
    @DisplayName("Disabled planner registers no beans")
    void disabled() {
        runner.withPropertyValues("planner.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(SlotAllocator.class).isEmpty()));
    }
}
