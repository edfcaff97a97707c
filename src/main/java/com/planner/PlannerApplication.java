package com.planner;

import com.planner.allocator.AllocationResult;
import com.planner.allocator.SlotAllocator;
import com.planner.allocator.UnplacedTask;
import com.planner.core.Task;
import com.planner.core.TaskSetReader;
import com.planner.spring.EnablePlanner;
import com.planner.time.MinuteOfWeek;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ClassPathResource;

import java.io.InputStream;
import java.util.List;

/**
 * Example Spring Boot application demonstrating planner usage.
 */
@SpringBootApplication
@EnablePlanner
public class PlannerApplication {

    private static final Logger log = LoggerFactory.getLogger(PlannerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PlannerApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(SlotAllocator slotAllocator) {
        return args -> {
            log.info("=== Planner Demo Started ===");

            List<Task> tasks;
            try (InputStream in = new ClassPathResource("sample-tasks.json").getInputStream()) {
                tasks = TaskSetReader.read(in);
            }
            log.info("Read {} tasks", tasks.size());

            AllocationResult result = slotAllocator.allocate(tasks);

            for (Task task : result.getPlaced()) {
                log.info("{} {} (priority={}{})",
                        MinuteOfWeek.format(task.getAssignedWindow().orElseThrow()),
                        task.getId(),
                        task.getPriority(),
                        task.isRescheduled() ? ", rescheduled" : "");
            }
            for (UnplacedTask unplaced : result.getUnplaced()) {
                log.info("Unplaced {}: {} ({})", unplaced.taskId(), unplaced.reason(), unplaced.detail());
            }

            log.info("=== Planner Demo Finished: {} ===", result);
        };
    }
}
