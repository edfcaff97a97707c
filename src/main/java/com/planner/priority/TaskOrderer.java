package com.planner.priority;

import com.planner.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders tasks for processing: priority descending, then dependency count ascending,
 * then input order.
 */
public class TaskOrderer {

    private static final Logger log = LoggerFactory.getLogger(TaskOrderer.class);

    /**
     * Sort tasks into processing order. Priorities are read as they are now, so run
     * propagation first.
     */
    public List<Task> sort(Collection<Task> tasks) {
        Map<Task, OrderingKey> keys = new IdentityHashMap<>();
        long sequence = 0;
        for (Task task : tasks) {
            keys.put(task, OrderingKey.of(task, sequence++));
        }
        List<Task> ordered = new ArrayList<>(tasks);
        ordered.sort(Comparator.comparing(keys::get));
        return ordered;
    }

    /**
     * Build the pop-highest / defer-to-back queue used by greedy placement.
     */
    public TaskQueue order(Collection<Task> tasks) {
        List<Task> ordered = sort(tasks);
        if (log.isDebugEnabled()) {
            log.debug("Processing order: {}", ordered.stream().map(Task::getId).toList());
        }
        return new TaskQueue(ordered);
    }
}
