package com.planner.priority;

import com.planner.core.Task;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Processing queue for one allocation run.
 * The head holds the highest-priority task; deferred tasks go to the lowest-priority end.
 */
public class TaskQueue {

    private final Deque<Task> deque;

    TaskQueue(List<Task> ordered) {
        this.deque = new ArrayDeque<>(ordered);
    }

    /**
     * Remove and return the highest-priority remaining task.
     */
    public Optional<Task> pollHighest() {
        return Optional.ofNullable(deque.pollFirst());
    }

    /**
     * Send a task to the lowest-priority end to be retried after the others.
     */
    public void defer(Task task) {
        deque.addLast(task);
    }

    public int size() {
        return deque.size();
    }

    public boolean isEmpty() {
        return deque.isEmpty();
    }

    /**
     * Snapshot of the remaining tasks, head first.
     */
    public List<Task> remaining() {
        return List.copyOf(deque);
    }
}
