package com.planner.priority;

import com.planner.core.Task;

import java.util.Objects;

/**
 * Processing-order key for a task.
 * Encapsulates: Priority + DependencyCount + Sequence
 * <p>
 * Comparison order:
 * 1. Priority (higher first)
 * 2. Dependency count (fewer first)
 * 3. Sequence (input order fallback: earlier task wins)
 * <p>
 * The dependency count is a tie-break heuristic only; readiness is enforced by the allocator.
 */
public final class OrderingKey implements Comparable<OrderingKey> {

    private final int priority;
    private final int dependencyCount;
    private final long sequence;

    public OrderingKey(int priority, int dependencyCount, long sequence) {
        this.priority = priority;
        this.dependencyCount = dependencyCount;
        this.sequence = sequence;
    }

    public static OrderingKey of(Task task, long sequence) {
        return new OrderingKey(task.getPriority(), task.getDependencies().size(), sequence);
    }

    public int getPriority() {
        return priority;
    }

    public int getDependencyCount() {
        return dependencyCount;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public int compareTo(OrderingKey other) {
        // 1. Higher priority first
        int priorityCmp = Integer.compare(other.priority, this.priority);
        if (priorityCmp != 0) {
            return priorityCmp;
        }

        // 2. Fewer dependencies first
        int depCmp = Integer.compare(this.dependencyCount, other.dependencyCount);
        if (depCmp != 0) {
            return depCmp;
        }

        // 3. Input order
        return Long.compare(this.sequence, other.sequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderingKey that = (OrderingKey) o;
        return priority == that.priority &&
                dependencyCount == that.dependencyCount &&
                sequence == that.sequence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(priority, dependencyCount, sequence);
    }

    @Override
    public String toString() {
        return "OrderingKey{" +
                "priority=" + priority +
                ", dependencies=" + dependencyCount +
                ", sequence=" + sequence +
                '}';
    }
}
