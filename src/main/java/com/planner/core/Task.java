package com.planner.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * A unit of schedulable work.
 * <p>
 * Identity, dependencies, effort, deadline and fixed window are set once by the caller.
 * Priority may be raised by dependency propagation; the assigned window and the
 * rescheduled flag are written by the allocator during a single run.
 */
public final class Task {

    private final String id;
    private final Set<String> dependencies;
    private final Integer duration;
    private final Integer estimatedTimeToComplete;
    private final Integer deadline;
    private final TimeWindow fixedWindow;

    private int priority;
    private TimeWindow assignedWindow;
    private boolean rescheduled;

    private Task(Builder builder) {
        this.id = builder.id;
        this.priority = builder.priority;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependencies));
        this.duration = builder.duration;
        this.estimatedTimeToComplete = builder.estimatedTimeToComplete;
        this.deadline = builder.deadline;
        this.fixedWindow = builder.fixedWindow;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    public OptionalInt getDuration() {
        return duration != null ? OptionalInt.of(duration) : OptionalInt.empty();
    }

    public OptionalInt getEstimatedTimeToComplete() {
        return estimatedTimeToComplete != null ? OptionalInt.of(estimatedTimeToComplete) : OptionalInt.empty();
    }

    public OptionalInt getDeadline() {
        return deadline != null ? OptionalInt.of(deadline) : OptionalInt.empty();
    }

    public Optional<TimeWindow> getFixedWindow() {
        return Optional.ofNullable(fixedWindow);
    }

    public boolean isFixed() {
        return fixedWindow != null;
    }

    /**
     * Minutes this task occupies once placed.
     * A fixed task occupies its window length; otherwise the duration wins over the estimate.
     * Non-positive values count as absent.
     *
     * @return required minutes, or empty if the task cannot be scheduled
     */
    public OptionalInt requiredMinutes() {
        if (fixedWindow != null) {
            return OptionalInt.of(fixedWindow.length());
        }
        if (duration != null && duration > 0) {
            return OptionalInt.of(duration);
        }
        if (estimatedTimeToComplete != null && estimatedTimeToComplete > 0) {
            return OptionalInt.of(estimatedTimeToComplete);
        }
        return OptionalInt.empty();
    }

    public Optional<TimeWindow> getAssignedWindow() {
        return Optional.ofNullable(assignedWindow);
    }

    public boolean isPlaced() {
        return assignedWindow != null;
    }

    /**
     * True while the task sits exactly at its caller-supplied fixed window.
     */
    public boolean isPinned() {
        return fixedWindow != null && fixedWindow.equals(assignedWindow);
    }

    public void assign(TimeWindow window) {
        this.assignedWindow = Objects.requireNonNull(window, "window cannot be null");
    }

    public void unassign() {
        this.assignedWindow = null;
    }

    /**
     * Clear the placement and the rescheduled flag before a new allocation run.
     */
    public void reset() {
        this.assignedWindow = null;
        this.rescheduled = false;
    }

    public boolean isRescheduled() {
        return rescheduled;
    }

    public void markRescheduled() {
        this.rescheduled = true;
    }

    @Override
    public String toString() {
        return "Task{" +
                "id='" + id + '\'' +
                ", priority=" + priority +
                ", dependencies=" + dependencies +
                ", assigned=" + assignedWindow +
                (rescheduled ? ", rescheduled" : "") +
                '}';
    }

    /**
     * Builder for Task.
     */
    public static final class Builder {
        private final String id;
        private int priority;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private Integer duration;
        private Integer estimatedTimeToComplete;
        private Integer deadline;
        private TimeWindow fixedWindow;

        private Builder(String id) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Task id cannot be blank");
            }
            this.id = id;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependsOn(String... ids) {
            for (String dep : ids) {
                dependsOn(dep);
            }
            return this;
        }

        public Builder dependsOn(String dependencyId) {
            if (dependencyId != null && !dependencyId.isBlank()) {
                this.dependencies.add(dependencyId);
            }
            return this;
        }

        public Builder dependencies(Iterable<String> ids) {
            if (ids != null) {
                for (String dep : ids) {
                    dependsOn(dep);
                }
            }
            return this;
        }

        public Builder duration(Integer minutes) {
            this.duration = minutes;
            return this;
        }

        public Builder estimatedTimeToComplete(Integer minutes) {
            this.estimatedTimeToComplete = minutes;
            return this;
        }

        public Builder deadline(Integer minuteOfWeek) {
            this.deadline = minuteOfWeek;
            return this;
        }

        public Builder fixed(int start, int end) {
            this.fixedWindow = new TimeWindow(start, end);
            return this;
        }

        public Builder fixed(TimeWindow window) {
            this.fixedWindow = window;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
