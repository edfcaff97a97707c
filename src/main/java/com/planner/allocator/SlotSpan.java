package com.planner.allocator;

/**
 * Grid index range claimed by one placement: task slots {@code [start, taskEnd)}
 * followed by break slots {@code [taskEnd, end)}.
 * The break part is shorter than the configured break duration when it abuts the end
 * of the working block.
 */
public record SlotSpan(int start, int taskEnd, int end) {

    public int taskLength() {
        return taskEnd - start;
    }

    public int breakLength() {
        return end - taskEnd;
    }
}
