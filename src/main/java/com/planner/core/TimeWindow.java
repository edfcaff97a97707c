package com.planner.core;

/**
 * Half-open interval of minutes-of-week, {@code [start, end)}.
 *
 * @param start First minute (inclusive)
 * @param end   Last minute (exclusive)
 */
public record TimeWindow(int start, int end) {

    public TimeWindow {
        if (start < 0) {
            throw new IllegalArgumentException("Window start must not be negative: " + start);
        }
        if (end <= start) {
            throw new IllegalArgumentException("Window end must be after start: [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(TimeWindow other) {
        return start < other.end && other.start < end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
