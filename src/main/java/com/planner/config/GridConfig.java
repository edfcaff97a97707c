package com.planner.config;

import com.planner.exception.GridConfigurationException;

/**
 * Configuration for the weekly slot grid.
 *
 * @param workingHoursStart     First working minute of each day (minutes from midnight)
 * @param workingHoursEnd       End of the working day, exclusive (minutes from midnight)
 * @param breakInterval         Length of the periodic break cycle in minutes (0 disables the pattern)
 * @param breakDuration         Rest period after every placed task, and the tail of each break cycle
 * @param reservePeriodicBreaks Whether break-eligible slots are blocked for task placement
 */
public record GridConfig(
        int workingHoursStart,
        int workingHoursEnd,
        int breakInterval,
        int breakDuration,
        boolean reservePeriodicBreaks
) {
    public static final int MINUTES_PER_DAY = 1440;

    /**
     * 08:00 to 20:00, a 15 minute break after every task, periodic break every two hours.
     */
    public static GridConfig defaults() {
        return new GridConfig(480, 1200, 120, 15, false);
    }

    /**
     * Grid without any break handling.
     */
    public static GridConfig withoutBreaks(int workingHoursStart, int workingHoursEnd) {
        return new GridConfig(workingHoursStart, workingHoursEnd, 0, 0, false);
    }

    public int workingMinutesPerDay() {
        return workingHoursEnd - workingHoursStart;
    }

    /**
     * Fail fast on bounds that would produce an empty or inconsistent grid.
     */
    public void validate() {
        if (workingHoursStart < 0 || workingHoursStart >= MINUTES_PER_DAY) {
            throw new GridConfigurationException(
                    "working-hours-start must be within [0, 1440), got " + workingHoursStart);
        }
        if (workingHoursEnd <= workingHoursStart || workingHoursEnd > MINUTES_PER_DAY) {
            throw new GridConfigurationException("working-hours-end must be within ("
                    + workingHoursStart + ", 1440], got " + workingHoursEnd);
        }
        if (breakInterval < 0 || breakDuration < 0) {
            throw new GridConfigurationException("break-interval and break-duration must not be negative");
        }
        if (breakInterval > 0 && breakDuration >= breakInterval) {
            throw new GridConfigurationException("break-duration (" + breakDuration
                    + ") must be shorter than break-interval (" + breakInterval + ")");
        }
    }
}
