package com.planner.time;

import com.planner.config.GridConfig;
import com.planner.core.TimeWindow;
import com.planner.grid.WeeklySlotGrid;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Conversions between minute-of-week values and {@code java.time} types.
 * <p>
 * Minute 0 is Monday 00:00; {@code 10080} is the exclusive end of the week.
 */
public final class MinuteOfWeek {

    private MinuteOfWeek() {
    }

    public static int of(DayOfWeek day, LocalTime time) {
        return (day.getValue() - 1) * GridConfig.MINUTES_PER_DAY + time.getHour() * 60 + time.getMinute();
    }

    /**
     * Minute of the week the date-time falls in. The date itself is dropped.
     */
    public static int of(LocalDateTime dateTime) {
        return of(dateTime.getDayOfWeek(), dateTime.toLocalTime());
    }

    public static DayOfWeek dayOf(int minute) {
        checkRange(minute);
        return DayOfWeek.of(minute / GridConfig.MINUTES_PER_DAY + 1);
    }

    public static LocalTime timeOf(int minute) {
        checkRange(minute);
        int ofDay = minute % GridConfig.MINUTES_PER_DAY;
        return LocalTime.of(ofDay / 60, ofDay % 60);
    }

    /**
     * Render as {@code "Mon 09:00"}. The end of the week renders as {@code "Sun 24:00"}.
     */
    public static String format(int minute) {
        if (minute == WeeklySlotGrid.MINUTES_PER_WEEK) {
            return "Sun 24:00";
        }
        return shortName(dayOf(minute)) + " " + timeOf(minute);
    }

    /**
     * Render a window as {@code "Mon 09:00-10:30"}, or with both days when it ends on another day.
     */
    public static String format(TimeWindow window) {
        String start = format(window.start());
        String end = format(window.end());
        if (window.end() % GridConfig.MINUTES_PER_DAY != 0 && start.regionMatches(0, end, 0, 3)) {
            return start + "-" + end.substring(4);
        }
        return start + " - " + end;
    }

    /**
     * Parse {@code "Mon 09:00"}; the day is matched on its first three letters, ignoring case.
     *
     * @throws IllegalArgumentException if the text is not a day and a time
     */
    public static int parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Minute-of-week text cannot be null");
        }
        String[] parts = text.trim().split("\\s+");
        if (parts.length != 2 || parts[0].length() < 3) {
            throw new IllegalArgumentException("Expected '<day> HH:mm' but got: " + text);
        }
        DayOfWeek day = parseDay(parts[0].substring(0, 3), text);
        if ("24:00".equals(parts[1])) {
            return of(day, LocalTime.MIDNIGHT) + GridConfig.MINUTES_PER_DAY;
        }
        try {
            return of(day, LocalTime.parse(parts[1]));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time in: " + text, e);
        }
    }

    private static DayOfWeek parseDay(String prefix, String text) {
        for (DayOfWeek day : DayOfWeek.values()) {
            if (shortName(day).equalsIgnoreCase(prefix)) {
                return day;
            }
        }
        throw new IllegalArgumentException("Unknown day in: " + text);
    }

    private static String shortName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    private static void checkRange(int minute) {
        if (minute < 0 || minute >= WeeklySlotGrid.MINUTES_PER_WEEK) {
            throw new IllegalArgumentException("Minute of week out of range [0, " + WeeklySlotGrid.MINUTES_PER_WEEK + "): " + minute);
        }
    }
}
