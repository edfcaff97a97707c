package com.planner.grid;

import com.planner.config.GridConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * One minute-granular slot per working minute of a recurring week (Monday = day 0).
 * <p>
 * The grid is the sole authority on whether a minute is schedulable at all. Its
 * structure is fixed at construction; slot contents change during one allocation run.
 * Slot indices are dense and ascending in minute-of-week, but consecutive indices are
 * only consecutive minutes inside one working block (one day).
 */
public class WeeklySlotGrid {

    private static final Logger log = LoggerFactory.getLogger(WeeklySlotGrid.class);

    public static final int DAYS_PER_WEEK = 7;
    public static final int MINUTES_PER_WEEK = DAYS_PER_WEEK * GridConfig.MINUTES_PER_DAY;

    private final GridConfig config;
    private final List<TimeSlot> slots;
    private final int[] indexByMinute;
    private final int blockLength;

    private WeeklySlotGrid(GridConfig config) {
        this.config = config;
        this.blockLength = config.workingMinutesPerDay();
        this.indexByMinute = new int[MINUTES_PER_WEEK];
        Arrays.fill(indexByMinute, -1);

        List<TimeSlot> built = new ArrayList<>(DAYS_PER_WEEK * blockLength);
        for (int day = 0; day < DAYS_PER_WEEK; day++) {
            for (int minuteOfDay = config.workingHoursStart(); minuteOfDay < config.workingHoursEnd(); minuteOfDay++) {
                int minute = day * GridConfig.MINUTES_PER_DAY + minuteOfDay;
                int offset = minuteOfDay - config.workingHoursStart();
                TimeSlot slot = new TimeSlot(built.size(), minute, isBreakEligible(offset));
                indexByMinute[minute] = slot.getIndex();
                built.add(slot);
            }
        }
        this.slots = Collections.unmodifiableList(built);

        if (config.reservePeriodicBreaks()) {
            int reserved = 0;
            for (TimeSlot slot : slots) {
                if (slot.isPeriodicBreak()) {
                    slot.reserveBreak();
                    reserved++;
                }
            }
            log.debug("Reserved {} periodic break slots", reserved);
        }
    }

    /**
     * Build a fresh grid for one allocation run.
     *
     * @throws com.planner.exception.GridConfigurationException if the bounds are invalid
     */
    public static WeeklySlotGrid build(GridConfig config) {
        config.validate();
        WeeklySlotGrid grid = new WeeklySlotGrid(config);
        log.debug("Built weekly grid: {} slots, working hours [{}, {}), break {}/{}",
                grid.size(), config.workingHoursStart(), config.workingHoursEnd(),
                config.breakDuration(), config.breakInterval());
        return grid;
    }

    private boolean isBreakEligible(int offset) {
        int interval = config.breakInterval();
        int duration = config.breakDuration();
        if (interval <= 0 || duration <= 0) {
            return false;
        }
        return offset % interval >= interval - duration;
    }

    public GridConfig getConfig() {
        return config;
    }

    public int size() {
        return slots.size();
    }

    public List<TimeSlot> getSlots() {
        return slots;
    }

    public TimeSlot slot(int index) {
        return slots.get(index);
    }

    public int minuteAt(int index) {
        return slots.get(index).getStart();
    }

    /**
     * Slot index holding the given minute-of-week, if the minute is inside working hours.
     */
    public OptionalInt indexOf(int minute) {
        if (minute < 0 || minute >= MINUTES_PER_WEEK || indexByMinute[minute] < 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(indexByMinute[minute]);
    }

    /**
     * First slot index whose minute is at or after the given minute, or {@link #size()} if none.
     */
    public int firstIndexAtOrAfter(int minute) {
        if (minute <= 0) {
            return 0;
        }
        int day = minute / GridConfig.MINUTES_PER_DAY;
        if (day >= DAYS_PER_WEEK) {
            return size();
        }
        int minuteOfDay = minute % GridConfig.MINUTES_PER_DAY;
        if (minuteOfDay < config.workingHoursStart()) {
            return day * blockLength;
        }
        if (minuteOfDay >= config.workingHoursEnd()) {
            return (day + 1) * blockLength;
        }
        return day * blockLength + (minuteOfDay - config.workingHoursStart());
    }

    /**
     * Exclusive end index of the working block (day) containing the given index.
     */
    public int blockEnd(int index) {
        return (index / blockLength + 1) * blockLength;
    }

    /**
     * Whether indices {@code [from, to)} are consecutive minutes inside the grid.
     */
    public boolean isContiguous(int from, int to) {
        if (from < 0 || to > size() || from >= to) {
            return false;
        }
        return to <= blockEnd(from);
    }

    /**
     * Whether every slot in {@code [from, to)} is free.
     */
    public boolean isFree(int from, int to) {
        for (int i = from; i < to; i++) {
            if (slots.get(i).isOccupied()) {
                return false;
            }
        }
        return true;
    }

    public void occupy(int index, int taskHandle) {
        slots.get(index).occupy(taskHandle);
    }

    public void reserveBreak(int index) {
        slots.get(index).reserveBreak();
    }

    public void release(int index) {
        slots.get(index).release();
    }

    public int countOccupied() {
        int count = 0;
        for (TimeSlot slot : slots) {
            if (slot.isOccupied()) {
                count++;
            }
        }
        return count;
    }
}
