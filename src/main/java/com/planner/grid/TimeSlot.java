package com.planner.grid;

import java.util.OptionalInt;

/**
 * One atomic minute of the weekly grid.
 * <p>
 * A slot is free, held by exactly one task (by task handle), or reserved as a break
 * (occupied with no occupant).
 */
public final class TimeSlot {

    private static final int NO_OCCUPANT = -1;

    private final int index;
    private final int start;
    private final boolean periodicBreak;

    private boolean occupied;
    private int occupant = NO_OCCUPANT;

    TimeSlot(int index, int start, boolean periodicBreak) {
        this.index = index;
        this.start = start;
        this.periodicBreak = periodicBreak;
    }

    public int getIndex() {
        return index;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return start + 1;
    }

    public boolean isOccupied() {
        return occupied;
    }

    /**
     * Whether the slot falls in the periodic break pattern of its working block.
     */
    public boolean isPeriodicBreak() {
        return periodicBreak;
    }

    /**
     * Occupied with no task: a post-task rest period or a reserved periodic break.
     */
    public boolean isBreak() {
        return occupied && occupant == NO_OCCUPANT;
    }

    public boolean isFree() {
        return !occupied;
    }

    public OptionalInt getOccupant() {
        return occupant == NO_OCCUPANT ? OptionalInt.empty() : OptionalInt.of(occupant);
    }

    void occupy(int taskHandle) {
        if (occupied) {
            throw new IllegalStateException("Slot " + index + " (minute " + start + ") is already "
                    + (occupant == NO_OCCUPANT ? "a break" : "held by task handle " + occupant));
        }
        this.occupied = true;
        this.occupant = taskHandle;
    }

    void reserveBreak() {
        if (occupied) {
            throw new IllegalStateException("Slot " + index + " (minute " + start + ") is already occupied");
        }
        this.occupied = true;
        this.occupant = NO_OCCUPANT;
    }

    void release() {
        this.occupied = false;
        this.occupant = NO_OCCUPANT;
    }

    @Override
    public String toString() {
        return "TimeSlot{" +
                "index=" + index +
                ", minute=" + start +
                (isBreak() ? ", break" : occupied ? ", task=" + occupant : "") +
                '}';
    }
}
