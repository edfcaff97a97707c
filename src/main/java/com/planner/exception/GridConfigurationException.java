package com.planner.exception;

/**
 * Thrown when working-hours bounds or break parameters cannot produce a valid slot grid.
 * Aborts the allocation run.
 */
public class GridConfigurationException extends ConfigurationException {

    public GridConfigurationException(String message) {
        super(message);
    }
}
