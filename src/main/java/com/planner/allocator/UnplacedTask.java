package com.planner.allocator;

/**
 * A task that could not be placed, with the reason reported by the last phase that tried.
 *
 * @param taskId Task identifier
 * @param reason Failure category
 * @param detail Human-readable explanation
 */
public record UnplacedTask(
        String taskId,
        UnplacedReason reason,
        String detail
) {
}
