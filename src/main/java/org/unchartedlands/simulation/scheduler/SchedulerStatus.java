package org.unchartedlands.simulation.scheduler;

/**
 * Snapshot of the scheduler for collaborators.
 *
 * @param running     whether the timer is running
 * @param currentTick ticks since start
 * @param activeCount registered settlements
 * @param tickRate    configured ticks per second
 */
public record SchedulerStatus(boolean running, long currentTick, int activeCount, int tickRate) {
}
