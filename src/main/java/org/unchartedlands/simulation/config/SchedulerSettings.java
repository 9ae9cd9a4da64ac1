package org.unchartedlands.simulation.config;

import com.typesafe.config.Config;

/**
 * Cadence and concurrency settings of the tick scheduler.
 *
 * @param tickRate               ticks per second
 * @param coarsePeriodTicks      ticks between two resource waves
 * @param populationPeriodTicks  ticks between two population evaluations
 * @param batchSize              settlements processed concurrently within a wave
 * @param statusLogIntervalTicks ticks between two status log lines
 */
public record SchedulerSettings(
        int tickRate,
        long coarsePeriodTicks,
        long populationPeriodTicks,
        int batchSize,
        long statusLogIntervalTicks
) {

    public static final int DEFAULT_TICK_RATE = 60;
    public static final long DEFAULT_POPULATION_PERIOD_TICKS = 36000;
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final long STATUS_LOG_INTERVAL_SECONDS = 300;

    public SchedulerSettings {
        requirePositive("tick-rate", tickRate);
        requirePositive("coarse-period-ticks", coarsePeriodTicks);
        requirePositive("population-period-ticks", populationPeriodTicks);
        requirePositive("batch-size", batchSize);
        requirePositive("status-log-interval-ticks", statusLogIntervalTicks);
    }

    public static SchedulerSettings defaults() {
        return forTickRate(DEFAULT_TICK_RATE);
    }

    /**
     * Default settings for a tick rate: one wave per second, population every
     * {@value #DEFAULT_POPULATION_PERIOD_TICKS} ticks, status every five minutes.
     */
    public static SchedulerSettings forTickRate(int tickRate) {
        return new SchedulerSettings(tickRate, tickRate, DEFAULT_POPULATION_PERIOD_TICKS,
                DEFAULT_BATCH_SIZE, STATUS_LOG_INTERVAL_SECONDS * tickRate);
    }

    /**
     * Reads settings from a scheduler options block. Missing keys fall back to the defaults
     * derived from the configured tick rate.
     *
     * @param options the {@code simulation.scheduler} block
     * @return the settings
     * @throws IllegalArgumentException if a value is not positive
     */
    public static SchedulerSettings fromConfig(Config options) {
        int tickRate = options.hasPath("tick-rate") ? options.getInt("tick-rate") : DEFAULT_TICK_RATE;
        long coarsePeriod = options.hasPath("coarse-period-ticks") ? options.getLong("coarse-period-ticks") : tickRate;
        long populationPeriod = options.hasPath("population-period-ticks")
                ? options.getLong("population-period-ticks") : DEFAULT_POPULATION_PERIOD_TICKS;
        int batchSize = options.hasPath("batch-size") ? options.getInt("batch-size") : DEFAULT_BATCH_SIZE;
        long statusInterval = options.hasPath("status-log-interval-ticks")
                ? options.getLong("status-log-interval-ticks") : STATUS_LOG_INTERVAL_SECONDS * tickRate;
        return new SchedulerSettings(tickRate, coarsePeriod, populationPeriod, batchSize, statusInterval);
    }

    /**
     * @return the timer period in nanoseconds
     */
    public long tickIntervalNanos() {
        return 1_000_000_000L / tickRate;
    }

    /**
     * @return ticks in one hour of game time, the reference unit of the rate tables
     */
    public double ticksPerHour() {
        return tickRate * 3600.0;
    }

    private static void requirePositive(String key, long value) {
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be >= 1 but was " + value);
        }
    }
}
