package org.unchartedlands.simulation.junit.extensions.logging;

/**
 * Levels the log watcher distinguishes. Anything below INFO is never checked.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
