package org.neurosync.junit.extensions.logging;

/**
 * Levels that {@link LogWatchExtension} can watch for.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
