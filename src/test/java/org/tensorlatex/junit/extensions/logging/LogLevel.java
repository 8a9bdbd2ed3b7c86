package org.tensorlatex.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} can assert on.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
