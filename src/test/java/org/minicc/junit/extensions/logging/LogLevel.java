package org.minicc.junit.extensions.logging;

/**
 * Log levels that can be allowed or expected in a test.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
