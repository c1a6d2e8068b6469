package org.minicc.node.processes.http.api.analysis;

/**
 * Thrown when a submitted source exceeds the configured maximum length.
 */
public class SourceTooLargeException extends RuntimeException {

    /**
     * @param length    The length of the submitted source.
     * @param maxLength The configured maximum.
     */
    public SourceTooLargeException(final int length, final int maxLength) {
        super("Source has " + length + " characters, the maximum is " + maxLength + ".");
    }
}
