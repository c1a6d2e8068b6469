package org.minicc.node.spi;

/**
 * A long-running unit of work managed by the {@link org.minicc.node.Node}.
 * The node starts processes in dependency order and stops them in reverse order.
 */
public interface IProcess {

    /**
     * Starts the process. Must return promptly; continuous work belongs on the
     * process's own threads.
     */
    void start();

    /**
     * Stops the process and releases its resources. Calling it on a process
     * that is not running has no effect.
     */
    void stop();
}
