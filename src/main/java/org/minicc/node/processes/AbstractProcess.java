package org.minicc.node.processes;

import com.typesafe.config.Config;
import org.minicc.node.spi.IProcess;

import java.util.Map;

/**
 * Base class for processes instantiated by the {@link org.minicc.node.Node}. It fixes the
 * constructor signature the node calls reflectively:
 * {@code (String processName, Map<String, Object> dependencies, Config options)}.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * @param processName  The name of the process in the {@code node.processes} block.
     * @param dependencies The services this process requires, keyed by their local name.
     * @param options      The process's {@code options} block.
     */
    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies == null ? Map.of() : Map.copyOf(dependencies);
        this.options = options;
    }

    /**
     * @return The process name.
     */
    public String getProcessName() {
        return processName;
    }

    /**
     * Returns a required dependency.
     *
     * @param name         The local name used in the {@code require} block.
     * @param expectedType The type the dependency must have.
     * @param <T>          The dependency type.
     * @return The dependency.
     * @throws IllegalArgumentException if the dependency is missing or of the wrong type.
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final Object dep = dependencies.get(name);
        if (dep == null) {
            throw new IllegalArgumentException(
                "Process '" + processName + "' requires dependency '" + name + "' but none was injected.");
        }
        if (!expectedType.isInstance(dep)) {
            throw new IllegalArgumentException(
                "Dependency '" + name + "' of process '" + processName + "' is a " + dep.getClass().getName()
                    + ", expected " + expectedType.getName() + ".");
        }
        return expectedType.cast(dep);
    }
}
