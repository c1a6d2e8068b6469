package org.minicc.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.minicc.node.spi.IProcess;
import org.minicc.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Hosts the configured processes of a minicc server and manages their lifecycle.
 *
 * <p>Processes are declared under {@code node.processes.<name>} with a {@code className}, an
 * optional {@code options} block and an optional {@code require} block mapping local names to
 * other processes. Required processes are instantiated first and their exposed services are
 * passed to the dependent process's constructor.</p>
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_CONFIG_PATH = "node.processes";

    private final Map<String, IProcess> managedProcesses = new LinkedHashMap<>();
    private Thread shutdownHook;

    /**
     * Instantiates all configured processes in dependency order.
     *
     * @param config The fully resolved application configuration.
     * @throws IllegalStateException if a process cannot be created or the dependencies cannot be resolved.
     */
    public Node(final Config config) {
        try {
            initializeProcesses(config);
        } catch (final Exception e) {
            LOGGER.error("Failed to initialize the node.", e);
            throw new IllegalStateException("Node initialization failed", e);
        }
    }

    /**
     * Starts all processes in dependency order and registers a shutdown hook that stops them.
     */
    public void start() {
        if (managedProcesses.isEmpty()) {
            LOGGER.warn("No processes configured to start. The node will be idle.");
        }
        managedProcesses.forEach((name, process) -> {
            LOGGER.debug("Starting process '{}'...", name);
            process.start();
        });

        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started with {} process(es).", managedProcesses.size());
    }

    /**
     * Stops all processes in reverse start order. A failing process does not prevent the others from stopping.
     */
    public void stop() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("Shutdown already in progress: {}", e.getMessage());
            }
            shutdownHook = null;
        }

        final List<String> processNames = new ArrayList<>(managedProcesses.keySet());
        Collections.reverse(processNames);
        for (final String name : processNames) {
            try {
                LOGGER.debug("Stopping process '{}'...", name);
                managedProcesses.get(name).stop();
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}'.", name, e);
            }
        }
        LOGGER.info("Node stopped.");
    }

    /**
     * @param name The process name from the configuration.
     * @return The process instance, or null if there is none with that name.
     */
    public IProcess getProcess(final String name) {
        return managedProcesses.get(name);
    }

    /**
     * @return The process names in start order.
     */
    public List<String> getProcessNames() {
        return List.copyOf(managedProcesses.keySet());
    }

    private void initializeProcesses(final Config config) throws ReflectiveOperationException {
        if (!config.hasPath(PROCESSES_CONFIG_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_CONFIG_PATH);
            return;
        }

        final ConfigObject processesConfig = config.getObject(PROCESSES_CONFIG_PATH);
        final Map<String, ProcessDefinition> processDefs = new LinkedHashMap<>();
        for (final String processName : new TreeSet<>(processesConfig.keySet())) {
            final Config processConfig = processesConfig.toConfig().getConfig(quote(processName));
            final Config options = processConfig.hasPath("options")
                ? processConfig.getConfig("options")
                : ConfigFactory.empty();

            final Map<String, String> requires = new LinkedHashMap<>();
            if (processConfig.hasPath("require")) {
                final Config requireConfig = processConfig.getConfig("require");
                for (final String localName : requireConfig.root().keySet()) {
                    requires.put(localName, requireConfig.getString(quote(localName)));
                }
            }
            processDefs.put(processName,
                new ProcessDefinition(processName, processConfig.getString("className"), options, requires));
        }

        final List<String> orderedProcessNames = topologicalSort(processDefs);
        LOGGER.debug("Process instantiation order: {}", orderedProcessNames);

        final Map<String, Object> exposedServices = new HashMap<>();
        for (final String processName : orderedProcessNames) {
            final ProcessDefinition def = processDefs.get(processName);

            final Map<String, Object> injectedDeps = new HashMap<>();
            def.requires().forEach((localName, sourceProcess) -> {
                final Object service = exposedServices.get(sourceProcess);
                if (service == null) {
                    throw new IllegalStateException(
                        "Process '" + processName + "' requires '" + sourceProcess + "', which exposes no service.");
                }
                injectedDeps.put(localName, service);
            });

            final Class<?> processClass = Class.forName(def.className());
            if (!IProcess.class.isAssignableFrom(processClass)) {
                throw new IllegalArgumentException("Class " + def.className() + " does not implement IProcess.");
            }
            final Constructor<?> constructor = processClass.getConstructor(String.class, Map.class, Config.class);
            final IProcess process = (IProcess) constructor.newInstance(processName, injectedDeps, def.options());
            managedProcesses.put(processName, process);

            if (process instanceof IServiceProvider provider) {
                final Object service = provider.getExposedService();
                if (service != null) {
                    exposedServices.put(processName, service);
                }
            }
            LOGGER.debug("Instantiated process '{}' ({}).", processName, def.className());
        }
    }

    /**
     * Orders processes so that every process comes after the processes it requires (Kahn's algorithm).
     * Ties are ordered by process name.
     *
     * @throws IllegalStateException on unknown or circular dependencies.
     */
    private static List<String> topologicalSort(final Map<String, ProcessDefinition> processDefs) {
        final Map<String, Set<String>> dependents = new LinkedHashMap<>();
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (final String processName : processDefs.keySet()) {
            dependents.put(processName, new LinkedHashSet<>());
            inDegree.put(processName, 0);
        }

        for (final ProcessDefinition def : processDefs.values()) {
            for (final String required : def.requires().values()) {
                if (!processDefs.containsKey(required)) {
                    throw new IllegalStateException(
                        "Process '" + def.name() + "' requires '" + required + "', which is not configured.");
                }
                if (dependents.get(required).add(def.name())) {
                    inDegree.merge(def.name(), 1, Integer::sum);
                }
            }
        }

        final Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) queue.add(name);
        });

        final List<String> result = new ArrayList<>();
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            result.add(current);
            for (final String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (result.size() != processDefs.size()) {
            final List<String> remaining = new ArrayList<>(processDefs.keySet());
            remaining.removeAll(result);
            throw new IllegalStateException("Circular dependency detected among processes: " + remaining);
        }
        return result;
    }

    private static String quote(final String key) {
        return "\"" + key + "\"";
    }

    private record ProcessDefinition(String name, String className, Config options, Map<String, String> requires) {}
}
