package org.minicc.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import io.javalin.http.staticfiles.Location;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.minicc.compiler.api.ICompiler;
import org.minicc.node.processes.AbstractProcess;
import org.minicc.node.spi.IController;
import org.minicc.node.spi.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A manageable process that runs a Javalin HTTP server. Its routes come from the
 * {@code routes} block of its options: a {@code $controller} entry mounts an
 * {@link IController} at the enclosing path, a {@code $static} entry serves a
 * classpath directory there.
 *
 * <p>Requires the dependency {@code compiler}, which is registered as {@link ICompiler}
 * in the {@link ServiceRegistry} handed to controllers.</p>
 */
public class HttpServerProcess extends AbstractProcess {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private static final String ROUTES_CONFIG_KEY = "routes";
    private static final String CONTROLLER_ACTION_KEY = "$controller";
    private static final String STATIC_ACTION_KEY = "$static";

    private final List<RouteDefinition> routeDefinitions = new ArrayList<>();
    private final ServiceRegistry controllerRegistry = new ServiceRegistry();
    private Javalin app;

    /**
     * Constructs a new HttpServerProcess.
     *
     * @param processName  The name of this process instance from the configuration.
     * @param dependencies Dependencies injected by the node; {@code compiler} is required.
     * @param options      Network settings and routes.
     */
    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        controllerRegistry.register(ICompiler.class, getDependency("compiler", ICompiler.class));
        parseRoutes();
        LOGGER.debug("HttpServerProcess '{}' initialized with {} route(s).", processName, routeDefinitions.size());
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server is already running.");
            return;
        }

        final String host = options.getString("network.host");
        final int port = options.getInt("network.port");

        final Javalin created = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
                }
            });

            final QueuedThreadPool threadPool = new QueuedThreadPool(
                intOption("network.threadPool.maxThreads", 50),
                intOption("network.threadPool.minThreads", 4),
                intOption("network.threadPool.idleTimeoutMs", 60000)
            );
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;

            for (final RouteDefinition def : routeDefinitions) {
                if (def.type() == RouteType.STATIC) {
                    final String classpathDir = (String) def.configValue().unwrapped();
                    LOGGER.debug("Serving classpath '{}' at '{}'", classpathDir, def.basePath());
                    config.staticFiles.add(staticFiles -> {
                        staticFiles.hostedPath = def.basePath();
                        staticFiles.directory = classpathDir;
                        staticFiles.location = Location.CLASSPATH;
                    });
                }
            }
        });

        for (final RouteDefinition def : routeDefinitions) {
            if (def.type() == RouteType.CONTROLLER) {
                registerController(def, created);
            }
        }

        created.start(host, port);
        app = created;
        LOGGER.info("HTTP server started on {}:{}", host, app.port());
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * @return The port the server is bound to, which differs from the configured one when that is 0.
     * @throws IllegalStateException if the server is not running.
     */
    public int getPort() {
        if (app == null) {
            throw new IllegalStateException("HTTP server is not running.");
        }
        return app.port();
    }

    private int intOption(final String path, final int defaultValue) {
        return options.hasPath(path) ? options.getInt(path) : defaultValue;
    }

    private void parseRoutes() {
        if (!options.hasPath(ROUTES_CONFIG_KEY)) {
            LOGGER.warn("No '{}' block found in http server configuration. No routes will be served.", ROUTES_CONFIG_KEY);
            return;
        }
        parseConfigLevel(options.getConfig(ROUTES_CONFIG_KEY).root(), "/");
    }

    private void parseConfigLevel(final ConfigObject configObject, final String currentPath) {
        for (final Map.Entry<String, ConfigValue> entry : configObject.entrySet()) {
            final String key = entry.getKey();
            final ConfigValue value = entry.getValue();

            if (key.equals(CONTROLLER_ACTION_KEY)) {
                if (value.valueType() != ConfigValueType.OBJECT) {
                    throw new IllegalArgumentException("Invalid '$controller' at path '" + currentPath + "': expected an object.");
                }
                routeDefinitions.add(new RouteDefinition(currentPath, RouteType.CONTROLLER, value));
            } else if (key.equals(STATIC_ACTION_KEY)) {
                if (value.valueType() != ConfigValueType.STRING) {
                    throw new IllegalArgumentException("Invalid '$static' at path '" + currentPath + "': expected a string.");
                }
                final String staticPath = currentPath.length() > 1 && currentPath.endsWith("/")
                    ? currentPath.substring(0, currentPath.length() - 1)
                    : currentPath;
                routeDefinitions.add(new RouteDefinition(staticPath, RouteType.STATIC, value));
            } else if (value.valueType() == ConfigValueType.OBJECT) {
                parseConfigLevel((ConfigObject) value, (currentPath + key + "/").replace("//", "/"));
            }
        }
    }

    private void registerController(final RouteDefinition def, final Javalin app) {
        final Config controllerConfig = ((ConfigObject) def.configValue()).toConfig();
        final String className = controllerConfig.getString("className");
        final Config controllerOptions = controllerConfig.hasPath("options")
            ? controllerConfig.getConfig("options")
            : ConfigFactory.empty();

        LOGGER.debug("Registering controller '{}' at base path '{}'", className, def.basePath());
        try {
            final Class<?> controllerClass = Class.forName(className);
            if (!IController.class.isAssignableFrom(controllerClass)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IController.");
            }
            final Constructor<?> constructor = controllerClass.getConstructor(ServiceRegistry.class, Config.class);
            final IController controller = (IController) constructor.newInstance(controllerRegistry, controllerOptions);
            controller.registerRoutes(app, def.basePath());
        } catch (final ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to instantiate controller " + className, e);
        }
    }

    private enum RouteType {
        CONTROLLER, STATIC
    }

    private record RouteDefinition(String basePath, RouteType type, ConfigValue configValue) {}
}
