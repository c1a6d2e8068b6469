package org.minicc.node.processes.http;

import com.typesafe.config.Config;
import org.minicc.node.spi.IController;
import org.minicc.node.spi.ServiceRegistry;

/**
 * Base class for controllers mounted by the {@link HttpServerProcess}. It fixes the
 * constructor signature used for reflective instantiation:
 * {@code (ServiceRegistry registry, Config options)}.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    /**
     * @param registry The services shared by the HTTP server, such as the compiler.
     * @param options  The controller's {@code options} block from the route configuration.
     */
    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }
}
