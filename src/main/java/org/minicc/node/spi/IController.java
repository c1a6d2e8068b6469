package org.minicc.node.spi;

import io.javalin.Javalin;

/**
 * A group of HTTP routes mounted by the HTTP server process.
 */
public interface IController {

    /**
     * Registers this controller's routes and exception handlers.
     *
     * @param app      The Javalin application instance to register routes with.
     * @param basePath The path under which the routes are mounted, e.g. {@code /}.
     */
    void registerRoutes(Javalin app, String basePath);
}
