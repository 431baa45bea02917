package com.vireo.routing;

/**
 * A module of route declarations. Implementations listed in
 * {@code META-INF/services/com.vireo.routing.RouteProvider} are loaded when the
 * application handles its first request.
 */
@FunctionalInterface
public interface RouteProvider {

    /**
     * Registers this module's routes.
     *
     * @param router the application router
     */
    void registerRoutes(Router router);
}
