package com.vireo.middleware;

import com.vireo.http.Context;

/**
 * Interface for middleware components.
 * Middleware can process requests before they reach route handlers
 * and can be used for cross-cutting concerns like authentication,
 * logging, CORS, etc.
 *
 * <p>Route middleware is referenced by name, optionally with colon-separated
 * parameters: {@code "throttle:60:1"} calls the {@code throttle} middleware
 * with {@code params = ["60", "1"]}.
 */
@FunctionalInterface
public interface Middleware {
    /**
     * Processes the request context.
     *
     * @param ctx    the context containing the request and response
     * @param params the parameters given after the middleware name, possibly none
     * @return true to continue processing, false to stop dispatching the request
     * @throws Exception if an error occurs during processing
     */
    boolean handle(Context ctx, String... params) throws Exception;
}
