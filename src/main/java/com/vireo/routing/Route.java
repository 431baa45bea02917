package com.vireo.routing;

import com.vireo.core.Vireo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A registered route: HTTP method, compiled template, handler, middleware
 * definitions and an optional name for reverse routing.
 *
 * <p>The handler is either a {@link Vireo.Handler} or a controller action of
 * the form {@code "UserController@show"}; exactly one of them is set.
 */
public class Route {
    private final Router router;
    private final String method;
    private final PathPattern pathPattern;
    private final Vireo.Handler handler;
    private final String action;
    private final List<String> middleware;
    private String name;

    Route(Router router, String method, PathPattern pathPattern, Vireo.Handler handler, String action,
          List<String> middleware) {
        this.router = router;
        this.method = method.toUpperCase();
        this.pathPattern = pathPattern;
        this.handler = handler;
        this.action = action;
        this.middleware = new ArrayList<>(middleware);
    }

    /**
     * Gives this route a name usable with {@link Router#url(String, Map)}.
     * A later route registered under the same name replaces this one.
     *
     * @param name the route name
     * @return this route for method chaining
     */
    public Route name(String name) {
        router.registerName(name, this);
        this.name = name;
        return this;
    }

    /**
     * Appends middleware definitions such as {@code "auth"} or
     * {@code "jwt:admin:editor"}.
     *
     * @param definitions the middleware definitions
     * @return this route for method chaining
     */
    public Route middleware(String... definitions) {
        Collections.addAll(middleware, definitions);
        return this;
    }

    /**
     * Matches a normalized path against the compiled pattern.
     *
     * @param path the normalized request path
     * @return the captured parameters, or null on mismatch
     */
    public Map<String, String> match(String path) {
        return pathPattern.match(path);
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return the normalized template the route was declared with
     */
    public String getPath() {
        return pathPattern.getTemplate();
    }

    public PathPattern getPathPattern() {
        return pathPattern;
    }

    public List<String> getParamNames() {
        return pathPattern.getParamNames();
    }

    public Vireo.Handler getHandler() {
        return handler;
    }

    public String getAction() {
        return action;
    }

    public boolean isControllerAction() {
        return action != null;
    }

    public List<String> getMiddleware() {
        return Collections.unmodifiableList(middleware);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return method + " " + getPath() + (name != null ? " [" + name + "]" : "");
    }
}
