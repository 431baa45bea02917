package com.vireo.http;

import com.vireo.routing.Route;
import com.vireo.routing.RouteMatch;
import com.vireo.routing.Router;
import io.undertow.server.HttpServerExchange;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Context for an HTTP request/response cycle.
 * Provides convenient access to the request, the response, the matched route
 * and per-request locals. A new context is created for every request.
 */
public class Context {
    private final Request request;
    private final Response response;
    private final Router router;
    private final Map<String, Object> locals = new HashMap<>();
    private Route route;
    private Map<String, String> routeParams = Collections.emptyMap();
    private Map<String, Object> params;

    /**
     * Creates a new context with the given request and response.
     *
     * @param request  the HTTP request
     * @param response the HTTP response
     * @param router   the router, used for URL generation
     */
    public Context(Request request, Response response, Router router) {
        this.request = request;
        this.response = response;
        this.router = router;
    }

    /**
     * Binds the matched route and its extracted parameters to this context.
     *
     * @param match the route match
     */
    public void setRoute(RouteMatch match) {
        this.route = match.getRoute();
        this.routeParams = match.getParams();
        this.params = null;
    }

    public Route route() {
        return route;
    }

    public Request request() {
        return request;
    }

    public Response response() {
        return response;
    }

    public Router router() {
        return router;
    }

    /**
     * Gets the underlying exchange object.
     *
     * @return the exchange
     */
    public HttpServerExchange exchange() {
        return request.getExchange();
    }

    /**
     * Gets a route parameter by name.
     *
     * @param name the parameter name
     * @return the parameter value or null if not present
     */
    public String param(String name) {
        return routeParams.get(name);
    }

    public Map<String, String> routeParams() {
        return routeParams;
    }

    /**
     * Route parameters overlaid by request data; request data wins on a key
     * clash.
     *
     * @return the merged parameters
     */
    public Map<String, Object> params() {
        if (params == null) {
            Map<String, Object> merged = new LinkedHashMap<>(routeParams);
            merged.putAll(request.all());
            params = Collections.unmodifiableMap(merged);
        }
        return params;
    }

    public Object input(String key) {
        return params().get(key);
    }

    public Object input(String key, Object defaultValue) {
        Object value = params().get(key);
        return value != null ? value : defaultValue;
    }

    public String query(String name) {
        return request.getQueryParam(name);
    }

    public String header(String name) {
        return request.getHeader(name);
    }

    public String body() throws IOException {
        return request.getBody();
    }

    public Context status(int status) {
        response.status(status);
        return this;
    }

    public Context header(String name, String value) {
        response.header(name, value);
        return this;
    }

    public Context type(String contentType) {
        response.type(contentType);
        return this;
    }

    public Context send(String text) {
        response.send(text);
        return this;
    }

    public Context html(String html) {
        response.html(html);
        return this;
    }

    public Context json(String json) {
        response.json(json);
        return this;
    }

    public Context json(Object obj) {
        response.json(obj);
        return this;
    }

    /**
     * Sends an error envelope.
     *
     * @param status  the HTTP status code
     * @param message the error message
     * @return this context for method chaining
     */
    public Context error(int status, String message) {
        response.error(message, status);
        return this;
    }

    public Context redirect(String url) {
        response.redirect(url);
        return this;
    }

    /**
     * Redirects to a named route.
     *
     * @param name   the route name
     * @param params values for the route placeholders
     * @return this context for method chaining
     */
    public Context redirectToRoute(String name, Map<String, ?> params) {
        response.redirect(router.url(name, params));
        return this;
    }

    public String url(String name, Map<String, ?> params) {
        return router.url(name, params);
    }

    public String url(String name) {
        return router.url(name);
    }

    /**
     * Stores a value in the context locals for the current request/response cycle.
     *
     * @param key   the key
     * @param value the value
     * @return this context for method chaining
     */
    public Context set(String key, Object value) {
        locals.put(key, value);
        return this;
    }

    /**
     * Gets a value from the context locals.
     *
     * @param key the key
     * @param <T> the type of the value
     * @return the value or null if not present
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) locals.get(key);
    }

    public boolean isSent() {
        return response.isSent();
    }
}
