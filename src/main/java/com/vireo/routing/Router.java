package com.vireo.routing;

import com.vireo.core.Vireo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered route table with named-route reverse lookup.
 *
 * <p>Matching is a linear scan in registration order and the first route whose
 * method and pattern both match wins. There is no specificity ranking, so when
 * two templates overlap the one declared first takes the request.
 *
 * <p>Routes are expected to be registered during start-up; the table is not
 * guarded for registration while requests are being served.
 */
public class Router {
    private static final Pattern UNFILLED_PLACEHOLDER = Pattern.compile("\\{[^}]+\\}");

    private final List<Route> routes = new ArrayList<>();
    private final Map<String, Route> namedRoutes = new LinkedHashMap<>();
    private final ParameterPatterns patterns;
    private String baseUrl = "";

    /**
     * Creates a router with the built-in parameter types.
     */
    public Router() {
        this(new ParameterPatterns());
    }

    /**
     * Creates a router backed by the given parameter types.
     *
     * @param patterns the parameter type table
     */
    public Router(ParameterPatterns patterns) {
        this.patterns = patterns;
    }

    /**
     * Adds a route served by a handler function.
     *
     * @param method  the HTTP method
     * @param path    the route template
     * @param handler the handler function
     * @return the created route for further customization
     */
    public Route addRoute(String method, String path, Vireo.Handler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Route handler must not be null");
        }
        return add(method, path, handler, null);
    }

    /**
     * Adds a route served by a controller action.
     *
     * @param method the HTTP method
     * @param path   the route template
     * @param action the action, {@code "Controller@method"}
     * @return the created route for further customization
     */
    public Route addRoute(String method, String path, String action) {
        if (action == null || action.indexOf('@') <= 0 || action.endsWith("@")) {
            throw new IllegalArgumentException("Controller action must look like 'Class@method': " + action);
        }
        return add(method, path, null, action);
    }

    private Route add(String method, String path, Vireo.Handler handler, String action) {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("HTTP method must not be empty");
        }
        PathPattern pathPattern = PathPattern.compile(path, patterns);
        Route route = new Route(this, method, pathPattern, handler, action, Collections.emptyList());
        routes.add(route);
        return route;
    }

    public Route get(String path, Vireo.Handler handler) {
        return addRoute("GET", path, handler);
    }

    public Route get(String path, String action) {
        return addRoute("GET", path, action);
    }

    public Route post(String path, Vireo.Handler handler) {
        return addRoute("POST", path, handler);
    }

    public Route post(String path, String action) {
        return addRoute("POST", path, action);
    }

    public Route put(String path, Vireo.Handler handler) {
        return addRoute("PUT", path, handler);
    }

    public Route put(String path, String action) {
        return addRoute("PUT", path, action);
    }

    public Route patch(String path, Vireo.Handler handler) {
        return addRoute("PATCH", path, handler);
    }

    public Route patch(String path, String action) {
        return addRoute("PATCH", path, action);
    }

    public Route delete(String path, Vireo.Handler handler) {
        return addRoute("DELETE", path, handler);
    }

    public Route delete(String path, String action) {
        return addRoute("DELETE", path, action);
    }

    public Route options(String path, Vireo.Handler handler) {
        return addRoute("OPTIONS", path, handler);
    }

    /**
     * Registers the same handler for several methods, one route per method.
     *
     * @param methods the HTTP methods
     * @param path    the route template
     * @param handler the handler function
     * @return the created routes, in the order of {@code methods}
     */
    public List<Route> match(List<String> methods, String path, Vireo.Handler handler) {
        List<Route> created = new ArrayList<>();
        for (String method : methods) {
            created.add(addRoute(method.toUpperCase(), path, handler));
        }
        return created;
    }

    /**
     * Registers the same controller action for several methods.
     *
     * @param methods the HTTP methods
     * @param path    the route template
     * @param action  the controller action
     * @return the created routes, in the order of {@code methods}
     */
    public List<Route> match(List<String> methods, String path, String action) {
        List<Route> created = new ArrayList<>();
        for (String method : methods) {
            created.add(addRoute(method.toUpperCase(), path, action));
        }
        return created;
    }

    /**
     * Names the most recently added route. Does nothing when no route exists yet.
     *
     * @param name the route name
     * @return this router for method chaining
     */
    public Router name(String name) {
        if (!routes.isEmpty()) {
            routes.get(routes.size() - 1).name(name);
        }
        return this;
    }

    void registerName(String name, Route route) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Route name must not be empty");
        }
        namedRoutes.put(name, route);
    }

    /**
     * Finds the first route matching the method and path.
     *
     * @param method the HTTP method, compared case-insensitively
     * @param path   the request path; query string and trailing slash are ignored
     * @return the match, or null if no route matches
     */
    public RouteMatch find(String method, String path) {
        String normalized = normalizePath(path);
        for (Route route : routes) {
            if (!route.getMethod().equalsIgnoreCase(method)) {
                continue;
            }
            Map<String, String> params = route.match(normalized);
            if (params != null) {
                return new RouteMatch(route, params);
            }
        }
        return null;
    }

    /**
     * Lists the methods of every route whose pattern accepts the path.
     *
     * @param path the request path
     * @return the methods in registration order, without duplicates
     */
    public Set<String> allowedMethods(String path) {
        String normalized = normalizePath(path);
        Set<String> methods = new LinkedHashSet<>();
        for (Route route : routes) {
            if (route.match(normalized) != null) {
                methods.add(route.getMethod());
            }
        }
        return methods;
    }

    /**
     * Generates the path of a named route.
     *
     * @param name   the route name
     * @param params values for the template placeholders; extra entries are ignored
     * @return the generated path
     * @throws RoutingException if the route is unknown or a placeholder has no value
     */
    public String url(String name, Map<String, ?> params) {
        Route route = namedRoutes.get(name);
        if (route == null) {
            throw new RoutingException("Route '" + name + "' not found");
        }

        String url = route.getPath();
        if (params != null) {
            for (Map.Entry<String, ?> entry : params.entrySet()) {
                Pattern placeholder = Pattern.compile(
                        "\\{" + Pattern.quote(entry.getKey()) + "(?::[a-zA-Z0-9_]+)?\\}");
                String value = String.valueOf(entry.getValue());
                url = placeholder.matcher(url).replaceAll(Matcher.quoteReplacement(value));
            }
        }

        if (UNFILLED_PLACEHOLDER.matcher(url).find()) {
            throw new RoutingException("Missing parameters for route '" + name + "'");
        }
        return url;
    }

    public String url(String name) {
        return url(name, Collections.emptyMap());
    }

    /**
     * Generates an absolute URL for a named route using the configured base URL.
     *
     * @param name   the route name
     * @param params values for the template placeholders
     * @return the base URL joined with the route path
     */
    public String absoluteUrl(String name, Map<String, ?> params) {
        String path = url(name, params);
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + path;
    }

    /**
     * Checks whether the current path is the URL of a named route. A name
     * containing {@code *} is a wildcard, e.g. {@code users.*}, and is tried
     * against every named route without parameters.
     *
     * @param namePattern a route name or wildcard
     * @param currentPath the current request path
     * @return true if one of the candidate routes generates the current path
     */
    public boolean isRoute(String namePattern, String currentPath) {
        String path = normalizePath(currentPath);
        if (namePattern.indexOf('*') < 0) {
            return namedRoutes.containsKey(namePattern) && path.equals(urlOrNull(namePattern));
        }

        Pattern wildcard = Pattern.compile(Arrays.stream(namePattern.split("\\*", -1))
                .map(part -> part.isEmpty() ? "" : Pattern.quote(part))
                .reduce((left, right) -> left + ".*" + right)
                .orElse(""));
        for (String name : namedRoutes.keySet()) {
            if (wildcard.matcher(name).matches() && path.equals(urlOrNull(name))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Navigation helper: returns {@code cssClass} when {@link #isRoute} holds.
     *
     * @param namePattern a route name or wildcard
     * @param currentPath the current request path
     * @param cssClass    the class to emit
     * @return the class, or an empty string
     */
    public String activeIf(String namePattern, String currentPath, String cssClass) {
        return isRoute(namePattern, currentPath) ? cssClass : "";
    }

    private String urlOrNull(String name) {
        try {
            return url(name);
        } catch (RoutingException e) {
            return null;
        }
    }

    public boolean hasRoute(String name) {
        return namedRoutes.containsKey(name);
    }

    /**
     * @return named routes in registration order
     */
    public Map<String, Route> getNamedRoutes() {
        return Collections.unmodifiableMap(namedRoutes);
    }

    /**
     * @return a snapshot of all routes in registration order
     */
    public List<Route> getRoutes() {
        return new ArrayList<>(routes);
    }

    /**
     * Registers a parameter type for templates compiled from now on.
     *
     * @param name  the type name
     * @param regex the regex fragment
     * @return this router for method chaining
     */
    public Router addPattern(String name, String regex) {
        patterns.add(name, regex);
        return this;
    }

    public ParameterPatterns getPatterns() {
        return patterns;
    }

    public Router setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl == null ? "" : baseUrl;
        return this;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Reduces a request path to the form templates are compiled against:
     * no query string, no trailing slash, {@code /} for an empty path.
     *
     * @param path the raw request path
     * @return the normalized path
     */
    public static String normalizePath(String path) {
        if (path == null) {
            return "/";
        }
        int query = path.indexOf('?');
        String normalized = query >= 0 ? path.substring(0, query) : path;
        int end = normalized.length();
        while (end > 0 && normalized.charAt(end - 1) == '/') {
            end--;
        }
        normalized = normalized.substring(0, end);
        if (normalized.isEmpty()) {
            return "/";
        }
        return normalized.startsWith("/") ? normalized : "/" + normalized;
    }
}
