package com.vireo.routing;

import java.util.Collections;
import java.util.Map;

/** The route selected for a request together with its extracted path parameters. */
public final class RouteMatch {
    private final Route route;
    private final Map<String, String> params;

    public RouteMatch(Route route, Map<String, String> params) {
        this.route = route;
        this.params = Collections.unmodifiableMap(params);
    }

    public Route getRoute() {
        return route;
    }

    /**
     * @return path parameters in template order
     */
    public Map<String, String> getParams() {
        return params;
    }

    public String getParam(String name) {
        return params.get(name);
    }
}
