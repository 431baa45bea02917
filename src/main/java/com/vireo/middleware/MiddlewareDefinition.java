package com.vireo.middleware;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A parsed middleware reference: {@code "name:p1:p2"} split on colons, the
 * first part being the name and the rest positional string parameters.
 */
public final class MiddlewareDefinition {
    private final String name;
    private final List<String> params;

    private MiddlewareDefinition(String name, List<String> params) {
        this.name = name;
        this.params = params;
    }

    /**
     * Parses a definition string.
     *
     * @param definition the definition, e.g. {@code "jwt:admin:editor"}
     * @return the parsed definition
     * @throws MiddlewareException if the name part is empty
     */
    public static MiddlewareDefinition parse(String definition) {
        if (definition == null || definition.isEmpty()) {
            throw new MiddlewareException("Middleware definition must not be empty");
        }
        String[] parts = definition.split(":", -1);
        if (parts[0].isEmpty()) {
            throw new MiddlewareException("Middleware definition has no name: '" + definition + "'");
        }
        List<String> params = parts.length > 1
                ? Collections.unmodifiableList(Arrays.asList(Arrays.copyOfRange(parts, 1, parts.length)))
                : Collections.emptyList();
        return new MiddlewareDefinition(parts[0], params);
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public String[] paramArray() {
        return params.toArray(new String[0]);
    }

    @Override
    public String toString() {
        return params.isEmpty() ? name : name + ":" + String.join(":", params);
    }
}
