package com.vireo.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Named regex fragments available to typed placeholders such as
 * {@code {id:uuid}} or {@code {year:year}}.
 */
public class ParameterPatterns {
    private static final Pattern TYPE_NAME = Pattern.compile("[a-zA-Z0-9_]+");

    private final Map<String, String> patterns = new LinkedHashMap<>();

    /**
     * Creates a table holding the built-in types.
     */
    public ParameterPatterns() {
        patterns.put("id", "[A-Z0-9]{8}");
        patterns.put("uuid", "[a-zA-Z0-9-]{36}");
        patterns.put("string", "[a-zA-Z]+");
        patterns.put("alpha", "[a-zA-Z]+");
        patterns.put("alphanum", "[a-zA-Z0-9]+");
        patterns.put("slug", "[a-zA-Z0-9-_]+");
        patterns.put("number", "[0-9]+");
        patterns.put("year", "[0-9]{4}");
        patterns.put("month", "[0-9]{1,2}");
        patterns.put("day", "[0-9]{1,2}");
        patterns.put("code", "[A-Z0-9]{6}");
        patterns.put("token", "[a-zA-Z0-9]{16}");
        patterns.put("phone", "[0-9-+]+");
        patterns.put("any", ".*");
    }

    /**
     * Registers or replaces a named type.
     *
     * @param name  the type name used after the colon in a placeholder
     * @param regex the regex fragment, without capture group or anchors
     * @return this table for method chaining
     * @throws IllegalArgumentException if the name or the regex is invalid
     */
    public ParameterPatterns add(String name, String regex) {
        if (name == null || !TYPE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid parameter type name: " + name);
        }
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid regex for parameter type '" + name + "': " + regex, e);
        }
        patterns.put(name, regex);
        return this;
    }

    /**
     * Gets the regex fragment of a type.
     *
     * @param name the type name
     * @return the fragment, or null if the type is unknown
     */
    public String get(String name) {
        return patterns.get(name);
    }

    public boolean has(String name) {
        return patterns.containsKey(name);
    }

    /**
     * @return an unmodifiable view of all types in registration order
     */
    public Map<String, String> all() {
        return Collections.unmodifiableMap(patterns);
    }
}
