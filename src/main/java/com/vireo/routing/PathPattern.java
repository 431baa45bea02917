package com.vireo.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled form of a route template such as {@code /users/{id:number}/posts/{slug}}.
 *
 * <p>Placeholders become capture groups: a registered type contributes its regex,
 * a numeric type {@code {code:6}} means exactly that many alphanumerics, and an
 * untyped or unknown placeholder accepts {@code [a-zA-Z0-9_-]+}. Everything else
 * in the template is matched literally and the expression is anchored at both ends.
 */
public final class PathPattern {
    static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z0-9_]+)(?::([a-zA-Z0-9_]+))?\\}");

    private static final String DEFAULT_SEGMENT = "[a-zA-Z0-9_-]+";
    private static final Pattern NUMERIC = Pattern.compile("[0-9]+");

    private final String template;
    private final Pattern pattern;
    private final List<String> paramNames;
    private final int[] groupIndexes;
    private final boolean literal;

    private PathPattern(String template, Pattern pattern, List<String> paramNames, int[] groupIndexes) {
        this.template = template;
        this.pattern = pattern;
        this.paramNames = Collections.unmodifiableList(paramNames);
        this.groupIndexes = groupIndexes;
        this.literal = paramNames.isEmpty();
    }

    /**
     * Compiles a template.
     *
     * @param template the route template
     * @param types    the named parameter types
     * @return the compiled pattern
     */
    public static PathPattern compile(String template, ParameterPatterns types) {
        String normalized = normalizeTemplate(template);
        List<String> paramNames = new ArrayList<>();
        List<Integer> groups = new ArrayList<>();
        int nextGroup = 1;
        StringBuilder regex = new StringBuilder("^");

        Matcher matcher = PLACEHOLDER.matcher(normalized);
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                regex.append(Pattern.quote(normalized.substring(last, matcher.start())));
            }
            String name = matcher.group(1);
            if (paramNames.contains(name)) {
                throw new RoutingException("Duplicate parameter '" + name + "' in route " + normalized);
            }
            String fragment = typeRegex(matcher.group(2), types);
            paramNames.add(name);
            groups.add(nextGroup);
            // a custom type may carry its own groups; skip past them
            nextGroup += 1 + Pattern.compile(fragment).matcher("").groupCount();
            regex.append('(').append(fragment).append(')');
            last = matcher.end();
        }
        if (last < normalized.length()) {
            regex.append(Pattern.quote(normalized.substring(last)));
        }
        regex.append('$');

        int[] groupIndexes = groups.stream().mapToInt(Integer::intValue).toArray();
        return new PathPattern(normalized, Pattern.compile(regex.toString()), paramNames, groupIndexes);
    }

    private static String typeRegex(String type, ParameterPatterns types) {
        if (type == null) {
            return DEFAULT_SEGMENT;
        }
        String registered = types.get(type);
        if (registered != null) {
            return registered;
        }
        if (NUMERIC.matcher(type).matches()) {
            return "[a-zA-Z0-9]{" + type + "}";
        }
        return DEFAULT_SEGMENT;
    }

    /**
     * Ensures a leading slash and drops a trailing one, the same shape request
     * paths are reduced to before matching.
     *
     * @param template the raw template
     * @return the normalized template
     */
    static String normalizeTemplate(String template) {
        if (template == null || template.isEmpty()) {
            return "/";
        }
        String normalized = template.startsWith("/") ? template : "/" + template;
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    /**
     * Matches a normalized request path.
     *
     * @param path the request path
     * @return the parameters in template order, or null if the path does not match
     */
    public Map<String, String> match(String path) {
        if (literal) {
            return template.equals(path) ? new LinkedHashMap<>() : null;
        }
        Matcher matcher = pattern.matcher(path);
        if (!matcher.matches()) {
            return null;
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < paramNames.size(); i++) {
            String value = matcher.group(groupIndexes[i]);
            if (value != null) {
                params.put(paramNames.get(i), value);
            }
        }
        return params;
    }

    public String getTemplate() {
        return template;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    @Override
    public String toString() {
        return template + " -> " + pattern.pattern();
    }
}
