package com.vireo.middleware;

import com.vireo.container.Container;
import com.vireo.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Named middleware available to routes.
 *
 * <p>A name maps either to a ready instance or to a class. Classes are
 * instantiated through the {@link Container} on every execution, so they may
 * declare constructor dependencies and keep per-request state in fields.
 */
public class MiddlewareRegistry {
    private static final Logger logger = LoggerFactory.getLogger(MiddlewareRegistry.class);

    private final Container container;
    private final Map<String, Middleware> instances = new ConcurrentHashMap<>();
    private final Map<String, Class<? extends Middleware>> classes = new ConcurrentHashMap<>();

    public MiddlewareRegistry(Container container) {
        this.container = container;
    }

    /**
     * Registers a middleware instance under a name, replacing any previous
     * registration of that name.
     *
     * @param name       the middleware name
     * @param middleware the middleware
     * @return this registry for method chaining
     */
    public MiddlewareRegistry register(String name, Middleware middleware) {
        validateName(name);
        classes.remove(name);
        instances.put(name, middleware);
        return this;
    }

    /**
     * Registers a middleware class under a name derived from its simple name.
     *
     * @param type the middleware class
     * @return the derived name
     * @see #deriveName(String)
     */
    public String register(Class<? extends Middleware> type) {
        String name = deriveName(type.getSimpleName());
        register(name, type);
        return name;
    }

    public MiddlewareRegistry register(String name, Class<? extends Middleware> type) {
        validateName(name);
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new MiddlewareException("Middleware " + type.getName() + " is not a concrete class");
        }
        instances.remove(name);
        classes.put(name, type);
        return this;
    }

    /**
     * Registers every {@link Middleware} implementation published under
     * {@code META-INF/services/com.vireo.middleware.Middleware}, named after
     * its class. Providers are not instantiated here.
     *
     * @return the names registered, sorted
     */
    public Set<String> discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    public Set<String> discover(ClassLoader classLoader) {
        List<Class<? extends Middleware>> found = ServiceLoader.load(Middleware.class, classLoader)
                .stream()
                .map(ServiceLoader.Provider::type)
                .sorted(Comparator.comparing(Class::getName))
                .collect(Collectors.toList());

        Set<String> names = new TreeSet<>();
        for (Class<? extends Middleware> type : found) {
            String name = register(type);
            names.add(name);
            logger.debug("Discovered middleware '{}' -> {}", name, type.getName());
        }
        return names;
    }

    public boolean has(String name) {
        return instances.containsKey(name) || classes.containsKey(name);
    }

    public Set<String> names() {
        Set<String> names = new TreeSet<>(instances.keySet());
        names.addAll(classes.keySet());
        return names;
    }

    /**
     * Looks up the middleware a name refers to, instantiating registered
     * classes.
     *
     * @param name the middleware name
     * @return the middleware
     * @throws MiddlewareException if nothing is registered under the name
     */
    public Middleware get(String name) {
        Middleware middleware = instances.get(name);
        if (middleware != null) {
            return middleware;
        }
        Class<? extends Middleware> type = classes.get(name);
        if (type == null) {
            throw new MiddlewareException("Middleware '" + name + "' not found");
        }
        return container.resolve(type);
    }

    /**
     * Parses and runs one middleware definition.
     *
     * @param definition the definition, e.g. {@code "jwt:admin"}
     * @param ctx        the request context
     * @return false if the middleware halted the request
     * @throws Exception whatever the middleware throws
     */
    public boolean execute(String definition, Context ctx) throws Exception {
        MiddlewareDefinition parsed = MiddlewareDefinition.parse(definition);
        return get(parsed.getName()).handle(ctx, parsed.paramArray());
    }

    /**
     * Derives a middleware name from a class name: the {@code Middleware}
     * suffix is dropped and PascalCase becomes kebab-case, so
     * {@code CustomAuthMiddleware} is registered as {@code custom-auth}.
     *
     * @param simpleName the simple class name
     * @return the middleware name
     */
    public static String deriveName(String simpleName) {
        String base = simpleName.endsWith("Middleware")
                ? simpleName.substring(0, simpleName.length() - "Middleware".length())
                : simpleName;
        return base.replaceAll("(?<!^)[A-Z]", "-$0").toLowerCase(Locale.ROOT);
    }

    private static void validateName(String name) {
        if (name == null || name.isEmpty() || name.indexOf(':') >= 0) {
            throw new MiddlewareException("Invalid middleware name: '" + name + "'");
        }
    }
}
