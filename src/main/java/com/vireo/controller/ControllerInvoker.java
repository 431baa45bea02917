package com.vireo.controller;

import com.vireo.container.Container;
import com.vireo.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs {@code "Controller@method"} actions.
 *
 * <p>A simple controller name is looked up in the configured packages in
 * order, then in the unnamed package; a name containing a dot is taken as
 * fully qualified. A new controller instance is built through the
 * {@link Container} for every call.
 *
 * <p>Accepted action signatures, tried in this order:
 * {@code (Context, Map)}, {@code (Context)}, {@code (Map)} and {@code ()}.
 * The map receives the route parameters overlaid by the request data.
 */
public class ControllerInvoker {
    private static final Logger logger = LoggerFactory.getLogger(ControllerInvoker.class);

    private final Container container;
    private final List<String> packages;
    private final ClassLoader classLoader;
    private final Map<String, Optional<Class<?>>> classCache = new ConcurrentHashMap<>();

    public ControllerInvoker(Container container, List<String> packages) {
        this(container, packages, ControllerInvoker.class.getClassLoader());
    }

    public ControllerInvoker(Container container, List<String> packages, ClassLoader classLoader) {
        this.container = container;
        this.packages = new ArrayList<>(packages);
        this.classLoader = classLoader;
    }

    /**
     * Resolves and calls a controller action.
     *
     * @param action the action, {@code "UserController@show"}
     * @param ctx    the request context
     * @return whatever the action returned
     * @throws Exception whatever the action throws, unwrapped
     */
    public Object invoke(String action, Context ctx) throws Exception {
        int at = action.lastIndexOf('@');
        if (at <= 0 || at == action.length() - 1) {
            throw new ControllerException("Invalid controller action: " + action);
        }
        String controllerName = action.substring(0, at);
        String methodName = action.substring(at + 1);

        Class<?> controllerClass = findController(controllerName);
        Method method = findMethod(controllerClass, methodName);
        Object controller = container.resolve(controllerClass);
        if (controller instanceof Controller) {
            ((Controller) controller).bind(ctx);
        }

        logger.debug("Dispatching to {}@{}", controllerClass.getName(), methodName);
        try {
            return method.invoke(controller, arguments(method, ctx));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    /**
     * Finds the controller class for a simple or fully qualified name.
     *
     * @param name the controller name
     * @return the class
     * @throws ControllerException if no candidate class exists
     */
    public Class<?> findController(String name) {
        return classCache.computeIfAbsent(name, this::lookup)
                .orElseThrow(() -> new ControllerException("Controller not found: " + name
                        + ". Searched in " + searchedLocations(name)));
    }

    private Optional<Class<?>> lookup(String name) {
        for (String candidate : candidates(name)) {
            try {
                return Optional.of(Class.forName(candidate, true, classLoader));
            } catch (ClassNotFoundException e) {
                logger.trace("No controller class {}", candidate);
            }
        }
        return Optional.empty();
    }

    private List<String> candidates(String name) {
        List<String> candidates = new ArrayList<>();
        if (name.indexOf('.') >= 0) {
            candidates.add(name);
            return candidates;
        }
        for (String pkg : packages) {
            candidates.add(pkg + "." + name);
        }
        candidates.add(name);
        return candidates;
    }

    private String searchedLocations(String name) {
        if (name.indexOf('.') >= 0) {
            return "the fully qualified name";
        }
        List<String> locations = new ArrayList<>(packages);
        locations.add("the default package");
        return String.join(", ", locations);
    }

    private static Method findMethod(Class<?> type, String name) {
        Method best = null;
        int bestRank = Integer.MAX_VALUE;
        for (Method method : type.getMethods()) {
            if (!method.getName().equals(name) || Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            int rank = rank(method.getParameterTypes());
            if (rank < bestRank) {
                best = method;
                bestRank = rank;
            }
        }
        if (best == null) {
            throw new ControllerException("Method " + name + " not found in " + type.getName());
        }
        return best;
    }

    private static int rank(Class<?>[] types) {
        if (types.length == 2 && types[0] == Context.class && types[1].isAssignableFrom(Map.class)) {
            return 0;
        }
        if (types.length == 1 && types[0] == Context.class) {
            return 1;
        }
        if (types.length == 1 && types[0].isAssignableFrom(Map.class)) {
            return 2;
        }
        if (types.length == 0) {
            return 3;
        }
        return Integer.MAX_VALUE;
    }

    private static Object[] arguments(Method method, Context ctx) {
        switch (rank(method.getParameterTypes())) {
            case 0:
                return new Object[] {ctx, ctx.params()};
            case 1:
                return new Object[] {ctx};
            case 2:
                return new Object[] {ctx.params()};
            default:
                return new Object[0];
        }
    }
}
