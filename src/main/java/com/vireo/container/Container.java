package com.vireo.container;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reflection-based dependency injection container.
 *
 * <p>Resolution order for a requested type:
 * <ol>
 *   <li>a registered {@link Factory};</li>
 *   <li>a cached instance (singletons and {@link #instance} registrations);</li>
 *   <li>a class binding, resolved in turn;</li>
 *   <li>constructor injection on the concrete class.</li>
 * </ol>
 *
 * <p>Constructor parameters of class types are resolved recursively. Primitive,
 * boxed and {@code String} parameters need a {@link DefaultValue}. A type that
 * reappears while it is being resolved raises a
 * {@link CircularDependencyException}.
 *
 * <p>Registrations are meant to happen at start-up; resolution is safe from
 * concurrent request threads and a singleton is created at most once.
 */
public class Container {
    private static final Logger logger = LoggerFactory.getLogger(Container.class);

    private final Map<Class<?>, Class<?>> bindings = new ConcurrentHashMap<>();
    private final Map<Class<?>, Factory<?>> factories = new ConcurrentHashMap<>();
    private final Map<Class<?>, Object> instances = new ConcurrentHashMap<>();
    private final Set<Class<?>> singletons = ConcurrentHashMap.newKeySet();
    private final Map<Class<?>, Object> singletonLocks = new ConcurrentHashMap<>();
    private final ThreadLocal<Deque<Class<?>>> resolving = ThreadLocal.withInitial(ArrayDeque::new);

    /**
     * Creates an empty container that can resolve itself.
     */
    public Container() {
        instances.put(Container.class, this);
    }

    /**
     * Binds an abstract type to the class that implements it.
     *
     * @param type     the requested type
     * @param concrete the class to instantiate instead
     * @param <T>      the requested type
     * @return this container for method chaining
     */
    public <T> Container bind(Class<T> type, Class<? extends T> concrete) {
        bindings.put(type, concrete);
        return this;
    }

    /**
     * Registers a factory. Factories win over bindings and cached instances.
     *
     * @param type    the requested type
     * @param factory the factory
     * @param <T>     the requested type
     * @return this container for method chaining
     */
    public <T> Container factory(Class<T> type, Factory<? extends T> factory) {
        factories.put(type, factory);
        return this;
    }

    /**
     * Binds a type whose instance is created on first resolution and then
     * shared.
     *
     * @param type     the requested type
     * @param concrete the class to instantiate
     * @param <T>      the requested type
     * @return this container for method chaining
     */
    public <T> Container singleton(Class<T> type, Class<? extends T> concrete) {
        if (type != concrete) {
            bindings.put(type, concrete);
        }
        singletons.add(type);
        return this;
    }

    public <T> Container singleton(Class<T> type) {
        return singleton(type, type);
    }

    /**
     * Registers a ready-made shared instance.
     *
     * @param type     the requested type
     * @param instance the instance to hand out
     * @param <T>      the requested type
     * @return this container for method chaining
     */
    public <T> Container instance(Class<T> type, T instance) {
        instances.put(type, instance);
        return this;
    }

    /**
     * @param type the requested type
     * @return true if a factory, binding, singleton or instance is registered
     */
    public boolean has(Class<?> type) {
        return factories.containsKey(type) || bindings.containsKey(type)
                || instances.containsKey(type) || singletons.contains(type);
    }

    /**
     * Resolves an instance of the given type.
     *
     * @param type the requested type
     * @param <T>  the requested type
     * @return the instance
     * @throws ContainerException if the type cannot be built
     */
    public <T> T resolve(Class<T> type) {
        Deque<Class<?>> stack = resolving.get();
        if (stack.contains(type)) {
            throw new CircularDependencyException(describeCycle(stack, type));
        }

        stack.push(type);
        try {
            return cast(type, doResolve(type));
        } finally {
            stack.pop();
            if (stack.isEmpty()) {
                resolving.remove();
            }
        }
    }

    private Object doResolve(Class<?> type) {
        Factory<?> factory = factories.get(type);
        if (factory != null) {
            Object created = factory.create(this);
            if (created == null) {
                throw new ContainerException("Factory for " + type.getName() + " returned null");
            }
            return created;
        }

        Object cached = instances.get(type);
        if (cached != null) {
            return cached;
        }

        if (!singletons.contains(type)) {
            return create(type);
        }

        // one lock per type; building the graph of one singleton never blocks another
        synchronized (singletonLocks.computeIfAbsent(type, key -> new Object())) {
            cached = instances.get(type);
            if (cached == null) {
                cached = create(type);
                instances.put(type, cached);
                logger.debug("Created singleton {}", type.getName());
            }
            return cached;
        }
    }

    private Object create(Class<?> type) {
        Class<?> concrete = bindings.get(type);
        if (concrete != null && concrete != type) {
            return resolve(concrete);
        }
        return construct(type);
    }

    private Object construct(Class<?> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new ContainerException("Cannot instantiate " + type.getName()
                    + ". Please register a binding using bind(" + type.getSimpleName()
                    + ".class, ConcreteClass.class)");
        }
        if (type.isPrimitive() || type.isArray() || type.isEnum()) {
            throw new ContainerException("Cannot instantiate " + type.getName());
        }

        Constructor<?> constructor = selectConstructor(type);
        Parameter[] parameters = constructor.getParameters();
        Object[] arguments = new Object[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            arguments[i] = resolveParameter(type, parameters[i]);
        }

        try {
            constructor.trySetAccessible();
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ContainerException("Failed to instantiate " + type.getName() + ": " + cause.getMessage(), cause);
        } catch (ReflectiveOperationException e) {
            throw new ContainerException("Failed to instantiate " + type.getName() + ": " + e.getMessage(), e);
        }
    }

    private Constructor<?> selectConstructor(Class<?> type) {
        Constructor<?>[] constructors = type.getConstructors();
        if (constructors.length == 0) {
            throw new ContainerException("Cannot instantiate " + type.getName() + ": no public constructor");
        }
        if (constructors.length == 1) {
            return constructors[0];
        }

        Constructor<?> noArgs = null;
        for (Constructor<?> constructor : constructors) {
            if (constructor.isAnnotationPresent(Inject.class)) {
                return constructor;
            }
            if (constructor.getParameterCount() == 0) {
                noArgs = constructor;
            }
        }
        if (noArgs != null) {
            return noArgs;
        }
        throw new ContainerException("Cannot choose a constructor for " + type.getName()
                + ". Annotate one of its public constructors with @Inject");
    }

    private Object resolveParameter(Class<?> owner, Parameter parameter) {
        Class<?> dependency = parameter.getType();
        if (isBuiltin(dependency)) {
            DefaultValue defaultValue = parameter.getAnnotation(DefaultValue.class);
            if (defaultValue == null) {
                throw new ContainerException("Cannot resolve built-in type parameter " + parameter.getName()
                        + " in " + owner.getName() + ". Parameter must have a @DefaultValue");
            }
            return convert(defaultValue.value(), dependency, owner, parameter);
        }

        try {
            return resolve(dependency);
        } catch (CircularDependencyException e) {
            throw e;
        } catch (ContainerException e) {
            throw new ContainerException("Cannot resolve dependency " + dependency.getName()
                    + " for " + owner.getName() + ": " + e.getMessage(), e);
        }
    }

    static boolean isBuiltin(Class<?> type) {
        return type.isPrimitive()
                || type == String.class
                || type == Boolean.class
                || type == Character.class
                || Number.class.isAssignableFrom(type) && type.getName().startsWith("java.lang.");
    }

    private static Object convert(String text, Class<?> type, Class<?> owner, Parameter parameter) {
        try {
            if (type == String.class) {
                return text;
            } else if (type == int.class || type == Integer.class) {
                return Integer.valueOf(text.trim());
            } else if (type == long.class || type == Long.class) {
                return Long.valueOf(text.trim());
            } else if (type == boolean.class || type == Boolean.class) {
                return Boolean.valueOf(text.trim());
            } else if (type == double.class || type == Double.class) {
                return Double.valueOf(text.trim());
            } else if (type == float.class || type == Float.class) {
                return Float.valueOf(text.trim());
            } else if (type == short.class || type == Short.class) {
                return Short.valueOf(text.trim());
            } else if (type == byte.class || type == Byte.class) {
                return Byte.valueOf(text.trim());
            } else if ((type == char.class || type == Character.class) && text.length() == 1) {
                return text.charAt(0);
            }
        } catch (NumberFormatException e) {
            throw new ContainerException("Invalid @DefaultValue '" + text + "' for parameter "
                    + parameter.getName() + " in " + owner.getName(), e);
        }
        throw new ContainerException("Cannot convert @DefaultValue '" + text + "' to " + type.getName()
                + " for parameter " + parameter.getName() + " in " + owner.getName());
    }

    private static String describeCycle(Deque<Class<?>> stack, Class<?> repeated) {
        StringBuilder chain = new StringBuilder();
        Iterator<Class<?>> outermostFirst = stack.descendingIterator();
        boolean inCycle = false;
        while (outermostFirst.hasNext()) {
            Class<?> type = outermostFirst.next();
            if (type == repeated) {
                inCycle = true;
            }
            if (inCycle) {
                chain.append(type.getSimpleName()).append(" -> ");
            }
        }
        return chain.append(repeated.getSimpleName()).toString();
    }

    @SuppressWarnings("unchecked")
    private static <T> T cast(Class<T> type, Object value) {
        if (type.isPrimitive()) {
            return (T) value;
        }
        return type.cast(value);
    }
}
