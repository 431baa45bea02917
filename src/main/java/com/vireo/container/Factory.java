package com.vireo.container;

/**
 * Builds an instance for a registered type. Factories take precedence over
 * class bindings.
 *
 * @param <T> the produced type
 */
@FunctionalInterface
public interface Factory<T> {
    /**
     * Creates the instance.
     *
     * @param container the container, for resolving further dependencies
     * @return the new instance
     */
    T create(Container container);
}
