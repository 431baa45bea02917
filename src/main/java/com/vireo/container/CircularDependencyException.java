package com.vireo.container;

/**
 * Thrown when a type depends on itself, directly or through other
 * constructor parameters. Propagates without the per-level wrapping other
 * resolution errors get, so the message shows the whole chain once.
 */
public class CircularDependencyException extends ContainerException {

    public CircularDependencyException(String chain) {
        super("Circular dependency detected: " + chain);
    }
}
