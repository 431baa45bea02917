package com.vireo.middleware;

import com.vireo.core.VireoException;

/**
 * Thrown for unknown middleware names and middleware classes that cannot be
 * registered or instantiated.
 */
public class MiddlewareException extends VireoException {

    public MiddlewareException(String message) {
        super(message);
    }

    public MiddlewareException(String message, Throwable cause) {
        super(message, cause);
    }
}
