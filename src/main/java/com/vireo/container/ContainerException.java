package com.vireo.container;

import com.vireo.core.VireoException;

/**
 * Thrown when the container cannot produce an instance of a requested type.
 */
public class ContainerException extends VireoException {

    public ContainerException(String message) {
        super(message);
    }

    public ContainerException(String message, Throwable cause) {
        super(message, cause);
    }
}
