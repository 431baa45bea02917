package com.vireo.routing;

import com.vireo.core.VireoException;

/** Thrown for unknown route names, incomplete URL parameters and invalid templates. */
public class RoutingException extends VireoException {

    public RoutingException(String message) {
        super(message);
    }
}
