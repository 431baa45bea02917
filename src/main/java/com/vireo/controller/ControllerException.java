package com.vireo.controller;

import com.vireo.core.VireoException;

/**
 * Thrown when a controller action string cannot be mapped to a class and a
 * callable method.
 */
public class ControllerException extends VireoException {

    public ControllerException(String message) {
        super(message);
    }

    public ControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
