package com.vireo.core;

/**
 * Base type for the framework's own runtime failures. Handler and middleware
 * code may still throw any exception; the dispatcher turns all of them into
 * error responses.
 */
public class VireoException extends RuntimeException {

  public VireoException(String message) {
    super(message);
  }

  public VireoException(String message, Throwable cause) {
    super(message, cause);
  }
}
