package com.fleethunt.exception;

/**
 * Base exception for the hunt control plane.
 */
public class HuntException extends RuntimeException {

  public HuntException(String message) {
    super(message);
  }

  public HuntException(String message, Throwable cause) {
    super(message, cause);
  }
}
