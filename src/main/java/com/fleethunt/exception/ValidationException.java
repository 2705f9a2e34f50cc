package com.fleethunt.exception;

/**
 * Thrown when a rule, hunt parameter or approval request/grant is malformed.
 * Raised by the call that introduced the bad input, never deferred.
 */
public class ValidationException extends HuntException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
