package com.fleethunt.model;

import com.fleethunt.enums.OutcomeType;
import jakarta.validation.constraints.NotNull;

/**
 * Terminal result of one client's task. Errors are carried as data rather than thrown.
 */
public record Outcome(
    @NotNull OutcomeType type,
    String message,
    String backtrace
) {

  public static Outcome success() {
    return new Outcome(OutcomeType.SUCCESS, null, null);
  }

  public static Outcome badness() {
    return new Outcome(OutcomeType.BADNESS, null, null);
  }

  public static Outcome error(String message) {
    return new Outcome(OutcomeType.ERROR, message, null);
  }

  public static Outcome error(String message, String backtrace) {
    return new Outcome(OutcomeType.ERROR, message, backtrace);
  }
}
