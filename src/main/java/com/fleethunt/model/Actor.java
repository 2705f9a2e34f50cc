package com.fleethunt.model;

/**
 * The identity performing an operation. {@code supervisor} marks an administrative override.
 */
public record Actor(
    String username,
    boolean supervisor
) {

  public static Actor user(String username) {
    return new Actor(username, false);
  }

  public static Actor supervisor(String username) {
    return new Actor(username, true);
  }
}
