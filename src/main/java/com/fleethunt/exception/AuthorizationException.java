package com.fleethunt.exception;

import com.fleethunt.enums.ProtectedAction;

/**
 * Thrown when a protected hunt operation is attempted without a granted approval.
 */
public class AuthorizationException extends HuntException {

  private final String huntId;
  private final String actor;
  private final ProtectedAction action;

  public AuthorizationException(String huntId, String actor, ProtectedAction action) {
    super("Approval required: user '" + actor + "' has no granted approval to "
        + action + " hunt " + huntId);
    this.huntId = huntId;
    this.actor = actor;
    this.action = action;
  }

  public String getHuntId() {
    return huntId;
  }

  public String getActor() {
    return actor;
  }

  public ProtectedAction getAction() {
    return action;
  }
}
