package com.fleethunt.foreman;

import java.util.Set;

/**
 * Records which clients a hunt has been dispatched to. {@link #tryAssign} is the at-most-once
 * boundary: it returns true for exactly one caller per (hunt, client) pair.
 */
public interface AssignmentStore {

  boolean tryAssign(String huntId, String clientId);

  boolean isAssigned(String huntId, String clientId);

  Set<String> assignedClients(String huntId);
}
