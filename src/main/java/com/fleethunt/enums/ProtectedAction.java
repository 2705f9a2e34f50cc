package com.fleethunt.enums;

/**
 * Hunt operations that require a granted approval unless the caller holds a supervisor override.
 */
public enum ProtectedAction {
  RUN,
  PAUSE,
  MODIFY,
  STOP
}
