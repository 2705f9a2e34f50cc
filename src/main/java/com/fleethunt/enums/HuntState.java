package com.fleethunt.enums;

public enum HuntState {
  CONSTRUCTED,
  RUNNING,
  PAUSED,
  STOPPED;

  public boolean isTerminal() {
    return this == STOPPED;
  }
}
