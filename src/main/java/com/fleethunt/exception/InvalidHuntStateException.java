package com.fleethunt.exception;

import com.fleethunt.enums.HuntState;

public class InvalidHuntStateException extends HuntException {

  public InvalidHuntStateException(String huntId, HuntState state, String operation) {
    super("Cannot " + operation + " hunt " + huntId + " in state " + state);
  }
}
