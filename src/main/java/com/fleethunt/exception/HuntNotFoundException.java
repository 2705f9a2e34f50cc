package com.fleethunt.exception;

public class HuntNotFoundException extends HuntException {

  public HuntNotFoundException(String huntId) {
    super("Hunt not found: " + huntId);
  }
}
