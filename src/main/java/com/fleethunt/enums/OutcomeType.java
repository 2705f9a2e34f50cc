package com.fleethunt.enums;

public enum OutcomeType {
  SUCCESS,
  BADNESS,
  ERROR
}
