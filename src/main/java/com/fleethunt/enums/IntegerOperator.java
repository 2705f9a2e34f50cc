package com.fleethunt.enums;

public enum IntegerOperator {
  LESS_THAN,
  EQUAL,
  GREATER_THAN
}
