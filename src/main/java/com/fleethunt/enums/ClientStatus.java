package com.fleethunt.enums;

public enum ClientStatus {
  OUTSTANDING,
  COMPLETED,
  BAD,
  ERROR
}
