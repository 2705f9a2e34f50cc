package com.fleethunt.enums;

public enum ApprovalState {
  UNREQUESTED,
  REQUESTED,
  GRANTED
}
