package com.fleethunt.controller;

/** Request headers identifying who performs a hunt operation. */
final class ActorHeaders {

  static final String USER = "X-User";
  static final String SUPERVISOR = "X-Supervisor";

  private ActorHeaders() {}
}
