package com.fleethunt.model;

public record ForemanAction(
    String huntId,
    String huntName
) {}
