package com.fleethunt.model;

import com.fleethunt.enums.ClientStatus;

public record ClientStatusView(
    String clientId,
    ClientStatus status
) {}
