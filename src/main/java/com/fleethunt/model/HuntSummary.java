package com.fleethunt.model;

import com.fleethunt.enums.HuntState;
import java.time.Duration;
import java.time.Instant;

public record HuntSummary(
    String id,
    String name,
    String creator,
    String description,
    Instant createdAt,
    HuntState state,
    int ruleCount,
    int clientLimit,
    Duration expiry,
    String notificationEvent,
    int startedCount,
    int finishedCount,
    int erroredCount,
    int badnessCount,
    int outstandingRequests,
    UsageStatsSummary usageStats
) {}
