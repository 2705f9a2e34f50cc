package com.fleethunt.model;

import java.util.List;

public record UsageStatsSummary(
    StatSummary userCpuStats,
    StatSummary systemCpuStats,
    StatSummary networkBytesSentStats,
    List<ResourceSample> worstPerformers
) {}
