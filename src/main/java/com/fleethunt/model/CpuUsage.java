package com.fleethunt.model;

public record CpuUsage(
    double userCpuTime,
    double systemCpuTime
) {

  public static final CpuUsage ZERO = new CpuUsage(0.0, 0.0);

  public CpuUsage plus(CpuUsage other) {
    return new CpuUsage(userCpuTime + other.userCpuTime, systemCpuTime + other.systemCpuTime);
  }
}
