package com.fleethunt.model;

public record ResourceSample(
    String clientId,
    String taskId,
    double userCpuTime,
    double systemCpuTime,
    long networkBytesSent
) {

  public double totalCpuTime() {
    return userCpuTime + systemCpuTime;
  }

  public CpuUsage cpuUsage() {
    return new CpuUsage(userCpuTime, systemCpuTime);
  }
}
