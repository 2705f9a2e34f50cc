package com.fleethunt.stats;

import com.fleethunt.model.CpuUsage;
import com.fleethunt.model.ResourceSample;
import com.fleethunt.model.UsageStatsSummary;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Resource accounting for one hunt: running statistics per metric, the worst performers and the
 * raw samples backing the per-client usage views.
 */
public class HuntUsageStats {

  private final RunningStatAccumulator userCpuStats =
      RunningStatAccumulator.withFixedWidthBins(0.0, 0.5, 21);
  private final RunningStatAccumulator systemCpuStats =
      RunningStatAccumulator.withFixedWidthBins(0.0, 0.5, 21);
  private final RunningStatAccumulator networkBytesSentStats =
      RunningStatAccumulator.withFixedWidthBins(0.0, 64 * 1024, 17);
  private final WorstPerformerList worstPerformers = new WorstPerformerList();
  private final Queue<ResourceSample> samples = new ConcurrentLinkedQueue<>();

  public void add(ResourceSample sample) {
    Objects.requireNonNull(sample, "sample");
    Objects.requireNonNull(sample.clientId(), "sample.clientId");
    samples.add(sample);
    userCpuStats.add(sample.userCpuTime());
    systemCpuStats.add(sample.systemCpuTime());
    networkBytesSentStats.add(sample.networkBytesSent());
    worstPerformers.add(sample);
  }

  public RunningStatAccumulator userCpuStats() {
    return userCpuStats;
  }

  public RunningStatAccumulator systemCpuStats() {
    return systemCpuStats;
  }

  public RunningStatAccumulator networkBytesSentStats() {
    return networkBytesSentStats;
  }

  public List<ResourceSample> worstPerformers() {
    return worstPerformers.snapshot();
  }

  public UsageStatsSummary summary() {
    return new UsageStatsSummary(
        userCpuStats.summary(),
        systemCpuStats.summary(),
        networkBytesSentStats.summary(),
        worstPerformers.snapshot()
    );
  }

  /**
   * Summed (user, system) CPU time per client. A null client id selects every client.
   */
  public Map<String, CpuUsage> resourceUsageByClient(String clientId) {
    Map<String, CpuUsage> result = new TreeMap<>();
    for (ResourceSample sample : samples) {
      if (clientId == null || clientId.equals(sample.clientId())) {
        result.merge(sample.clientId(), sample.cpuUsage(), CpuUsage::plus);
      }
    }
    return result;
  }

  /**
   * Per-task (user, system) CPU time grouped by client. A null client id selects every client.
   */
  public Map<String, Map<String, CpuUsage>> resourceUsageByTask(String clientId) {
    Map<String, Map<String, CpuUsage>> result = new TreeMap<>();
    for (ResourceSample sample : samples) {
      if (clientId == null || clientId.equals(sample.clientId())) {
        result.computeIfAbsent(sample.clientId(), k -> new TreeMap<>())
            .merge(Objects.requireNonNullElse(sample.taskId(), ""), sample.cpuUsage(), CpuUsage::plus);
      }
    }
    return result;
  }
}
