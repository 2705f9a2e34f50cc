package com.fleethunt.stats;

import com.fleethunt.model.ResourceSample;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the samples with the highest combined CPU time, sorted descending.
 */
public class WorstPerformerList {

  public static final int DEFAULT_CAPACITY = 10;

  private final int capacity;
  private final List<ResourceSample> entries;

  public WorstPerformerList() {
    this(DEFAULT_CAPACITY);
  }

  public WorstPerformerList(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Capacity must be positive");
    }
    this.capacity = capacity;
    this.entries = new ArrayList<>(capacity + 1);
  }

  public synchronized void add(ResourceSample sample) {
    double total = sample.totalCpuTime();
    if (entries.size() == capacity && total <= entries.get(entries.size() - 1).totalCpuTime()) {
      return;
    }
    int idx = 0;
    while (idx < entries.size() && entries.get(idx).totalCpuTime() >= total) {
      idx++;
    }
    entries.add(idx, sample);
    if (entries.size() > capacity) {
      entries.remove(entries.size() - 1);
    }
  }

  public synchronized List<ResourceSample> snapshot() {
    return List.copyOf(entries);
  }
}
