package com.fleethunt.stats;

import com.fleethunt.model.HistogramBin;
import com.fleethunt.model.StatSummary;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Online count/mean/variance (Welford) plus a histogram over fixed bin boundaries.
 *
 * <p>All mutators and readers are synchronized, so concurrent producers may call {@link #add}
 * freely. Values below the first boundary are counted in the first bin; the last bin is
 * open-ended. The reported standard deviation is the population one (divides by N).
 */
public class RunningStatAccumulator {

  private final double[] binBoundaries;
  private final long[] binCounts;

  private long count;
  private double mean;
  private double sumSquaredDeviations;

  public RunningStatAccumulator(double... binBoundaries) {
    if (binBoundaries == null || binBoundaries.length == 0) {
      throw new IllegalArgumentException("At least one histogram bin boundary is required");
    }
    for (int i = 1; i < binBoundaries.length; i++) {
      if (binBoundaries[i] <= binBoundaries[i - 1]) {
        throw new IllegalArgumentException("Histogram bin boundaries must be strictly ascending");
      }
    }
    this.binBoundaries = binBoundaries.clone();
    this.binCounts = new long[binBoundaries.length];
  }

  public static RunningStatAccumulator withFixedWidthBins(double lowerBound, double width,
                                                          int binCount) {
    if (width <= 0 || binCount <= 0) {
      throw new IllegalArgumentException("Bin width and count must be positive");
    }
    double[] boundaries = new double[binCount];
    for (int i = 0; i < binCount; i++) {
      boundaries[i] = lowerBound + i * width;
    }
    return new RunningStatAccumulator(boundaries);
  }

  public synchronized void add(double value) {
    count++;
    double delta = value - mean;
    mean += delta / count;
    sumSquaredDeviations += delta * (value - mean);
    binCounts[binIndex(value)]++;
  }

  /**
   * Folds another accumulator with identical bin boundaries into this one.
   */
  public void merge(RunningStatAccumulator other) {
    if (other == this) {
      throw new IllegalArgumentException("Cannot merge an accumulator into itself");
    }
    if (!Arrays.equals(binBoundaries, other.binBoundaries)) {
      throw new IllegalArgumentException("Cannot merge accumulators with different histogram bins");
    }
    Snapshot theirs = other.snapshot();
    synchronized (this) {
      if (theirs.count == 0) {
        return;
      }
      long total = count + theirs.count;
      double delta = theirs.mean - mean;
      mean += delta * theirs.count / total;
      sumSquaredDeviations += theirs.sumSquaredDeviations
          + delta * delta * ((double) count * theirs.count / total);
      count = total;
      for (int i = 0; i < binCounts.length; i++) {
        binCounts[i] += theirs.binCounts[i];
      }
    }
  }

  public synchronized long count() {
    return count;
  }

  public synchronized double mean() {
    return count == 0 ? 0.0 : mean;
  }

  public synchronized double variance() {
    return count == 0 ? 0.0 : sumSquaredDeviations / count;
  }

  public double stdev() {
    return Math.sqrt(variance());
  }

  public synchronized List<HistogramBin> histogram() {
    List<HistogramBin> bins = new ArrayList<>(binBoundaries.length);
    for (int i = 0; i < binBoundaries.length; i++) {
      bins.add(new HistogramBin(binBoundaries[i], binCounts[i]));
    }
    return bins;
  }

  public synchronized StatSummary summary() {
    return new StatSummary(count, mean(), stdev(), histogram());
  }

  private synchronized Snapshot snapshot() {
    return new Snapshot(count, mean, sumSquaredDeviations, binCounts.clone());
  }

  private int binIndex(double value) {
    int idx = Arrays.binarySearch(binBoundaries, value);
    if (idx >= 0) {
      return idx;
    }
    int insertionPoint = -idx - 1;
    return Math.max(0, insertionPoint - 1);
  }

  private record Snapshot(long count, double mean, double sumSquaredDeviations, long[] binCounts) {}
}
