package com.fleethunt.model;

import java.util.List;

public record StatSummary(
    long num,
    double mean,
    double stdev,
    List<HistogramBin> histogram
) {}
