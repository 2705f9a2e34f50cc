package com.fleethunt.model;

public record HistogramBin(
    double lowerBound,
    long count
) {}
