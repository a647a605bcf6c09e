package ru.stepanov.convolve.benchmark;

import lombok.Value;

@Value
public class BenchmarkResult {
    int threads;
    int repeats;
    double meanMillis;
    double minMillis;
    double maxMillis;
    double stdDevMillis;
    double speedup;
    double efficiency;
    boolean matchesBaseline;
}
