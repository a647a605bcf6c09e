package ru.stepanov.convolve.benchmark;

import lombok.Value;
import ru.stepanov.convolve.image.PixelBuffer;

import java.util.List;

@Value
public class BenchmarkReport {
    String kernelName;
    int width;
    int height;
    double baselineMeanMillis;
    List<BenchmarkResult> results;
    PixelBuffer output;

    public boolean allMatchBaseline() {
        return results.stream().allMatch(BenchmarkResult::isMatchesBaseline);
    }
}
