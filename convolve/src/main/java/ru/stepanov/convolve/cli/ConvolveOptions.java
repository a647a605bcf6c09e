package ru.stepanov.convolve.cli;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import ru.stepanov.convolve.kernel.Kernel;

import java.nio.file.Path;
import java.util.List;

@Value
@Builder
public class ConvolveOptions {
    public static final int DEFAULT_THREADS = 1;
    public static final int DEFAULT_REPEATS = 3;

    boolean help;
    Path inputPath;
    Path outputPath;
    Kernel kernel;
    @Builder.Default
    int threads = DEFAULT_THREADS;
    @Singular
    List<Integer> benchmarkThreads;
    @Builder.Default
    int repeats = DEFAULT_REPEATS;
    Path csvPath;

    public boolean isBenchmark() {
        return !benchmarkThreads.isEmpty();
    }
}
