package ru.stepanov.convolve.benchmark;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import ru.stepanov.convolve.engine.ConvolutionEngine;
import ru.stepanov.convolve.image.PixelBuffer;
import ru.stepanov.convolve.kernel.Kernel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Повторяет проход свёртки для разного числа потоков и сравнивает результат
 * с последовательным проходом на одном потоке.
 */
@Slf4j
@RequiredArgsConstructor
public class Benchmark {
    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final Kernel kernel;
    private final int repeats;

    public BenchmarkReport run(PixelBuffer input, List<Integer> threadCounts) {
        if (repeats < 1) {
            throw new IllegalArgumentException("Количество повторов должно быть положительным: " + repeats);
        }
        if (threadCounts.isEmpty()) {
            throw new IllegalArgumentException("Не заданы количества потоков для замера");
        }

        log.info("Запущен замер ядра '{}' на изображении {}x{}, {} повтор(ов)",
                kernel.getName(), input.getColumns(), input.getRows(), repeats);

        PixelBuffer baseline = PixelBuffer.allocate(input.getRows(), input.getColumns());
        double baselineMean = measure(input, baseline, 1).getMean();
        log.info("Последовательный проход: {} миллисекунд", String.format("%.3f", baselineMean));

        int largest = threadCounts.stream().mapToInt(Integer::intValue).max().getAsInt();
        PixelBuffer largestOutput = null;
        List<BenchmarkResult> results = new ArrayList<>();

        for (int numThreads : threadCounts) {
            PixelBuffer output = PixelBuffer.allocate(input.getRows(), input.getColumns());
            DescriptiveStatistics stats = measure(input, output, numThreads);

            double speedup = baselineMean / Math.max(stats.getMean(), Double.MIN_NORMAL);
            boolean matches = output.sameContent(baseline);
            BenchmarkResult result = new BenchmarkResult(numThreads, repeats,
                    stats.getMean(), stats.getMin(), stats.getMax(), stats.getStandardDeviation(),
                    speedup, speedup / numThreads, matches);
            results.add(result);

            log.info("{} потока(ов): среднее {} мс, ускорение {}, эффективность {}",
                    numThreads, String.format("%.3f", result.getMeanMillis()),
                    String.format("%.2f", result.getSpeedup()), String.format("%.2f", result.getEfficiency()));
            if (!matches) {
                log.warn("Результат на {} потоках отличается от последовательного", numThreads);
            }

            if (numThreads == largest && largestOutput == null) {
                largestOutput = output;
            } else {
                output.release();
            }
        }
        baseline.release();

        return new BenchmarkReport(kernel.getName(), input.getColumns(), input.getRows(),
                baselineMean, List.copyOf(results), largestOutput);
    }

    private DescriptiveStatistics measure(PixelBuffer input, PixelBuffer output, int numThreads) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int i = 0; i < repeats; i++) {
            Duration duration = ConvolutionEngine.convolve(input, output, kernel, numThreads);
            stats.addValue(duration.toNanos() / NANOS_PER_MILLI);
        }
        return stats;
    }
}
