package ru.stepanov.convolve.benchmark;

import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

@Slf4j
public final class BenchmarkCsvWriter {
    static final String[] HEADER = {
            "kernel", "width", "height", "threads", "repeats",
            "mean_ms", "min_ms", "max_ms", "stddev_ms", "speedup", "efficiency", "matches_baseline"
    };

    private BenchmarkCsvWriter() {
    }

    public static void write(Path path, BenchmarkReport report) throws IOException {
        try (ICSVWriter writer = new CSVWriterBuilder(Files.newBufferedWriter(path, StandardCharsets.UTF_8))
                .withSeparator(ICSVWriter.DEFAULT_SEPARATOR)
                .withQuoteChar(ICSVWriter.NO_QUOTE_CHARACTER)
                .build()) {
            writer.writeNext(HEADER);
            for (BenchmarkResult result : report.getResults()) {
                writer.writeNext(new String[]{
                        report.getKernelName(),
                        String.valueOf(report.getWidth()),
                        String.valueOf(report.getHeight()),
                        String.valueOf(result.getThreads()),
                        String.valueOf(result.getRepeats()),
                        format(result.getMeanMillis()),
                        format(result.getMinMillis()),
                        format(result.getMaxMillis()),
                        format(result.getStdDevMillis()),
                        format(result.getSpeedup()),
                        format(result.getEfficiency()),
                        String.valueOf(result.isMatchesBaseline())
                });
            }
        }
        log.info("Результаты замера записаны в {}", path);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
