package ru.stepanov.convolve;

import lombok.extern.slf4j.Slf4j;
import ru.stepanov.convolve.benchmark.Benchmark;
import ru.stepanov.convolve.benchmark.BenchmarkCsvWriter;
import ru.stepanov.convolve.benchmark.BenchmarkReport;
import ru.stepanov.convolve.cli.CommandLineParser;
import ru.stepanov.convolve.cli.ConvolveOptions;
import ru.stepanov.convolve.cli.UsageException;
import ru.stepanov.convolve.engine.ConvolutionEngine;
import ru.stepanov.convolve.engine.ConvolutionException;
import ru.stepanov.convolve.image.ImageCodec;
import ru.stepanov.convolve.image.ImageCodecException;
import ru.stepanov.convolve.image.PixelBuffer;
import ru.stepanov.convolve.kernel.KernelCatalog;

import java.io.IOException;
import java.io.PrintStream;

@Slf4j
public class Main {
    static final String PROGRAM_NAME = "convolve";
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        KernelCatalog catalog = KernelCatalog.standard();

        ConvolveOptions options;
        try {
            options = CommandLineParser.parse(args, catalog);
        } catch (UsageException e) {
            err.println();
            err.println(e.getMessage());
            err.println();
            err.print(CommandLineParser.usage(PROGRAM_NAME, catalog));
            return EXIT_FAILURE;
        }

        if (options.isHelp()) {
            out.print(CommandLineParser.usage(PROGRAM_NAME, catalog));
            return EXIT_OK;
        }

        try {
            PixelBuffer input = ImageCodec.decode(options.getInputPath());
            PixelBuffer output = options.isBenchmark()
                    ? benchmark(input, options)
                    : convolveOnce(input, options);

            ImageCodec.encode(options.getOutputPath(), output);

            input.release();
            output.release();
            return EXIT_OK;
        } catch (ImageCodecException e) {
            log.error("Ошибка обработки изображения: {}", e.getMessage(), e.getCause());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Не удалось записать результаты замера", e);
            return EXIT_FAILURE;
        } catch (ConvolutionException e) {
            log.error("Ошибка параллельной свёртки", e);
            return EXIT_FAILURE;
        }
    }

    private static PixelBuffer convolveOnce(PixelBuffer input, ConvolveOptions options) {
        log.info("Запущена свёртка '{}' на {} потоках", options.getKernel().getName(), options.getThreads());
        PixelBuffer output = PixelBuffer.allocate(input.getRows(), input.getColumns());
        ConvolutionEngine.convolve(input, output, options.getKernel(), options.getThreads());
        return output;
    }

    private static PixelBuffer benchmark(PixelBuffer input, ConvolveOptions options) throws IOException {
        BenchmarkReport report = new Benchmark(options.getKernel(), options.getRepeats())
                .run(input, options.getBenchmarkThreads());
        if (options.getCsvPath() != null) {
            BenchmarkCsvWriter.write(options.getCsvPath(), report);
        }
        if (!report.allMatchBaseline()) {
            log.warn("Не все замеры совпали с последовательным результатом");
        }
        return report.getOutput();
    }
}
