package ru.stepanov.convolve.engine;

import lombok.extern.slf4j.Slf4j;
import ru.stepanov.convolve.image.PixelBuffer;
import ru.stepanov.convolve.kernel.Kernel;
import ru.stepanov.convolve.partition.Partition;
import ru.stepanov.convolve.partition.WorkPartitioner;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
public final class ConvolutionEngine {

    private ConvolutionEngine() {
    }

    /**
     * Сворачивает {@code input} ядром {@code kernel} в {@code output}, используя ровно {@code numThreads} потоков,
     * каждый со своим непересекающимся участком выходного буфера. Возвращает время прохода.
     *
     * @throws ConvolutionException если поток не удалось запустить или он завершился с ошибкой
     */
    public static Duration convolve(PixelBuffer input, PixelBuffer output, Kernel kernel, int numThreads) {
        if (numThreads < 1) {
            throw new IllegalArgumentException("Количество потоков должно быть положительным: " + numThreads);
        }
        if (input == output) {
            throw new IllegalArgumentException("Входной и выходной буферы должны различаться");
        }
        if (!input.hasSameDimensions(output)) {
            throw new IllegalArgumentException("Размеры буферов не совпадают: "
                    + input.getColumns() + "x" + input.getRows() + " и "
                    + output.getColumns() + "x" + output.getRows());
        }

        List<Partition> partitions = WorkPartitioner.partition(input.totalBytes(), numThreads);
        Instant beginning = Instant.now();

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (Partition partition : partitions) {
                log.debug("Поток {}: байты [{}, {}), пиксели [{}, {})", partition.getIndex(),
                        partition.getStartByte(), partition.getEndByte(),
                        partition.startPixel(), partition.endPixel());
                ConvolutionWorker worker = new ConvolutionWorker(input,
                        output.slice(partition.startPixel(), partition.endPixel()), kernel);
                futures.add(executor.submit(worker));
            }

            for (Future<?> future : futures) {
                future.get();
            }
        } catch (RejectedExecutionException e) {
            throw new ConvolutionException("Не удалось запустить поток свёртки", e);
        } catch (ExecutionException e) {
            throw new ConvolutionException("Поток свёртки завершился с ошибкой", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConvolutionException("Ожидание потоков свёртки прервано", e);
        } finally {
            executor.shutdownNow();
        }

        Duration duration = Duration.between(beginning, Instant.now());
        log.info("{} потока(ов) завершили свёртку '{}' за {} миллисекунд.",
                numThreads, kernel.getName(), duration.toMillis());
        return duration;
    }
}
