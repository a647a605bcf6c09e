package ru.stepanov.convolve.partition;

import lombok.Value;

import static ru.stepanov.convolve.image.PixelBuffer.BYTES_PER_PIXEL;

/**
 * Полуоткрытый диапазон байтов {@code [startByte, endByte)} выходного буфера для потока {@code index}.
 * Пиксель принадлежит тому диапазону, в который попадает его первый (красный) байт.
 */
@Value
public class Partition {
    int index;
    int startByte;
    int endByte;

    public int size() {
        return endByte - startByte;
    }

    public boolean isEmpty() {
        return startPixel() == endPixel();
    }

    public int startPixel() {
        return ceilDiv(startByte, BYTES_PER_PIXEL);
    }

    public int endPixel() {
        return ceilDiv(endByte, BYTES_PER_PIXEL);
    }

    public int pixelCount() {
        return endPixel() - startPixel();
    }

    private static int ceilDiv(int value, int divisor) {
        return (value + divisor - 1) / divisor;
    }
}
