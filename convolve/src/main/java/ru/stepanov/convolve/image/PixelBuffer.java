package ru.stepanov.convolve.image;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Arrays;

/**
 * Растр RGBA: по четыре байта на пиксель, строки подряд.
 * Смещение канала {@code b} пикселя {@code (r, c)} равно {@code columns * 4 * r + 4 * c + b}.
 */
@Getter
public class PixelBuffer {
    public static final int BYTES_PER_PIXEL = 4;
    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;
    public static final int ALPHA = 3;
    public static final int MAX_CHANNEL_VALUE = 0xFF;

    private final int rows;
    private final int columns;
    @Getter(AccessLevel.NONE)
    private byte[] pixels;

    private PixelBuffer(int rows, int columns, byte[] pixels) {
        this.rows = rows;
        this.columns = columns;
        this.pixels = pixels;
    }

    public static PixelBuffer allocate(int rows, int columns) {
        return new PixelBuffer(rows, columns, new byte[byteSize(rows, columns)]);
    }

    /**
     * Оборачивает готовый массив без копирования; массив должен иметь длину {@code rows * columns * 4}.
     */
    public static PixelBuffer wrap(int rows, int columns, byte[] rgba) {
        int expected = byteSize(rows, columns);
        if (rgba.length != expected) {
            throw new IllegalArgumentException(
                    "Ожидалось " + expected + " байт для " + columns + "x" + rows + ", получено " + rgba.length);
        }
        return new PixelBuffer(rows, columns, rgba);
    }

    private static int byteSize(int rows, int columns) {
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException("Недопустимый размер изображения: " + columns + "x" + rows);
        }
        long size = (long) rows * columns * BYTES_PER_PIXEL;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Изображение слишком велико: " + columns + "x" + rows);
        }
        return (int) size;
    }

    public int pixelCount() {
        return rows * columns;
    }

    public int totalBytes() {
        return pixelCount() * BYTES_PER_PIXEL;
    }

    public boolean hasSameDimensions(PixelBuffer other) {
        return rows == other.rows && columns == other.columns;
    }

    public int addressOf(int row, int column, int channel) {
        if (row < 0 || row >= rows || column < 0 || column >= columns
                || channel < 0 || channel >= BYTES_PER_PIXEL) {
            throw new IndexOutOfBoundsException(
                    "Пиксель (" + row + ", " + column + ", " + channel + ") вне изображения " + columns + "x" + rows);
        }
        return columns * BYTES_PER_PIXEL * row + BYTES_PER_PIXEL * column + channel;
    }

    public int get(int row, int column, int channel) {
        return storage()[addressOf(row, column, channel)] & 0xFF;
    }

    public void set(int row, int column, int channel, int value) {
        if (value < 0 || value > MAX_CHANNEL_VALUE) {
            throw new IllegalArgumentException("Значение канала вне диапазона [0, 255]: " + value);
        }
        storage()[addressOf(row, column, channel)] = (byte) value;
    }

    public PixelBuffer copy() {
        return new PixelBuffer(rows, columns, storage().clone());
    }

    public byte[] toByteArray() {
        return storage().clone();
    }

    public boolean sameContent(PixelBuffer other) {
        return hasSameDimensions(other) && Arrays.equals(storage(), other.storage());
    }

    /**
     * Выдаёт исключительный доступ на запись к пикселям {@code [startPixel, endPixel)} в порядке строк.
     */
    public OutputSlice slice(int startPixel, int endPixel) {
        if (startPixel < 0 || endPixel > pixelCount() || startPixel > endPixel) {
            throw new IndexOutOfBoundsException(
                    "Диапазон пикселей [" + startPixel + ", " + endPixel + ") вне изображения из " + pixelCount());
        }
        storage();
        return new OutputSlice(this, startPixel, endPixel);
    }

    public void release() {
        pixels = null;
    }

    public boolean isReleased() {
        return pixels == null;
    }

    private byte[] storage() {
        if (pixels == null) {
            throw new IllegalStateException("Буфер уже освобождён");
        }
        return pixels;
    }
}
