package ru.stepanov.convolve.image;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Участок выходного буфера, принадлежащий одному потоку.
 * Запись вне {@code [startPixel, endPixel)} считается ошибкой программы.
 */
@Getter
public final class OutputSlice {
    @Getter(AccessLevel.NONE)
    private final PixelBuffer target;
    private final int startPixel;
    private final int endPixel;

    OutputSlice(PixelBuffer target, int startPixel, int endPixel) {
        this.target = target;
        this.startPixel = startPixel;
        this.endPixel = endPixel;
    }

    public int pixelCount() {
        return endPixel - startPixel;
    }

    public boolean isEmpty() {
        return startPixel == endPixel;
    }

    public int startRow() {
        return startPixel / target.getColumns();
    }

    public int startColumn() {
        return startPixel % target.getColumns();
    }

    public boolean owns(int row, int column) {
        int pixel = row * target.getColumns() + column;
        return pixel >= startPixel && pixel < endPixel;
    }

    public void set(int row, int column, int channel, int value) {
        target.addressOf(row, column, channel);
        if (!owns(row, column)) {
            throw new IllegalStateException("Пиксель (" + row + ", " + column + ") не принадлежит участку ["
                    + startPixel + ", " + endPixel + ")");
        }
        target.set(row, column, channel, value);
    }
}
