package ru.stepanov.convolve.engine;

import lombok.RequiredArgsConstructor;
import ru.stepanov.convolve.image.OutputSlice;
import ru.stepanov.convolve.image.PixelBuffer;
import ru.stepanov.convolve.kernel.Kernel;

import static ru.stepanov.convolve.engine.PixelMath.clampToRange;
import static ru.stepanov.convolve.image.PixelBuffer.ALPHA;
import static ru.stepanov.convolve.image.PixelBuffer.BYTES_PER_PIXEL;
import static ru.stepanov.convolve.image.PixelBuffer.MAX_CHANNEL_VALUE;

/**
 * Считает свёртку для пикселей своего участка. Входной буфер только читается,
 * выходной пишется только через {@link OutputSlice}.
 */
@RequiredArgsConstructor
public class ConvolutionWorker implements Runnable {
    private final PixelBuffer input;
    private final OutputSlice slice;
    private final Kernel kernel;

    @Override
    public void run() {
        if (slice.isEmpty()) {
            return;
        }

        int rows = input.getRows();
        int columns = input.getColumns();
        int rowStart = slice.startRow();
        int colStart = slice.startColumn();
        int endPixel = slice.getEndPixel();

        for (int r = rowStart; r < rows && r * columns < endPixel; r++) {
            for (int c = r == rowStart ? colStart : 0; c < columns && r * columns + c < endPixel; c++) {
                convolvePixel(r, c);
            }
        }
    }

    private void convolvePixel(int r, int c) {
        for (int b = 0; b < BYTES_PER_PIXEL; b++) {
            int value;
            if (b == ALPHA) {
                // альфа-канал не сворачивается
                value = input.get(r, c, b);
            } else {
                value = clampToRange(convolveChannel(r, c, b) / kernel.getNormalization(), 0, MAX_CHANNEL_VALUE);
            }
            slice.set(r, c, b, value);
        }
    }

    private int convolveChannel(int r, int c, int channel) {
        int lastRow = input.getRows() - 1;
        int lastColumn = input.getColumns() - 1;
        int sum = 0;

        for (int kr = 0; kr < Kernel.SIZE; kr++) {
            for (int kc = 0; kc < Kernel.SIZE; kc++) {
                int sourceRow = clampToRange(r + kr - Kernel.HALF_SIZE, 0, lastRow);
                int sourceColumn = clampToRange(c + kc - Kernel.HALF_SIZE, 0, lastColumn);
                sum += kernel.weight(kr, kc) * input.get(sourceRow, sourceColumn, channel);
            }
        }
        return sum;
    }
}
