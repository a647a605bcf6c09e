package ru.stepanov.convolve.image;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

import static ru.stepanov.convolve.image.PixelBuffer.ALPHA;
import static ru.stepanov.convolve.image.PixelBuffer.BLUE;
import static ru.stepanov.convolve.image.PixelBuffer.BYTES_PER_PIXEL;
import static ru.stepanov.convolve.image.PixelBuffer.GREEN;
import static ru.stepanov.convolve.image.PixelBuffer.RED;

@Slf4j
public final class ImageCodec {

    private ImageCodec() {
    }

    public static PixelBuffer decode(Path path) throws ImageCodecException {
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new ImageCodecException("Не удалось загрузить изображение: " + path, e);
        }
        if (image == null) {
            throw new ImageCodecException("Не удалось распознать формат изображения: " + path);
        }

        int width = image.getWidth();
        int height = image.getHeight();
        byte[] rgba = new byte[rgbaSize(width, height, path)];
        if (image.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_GRAY) {
            readGray(image, rgba);
        } else {
            readRgb(image, rgba);
        }

        log.info("Загружено {} ({}x{})", path, width, height);
        return PixelBuffer.wrap(height, width, rgba);
    }

    private static void readRgb(BufferedImage image, byte[] rgba) {
        int width = image.getWidth();
        int[] row = new int[width];
        for (int y = 0; y < image.getHeight(); y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int pixel = row[x];
                int offset = (y * width + x) * BYTES_PER_PIXEL;
                rgba[offset + RED] = (byte) (pixel >> 16);
                rgba[offset + GREEN] = (byte) (pixel >> 8);
                rgba[offset + BLUE] = (byte) pixel;
                rgba[offset + ALPHA] = (byte) (pixel >>> 24);
            }
        }
    }

    // getRGB переводит линейный серый в sRGB, поэтому отсчёты берутся из растра как есть
    private static void readGray(BufferedImage image, byte[] rgba) {
        ColorModel model = image.getColorModel();
        Raster gray = image.getRaster();
        Raster alpha = image.getAlphaRaster();
        int grayBits = model.getComponentSize(0);
        int alphaBits = model.hasAlpha() ? model.getComponentSize(model.getNumComponents() - 1) : 8;
        int width = image.getWidth();

        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < width; x++) {
                int value = toEightBits(gray.getSample(x, y, 0), grayBits);
                int offset = (y * width + x) * BYTES_PER_PIXEL;
                rgba[offset + RED] = (byte) value;
                rgba[offset + GREEN] = (byte) value;
                rgba[offset + BLUE] = (byte) value;
                rgba[offset + ALPHA] = (byte) (alpha == null ? 0xFF : toEightBits(alpha.getSample(x, y, 0), alphaBits));
            }
        }
    }

    static int rgbaSize(int width, int height, Path path) throws ImageCodecException {
        long size = (long) width * height * BYTES_PER_PIXEL;
        if (size > Integer.MAX_VALUE) {
            throw new ImageCodecException("Изображение слишком велико (" + width + "x" + height + "): " + path);
        }
        return (int) size;
    }

    static int toEightBits(int sample, int bits) {
        if (bits == 8) {
            return sample;
        }
        if (bits > 8) {
            return sample >>> (bits - 8);
        }
        return sample * 0xFF / ((1 << bits) - 1);
    }

    public static void encode(Path path, PixelBuffer buffer) throws ImageCodecException {
        String format = formatOf(path);
        boolean keepAlpha = !"jpg".equals(format);
        int width = buffer.getColumns();
        int height = buffer.getRows();

        byte[] rgba = buffer.toByteArray();
        int[] argb = new int[width * height];
        for (int i = 0; i < argb.length; i++) {
            int offset = i * BYTES_PER_PIXEL;
            int alpha = keepAlpha ? rgba[offset + ALPHA] & 0xFF : 0xFF;
            argb[i] = alpha << 24
                    | (rgba[offset + RED] & 0xFF) << 16
                    | (rgba[offset + GREEN] & 0xFF) << 8
                    | (rgba[offset + BLUE] & 0xFF);
        }

        BufferedImage image = new BufferedImage(width, height,
                keepAlpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, argb, 0, width);

        boolean written;
        try {
            written = ImageIO.write(image, format, path.toFile());
        } catch (IOException e) {
            throw new ImageCodecException("Не удалось сохранить изображение: " + path, e);
        }
        if (!written) {
            throw new ImageCodecException("Нет кодировщика для формата " + format + ": " + path);
        }

        log.info("Сохранено {} ({}x{})", path, width, height);
    }

    static String formatOf(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jpg") || name.endsWith(".jpeg") ? "jpg" : "png";
    }
}
