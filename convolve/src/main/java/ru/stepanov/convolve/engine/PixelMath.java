package ru.stepanov.convolve.engine;

public final class PixelMath {

    private PixelMath() {
    }

    public static int clampToRange(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
