package ru.stepanov.convolve.kernel;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Неизменяемое целочисленное ядро 3x3.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Kernel {
    public static final int SIZE = 3;
    public static final int HALF_SIZE = SIZE / 2;

    private final String name;
    @Getter(AccessLevel.NONE)
    private final int[][] weights;
    private final int normalization;

    public Kernel(String name, int[][] weights) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Имя ядра не задано");
        }
        if (weights.length != SIZE) {
            throw new IllegalArgumentException("Ядро " + name + " должно быть размером 3x3");
        }
        this.weights = new int[SIZE][];
        for (int r = 0; r < SIZE; r++) {
            if (weights[r].length != SIZE) {
                throw new IllegalArgumentException("Ядро " + name + " должно быть размером 3x3");
            }
            this.weights[r] = weights[r].clone();
        }
        this.name = name;
        this.normalization = normalize(this.weights);
    }

    public int weight(int row, int column) {
        return weights[row][column];
    }

    public int[][] getWeights() {
        int[][] copy = new int[SIZE][];
        for (int r = 0; r < SIZE; r++) {
            copy[r] = weights[r].clone();
        }
        return copy;
    }

    /**
     * Сумма весов ядра; нулевая сумма заменяется единицей.
     */
    public static int normalize(int[][] weights) {
        int norm = 0;
        for (int[] row : weights) {
            for (int weight : row) {
                norm += weight;
            }
        }
        return norm == 0 ? 1 : norm;
    }
}
