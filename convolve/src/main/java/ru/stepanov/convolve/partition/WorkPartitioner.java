package ru.stepanov.convolve.partition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class WorkPartitioner {

    private WorkPartitioner() {
    }

    /**
     * Делит {@code [0, totalBytes)} на {@code workerCount} смежных диапазонов по {@code totalBytes / workerCount}
     * байт; остаток от деления достаётся последнему диапазону.
     */
    public static List<Partition> partition(int totalBytes, int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Количество потоков должно быть положительным: " + workerCount);
        }
        if (totalBytes < 0) {
            throw new IllegalArgumentException("Отрицательный размер буфера: " + totalBytes);
        }

        int rangeSize = totalBytes / workerCount;
        List<Partition> partitions = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            int start = i * rangeSize;
            int end = i == workerCount - 1 ? totalBytes : start + rangeSize;
            partitions.add(new Partition(i, start, end));
        }
        return Collections.unmodifiableList(partitions);
    }
}
