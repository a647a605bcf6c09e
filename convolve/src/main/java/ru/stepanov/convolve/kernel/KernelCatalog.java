package ru.stepanov.convolve.kernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class KernelCatalog {
    public static final String DEFAULT_KERNEL_NAME = "identity";

    private static final KernelCatalog STANDARD = new KernelCatalog(List.of(
            new Kernel(DEFAULT_KERNEL_NAME, new int[][]{
                    {0, 0, 0},
                    {0, 1, 0},
                    {0, 0, 0}
            }),
            new Kernel("edge-detect", new int[][]{
                    {-1, -1, -1},
                    {-1,  8, -1},
                    {-1, -1, -1}
            }),
            new Kernel("sharpen", new int[][]{
                    { 0, -1,  0},
                    {-1,  5, -1},
                    { 0, -1,  0}
            }),
            new Kernel("emboss", new int[][]{
                    {-2, -1,  0},
                    {-1,  1,  1},
                    { 0, -2,  2}
            }),
            new Kernel("gaussian-blur", new int[][]{
                    {1, 2, 1},
                    {2, 4, 2},
                    {1, 2, 1}
            })
    ));

    private final Map<String, Kernel> kernels;

    private KernelCatalog(List<Kernel> entries) {
        Map<String, Kernel> byName = new LinkedHashMap<>();
        for (Kernel kernel : entries) {
            if (byName.put(kernel.getName(), kernel) != null) {
                throw new IllegalArgumentException("Ядро " + kernel.getName() + " уже зарегистрировано");
            }
        }
        this.kernels = Collections.unmodifiableMap(byName);
    }

    public static KernelCatalog standard() {
        return STANDARD;
    }

    public Optional<Kernel> lookup(String name) {
        return Optional.ofNullable(kernels.get(name));
    }

    public Kernel defaultKernel() {
        return kernels.get(DEFAULT_KERNEL_NAME);
    }

    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(kernels.keySet()));
    }

    public List<Kernel> kernels() {
        return List.copyOf(kernels.values());
    }
}
