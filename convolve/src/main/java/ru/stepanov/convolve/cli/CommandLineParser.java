package ru.stepanov.convolve.cli;

import ru.stepanov.convolve.kernel.Kernel;
import ru.stepanov.convolve.kernel.KernelCatalog;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Разбор флагов в стиле getopt: {@code -i in.png}, {@code -iin.png}.
 */
public final class CommandLineParser {
    private static final String FLAGS_WITH_VALUE = "ikonbrc";

    private CommandLineParser() {
    }

    public static ConvolveOptions parse(String[] args, KernelCatalog catalog) throws UsageException {
        ConvolveOptions.ConvolveOptionsBuilder options = ConvolveOptions.builder()
                .kernel(catalog.defaultKernel());
        Path input = null;
        Path output = null;
        Set<Character> given = new HashSet<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.length() < 2 || arg.charAt(0) != '-') {
                throw new UsageException("Неожиданный аргумент '" + arg + "'");
            }

            char flag = arg.charAt(1);
            if (flag == 'h') {
                return options.help(true).build();
            }
            if (FLAGS_WITH_VALUE.indexOf(flag) < 0) {
                throw new UsageException("Неизвестный флаг '" + arg + "'");
            }

            String value;
            if (arg.length() > 2) {
                value = arg.substring(2);
            } else if (i + 1 < args.length) {
                value = args[++i];
            } else {
                throw new UsageException("Флаг -" + flag + " требует значение");
            }

            given.add(flag);
            switch (flag) {
                case 'i' -> input = Path.of(value);
                case 'o' -> output = Path.of(value);
                case 'k' -> options.kernel(lookupKernel(catalog, value));
                case 'n' -> options.threads(parsePositive(value, "Количество потоков"));
                case 'r' -> options.repeats(parsePositive(value, "Количество повторов"));
                case 'c' -> options.csvPath(Path.of(value));
                case 'b' -> {
                    for (String count : value.split(",")) {
                        options.benchmarkThread(parsePositive(count.trim(), "Количество потоков в замере"));
                    }
                }
                default -> throw new UsageException("Неизвестный флаг '" + arg + "'");
            }
        }

        if (input == null) {
            throw new UsageException("Не указан входной файл");
        }
        if (output == null) {
            throw new UsageException("Не указан выходной файл");
        }
        if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
            throw new UsageException("Входной и выходной файлы не могут совпадать");
        }
        if (given.contains('b') && given.contains('n')) {
            throw new UsageException("Флаги -n и -b несовместимы: в замере потоки задаются списком -b");
        }
        if (!given.contains('b') && (given.contains('c') || given.contains('r'))) {
            throw new UsageException("Флаги -c и -r применимы только вместе с -b");
        }

        return options.inputPath(input).outputPath(output).build();
    }

    public static String usage(String programName, KernelCatalog catalog) {
        StringBuilder usage = new StringBuilder()
                .append("usage: ").append(programName).append(" [flags]\n")
                .append("  -h                print help\n")
                .append("  -i <input file>   set input file\n")
                .append("  -o <output file>  set output file\n")
                .append("  -n <threads>      number of threads to use (default ")
                .append(ConvolveOptions.DEFAULT_THREADS).append(")\n")
                .append("  -b <t1,t2,...>    benchmark the given thread counts (instead of -n)\n")
                .append("  -r <repeats>      passes per benchmarked thread count, with -b (default ")
                .append(ConvolveOptions.DEFAULT_REPEATS).append(")\n")
                .append("  -c <csv file>     write benchmark results as CSV, with -b\n")
                .append("  -k <kernel>       kernel from:\n");
        for (String name : catalog.names()) {
            usage.append("       ").append(name);
            if (name.equals(KernelCatalog.DEFAULT_KERNEL_NAME)) {
                usage.append(" (default)");
            }
            usage.append('\n');
        }
        return usage.toString();
    }

    private static Kernel lookupKernel(KernelCatalog catalog, String name) throws UsageException {
        return catalog.lookup(name)
                .orElseThrow(() -> new UsageException("Нет ядра с именем '" + name + "'"));
    }

    private static int parsePositive(String value, String what) throws UsageException {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(what + " должно быть целым числом: '" + value + "'");
        }
        if (parsed < 1) {
            throw new UsageException(what + " должно быть положительным: " + parsed);
        }
        return parsed;
    }
}
