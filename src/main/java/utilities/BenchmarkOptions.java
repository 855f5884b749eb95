package utilities;

import rmq.RmqType;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

// Parsed options for the benchmark driver.
public record BenchmarkOptions(
        Path dataDir,
        Path outputCsv,
        String distribution,         // null = every dataset in dataDir
        int runs,
        int queries,
        int updates,
        long timeoutSeconds,
        long seed,
        List<RmqType> algorithms,
        boolean measureMemory,
        boolean exportCsv) {

    public static final int DEFAULT_RUNS = 5;
    public static final int DEFAULT_QUERIES = 500;
    public static final int DEFAULT_UPDATES = 500;
    public static final long DEFAULT_TIMEOUT_SECONDS = 120;
    public static final long DEFAULT_SEED = 42;

    public BenchmarkOptions {
        if (runs < 1) throw new IllegalArgumentException("--runs must be >= 1");
        if (queries < 0) throw new IllegalArgumentException("--queries must be >= 0");
        if (updates < 0) throw new IllegalArgumentException("--updates must be >= 0");
        if (timeoutSeconds <= 0) throw new IllegalArgumentException("--timeout must be positive");
        if (algorithms == null || algorithms.isEmpty()) throw new IllegalArgumentException("--algorithms must not be empty");
        algorithms = List.copyOf(algorithms);
    }

    public static BenchmarkOptions defaults() {
        return parse(new String[0]);
    }

    public static BenchmarkOptions parse(String[] args) {
        Path dataDir = Path.of("datasets");
        Path outputCsv = Path.of("results", "benchmark_results.csv");
        String distribution = null;
        int runs = DEFAULT_RUNS;
        int queries = DEFAULT_QUERIES;
        int updates = DEFAULT_UPDATES;
        long timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        long seed = DEFAULT_SEED;
        List<RmqType> algorithms = Arrays.asList(RmqType.values());
        boolean measureMemory = true;
        boolean exportCsv = true;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) continue;
            String key; String value;
            int eq = arg.indexOf('=');
            if (eq >= 0) { key = arg.substring(2, eq); value = arg.substring(eq + 1);} else {
                key = arg.substring(2);
                if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for option --" + key);
                value = args[++i];
            }

            switch (key) {
                case "data-dir", "data-root" -> dataDir = Path.of(value);
                case "out", "csv-out" -> outputCsv = Path.of(value);
                case "distribution", "dist" -> distribution = "all".equalsIgnoreCase(value) ? null : value;
                case "runs" -> runs = Integer.parseInt(value);
                case "queries" -> queries = Integer.parseInt(value);
                case "updates" -> updates = Integer.parseInt(value);
                case "timeout" -> timeoutSeconds = Long.parseLong(value);
                case "seed" -> seed = Long.parseLong(value);
                case "algorithms", "algo" -> algorithms = parseAlgorithms(value);
                case "memory" -> measureMemory = Boolean.parseBoolean(value);
                case "csv" -> exportCsv = Boolean.parseBoolean(value);
                default -> throw new IllegalArgumentException("Unknown option --" + key);
            }
        }

        return new BenchmarkOptions(dataDir, outputCsv, distribution, runs, queries, updates,
                timeoutSeconds, seed, algorithms, measureMemory, exportCsv);
    }

    private static List<RmqType> parseAlgorithms(String value) {
        if ("all".equalsIgnoreCase(value)) {
            return Arrays.asList(RmqType.values());
        }
        List<RmqType> out = new ArrayList<>();
        for (String token : value.split(",")) {
            String t = token.trim();
            if (t.isEmpty()) continue;
            RmqType type = RmqType.fromString(t);
            if (!out.contains(type)) out.add(type);
        }
        return out;
    }
}
