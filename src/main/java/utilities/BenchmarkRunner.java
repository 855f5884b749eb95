package utilities;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import rmq.RangeMinimumQuery;
import rmq.RmqException;
import rmq.RmqType;
import utilities.BenchmarkEnums.Metric;
import utilities.DatasetLoader.Dataset;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;

/**
 * Times build, query and update workloads for every selected strategy on every dataset.
 * Each run builds a fresh structure from the dataset. A metric that exceeds the timeout
 * is skipped for that strategy on all remaining (larger) datasets.
 */
public final class BenchmarkRunner {

    private static final double UPDATE_MIN = -1000.0;
    private static final double UPDATE_MAX = 1000.0;

    private final BenchmarkOptions options;
    private final TimeoutGuard guard;
    private final BiFunction<RmqType, double[], RangeMinimumQuery> factory;
    private final RandomGenerator rng;
    private final EnumMap<Metric, EnumSet<RmqType>> skip = new EnumMap<>(Metric.class);

    public BenchmarkRunner(BenchmarkOptions options) {
        this(options, TimeoutGuard.ofSeconds(options.timeoutSeconds()), RmqType::build);
    }

    // The public constructor passes the configured timeout and RmqType::build.
    BenchmarkRunner(BenchmarkOptions options, TimeoutGuard guard,
                    BiFunction<RmqType, double[], RangeMinimumQuery> factory) {
        this.options = options;
        this.guard = guard;
        this.factory = factory;
        this.rng = new Well19937c(options.seed());
        for (Metric m : Metric.values()) {
            skip.put(m, EnumSet.noneOf(RmqType.class));
        }
    }

    public Aggregation.AggregateStats run(List<Dataset> datasets) {
        Aggregation.AggregateStats stats = new Aggregation.AggregateStats();
        RmqLogger.info(String.format(Locale.ROOT,
                "Running RMQ benchmarks (%d algorithms x %d datasets x %d runs)",
                options.algorithms().size(), datasets.size(), options.runs()));

        for (Dataset dataset : datasets) {
            int n = dataset.size();
            RmqLogger.info("Dataset " + dataset.name() + " (N=" + n + ")");
            for (RmqType type : options.algorithms()) {
                runBuild(type, dataset, stats);
                runQueries(type, dataset, stats);
                runUpdates(type, dataset, stats);
            }
        }
        RmqLogger.info("All benchmarks completed");
        return stats;
    }

    private void runBuild(RmqType type, Dataset dataset, Aggregation.AggregateStats stats) {
        int n = dataset.size();
        if (skipped(Metric.BUILD, type, n, stats)) return;
        RangeMinimumQuery last = null;
        DoubleArrayList samples = new DoubleArrayList(options.runs());
        for (int run = 0; run < options.runs(); run++) {
            Optional<BuildSample> sample = measure(Metric.BUILD, type, n, () -> {
                long t0 = System.nanoTime();
                RangeMinimumQuery rmq = factory.apply(type, dataset.values());
                long elapsed = System.nanoTime() - t0;
                return new BuildSample(rmq, elapsed / 1e9);
            });
            if (sample.isEmpty()) {
                timedOut(Metric.BUILD, type, n, stats);
                return;
            }
            samples.add(sample.get().seconds());
            last = sample.get().rmq();
        }
        commit(Metric.BUILD, type, n, samples, stats);
        if (options.measureMemory() && last != null) {
            stats.recordMemory(n, type, MemUtil.retainedMiB(last));
        }
    }

    private void runQueries(RmqType type, Dataset dataset, Aggregation.AggregateStats stats) {
        int n = dataset.size();
        int count = options.queries();
        if (count == 0 || skipped(Metric.QUERY, type, n, stats)) return;
        DoubleArrayList samples = new DoubleArrayList(options.runs());
        for (int run = 0; run < options.runs(); run++) {
            int[] lefts = new int[count];
            int[] rights = new int[count];
            for (int i = 0; i < count; i++) {
                int a = rng.nextInt(n);
                int b = rng.nextInt(n);
                lefts[i] = Math.min(a, b);
                rights[i] = Math.max(a, b);
            }
            Optional<Double> perOp = measure(Metric.QUERY, type, n, () -> {
                RangeMinimumQuery rmq = factory.apply(type, dataset.values());
                double sink = 0;
                long t0 = System.nanoTime();
                for (int i = 0; i < count; i++) {
                    sink += rmq.query(lefts[i], rights[i]);
                }
                long elapsed = System.nanoTime() - t0;
                RmqLogger.trace("query checksum " + sink);
                return elapsed / 1e9 / count;
            });
            if (perOp.isEmpty()) {
                timedOut(Metric.QUERY, type, n, stats);
                return;
            }
            samples.add(perOp.get().doubleValue());
        }
        commit(Metric.QUERY, type, n, samples, stats);
    }

    private void runUpdates(RmqType type, Dataset dataset, Aggregation.AggregateStats stats) {
        int n = dataset.size();
        int count = options.updates();
        if (count == 0 || skipped(Metric.UPDATE, type, n, stats)) return;
        DoubleArrayList samples = new DoubleArrayList(options.runs());
        for (int run = 0; run < options.runs(); run++) {
            int[] indices = new int[count];
            double[] newValues = new double[count];
            for (int i = 0; i < count; i++) {
                indices[i] = rng.nextInt(n);
                newValues[i] = UPDATE_MIN + rng.nextDouble() * (UPDATE_MAX - UPDATE_MIN);
            }
            Optional<Double> perOp = measure(Metric.UPDATE, type, n, () -> {
                RangeMinimumQuery rmq = factory.apply(type, dataset.values());
                long t0 = System.nanoTime();
                for (int i = 0; i < count; i++) {
                    rmq.update(indices[i], newValues[i]);
                }
                long elapsed = System.nanoTime() - t0;
                return elapsed / 1e9 / count;
            });
            if (perOp.isEmpty()) {
                timedOut(Metric.UPDATE, type, n, stats);
                return;
            }
            samples.add(perOp.get().doubleValue());
        }
        commit(Metric.UPDATE, type, n, samples, stats);
    }

    // Samples reach the aggregate only when every run of the metric finished in time.
    private static void commit(Metric metric, RmqType type, int n, DoubleArrayList samples,
                               Aggregation.AggregateStats stats) {
        for (int i = 0; i < samples.size(); i++) {
            stats.accumulate(metric, n, type, samples.getDouble(i));
        }
    }

    // Validation errors from the core are harness errors, never skipped.
    private <T> Optional<T> measure(Metric metric, RmqType type, int n, Callable<T> task) {
        try {
            return guard.run(task);
        } catch (RmqException e) {
            IllegalStateException failure = new IllegalStateException(type.displayName() + " " + metric.csvLabel()
                    + " failed for N=" + n + ": " + e.kind() + " " + e.getMessage(), e);
            RmqLogger.error("Benchmark aborted: " + failure.getMessage(), e);
            throw failure;
        }
    }

    private boolean skipped(Metric metric, RmqType type, int n, Aggregation.AggregateStats stats) {
        if (skip.get(metric).contains(type)) {
            stats.markSkipped(metric, n, type);
            return true;
        }
        return false;
    }

    private void timedOut(Metric metric, RmqType type, int n, Aggregation.AggregateStats stats) {
        RmqLogger.warning(String.format(Locale.ROOT,
                "%s (N=%d) %s exceeded %d ms, skipping this and future %s runs",
                type.displayName(), n, metric.csvLabel(), guard.timeoutMillis(), metric.csvLabel()));
        skip.get(metric).add(type);
        stats.markSkipped(metric, n, type);
    }

    private record BuildSample(RangeMinimumQuery rmq, double seconds) {}
}
