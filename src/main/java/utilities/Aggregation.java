package utilities;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import rmq.RmqType;
import utilities.BenchmarkEnums.Metric;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Aggregation of benchmark samples into mean and standard deviation per
 * (metric, N, algorithm). Samples for the same N coming from several datasets are pooled.
 */
public final class Aggregation {
    private Aggregation() {}

    public static final class AggregateStats {
        private final EnumMap<Metric, TreeMap<Integer, EnumMap<RmqType, Samples>>> samples = new EnumMap<>(Metric.class);
        private final EnumMap<Metric, TreeMap<Integer, EnumMap<RmqType, Boolean>>> skipped = new EnumMap<>(Metric.class);

        public void accumulate(Metric metric, int n, RmqType type, double seconds) {
            cell(metric, n, type).values.add(seconds);
        }

        // Memory is recorded once per (N, algorithm); the last value wins.
        public void recordMemory(int n, RmqType type, double mib) {
            cell(Metric.BUILD, n, type).memoryMiB = mib;
        }

        public void markSkipped(Metric metric, int n, RmqType type) {
            skipped.computeIfAbsent(metric, ignored -> new TreeMap<>())
                    .computeIfAbsent(n, ignored -> new EnumMap<>(RmqType.class))
                    .put(type, Boolean.TRUE);
        }

        public boolean isSkipped(Metric metric, int n, RmqType type) {
            Map<Integer, EnumMap<RmqType, Boolean>> byN = skipped.get(metric);
            if (byN == null) return false;
            Map<RmqType, Boolean> byType = byN.get(n);
            return byType != null && byType.containsKey(type);
        }

        public StatsSnapshot snapshot(Metric metric, int n, RmqType type) {
            Map<Integer, EnumMap<RmqType, Samples>> byN = samples.get(metric);
            if (byN == null) return null;
            Map<RmqType, Samples> byType = byN.get(n);
            if (byType == null) return null;
            Samples s = byType.get(type);
            if (s == null || s.values.isEmpty()) return null;
            double[] data = s.values.toDoubleArray();
            // Population standard deviation, matching numpy's default.
            double mean = new Mean().evaluate(data);
            double std = new StandardDeviation(false).evaluate(data);
            return new StatsSnapshot(mean, std, s.memoryMiB, data.length);
        }

        public NavigableMap<Integer, EnumMap<RmqType, Samples>> bySize(Metric metric) {
            TreeMap<Integer, EnumMap<RmqType, Samples>> byN = samples.get(metric);
            if (byN == null) {
                return Collections.emptyNavigableMap();
            }
            return Collections.unmodifiableNavigableMap(byN);
        }

        // Every N that has samples or a skip mark for any metric.
        public NavigableSet<Integer> sizes() {
            TreeSet<Integer> all = new TreeSet<>();
            samples.values().forEach(byN -> all.addAll(byN.keySet()));
            skipped.values().forEach(byN -> all.addAll(byN.keySet()));
            return all;
        }

        public boolean hasData() {
            return samples.values().stream()
                    .flatMap(byN -> byN.values().stream())
                    .flatMap(byType -> byType.values().stream())
                    .anyMatch(s -> !s.values.isEmpty());
        }

        private Samples cell(Metric metric, int n, RmqType type) {
            return samples.computeIfAbsent(metric, ignored -> new TreeMap<>())
                    .computeIfAbsent(n, ignored -> new EnumMap<>(RmqType.class))
                    .computeIfAbsent(type, ignored -> new Samples());
        }
    }

    public static final class Samples {
        private final DoubleArrayList values = new DoubleArrayList();
        private Double memoryMiB;

        public int count() { return values.size(); }
    }

    // memoryMiB is null when not measured (and always for query/update).
    public record StatsSnapshot(double mean, double stdDev, Double memoryMiB, int count) {}
}
