package utilities;

import rmq.RmqType;
import utilities.BenchmarkEnums.Metric;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Console and CSV reporting for aggregated benchmark results.
 */
public final class BenchmarkReporter {
    private BenchmarkReporter() {}

    public static final List<String> CSV_HEADER = List.of("Metric", "N", "Algorithm", "Mean", "StdDev", "Memory_MB");
    static final String SKIPPED = "skipped";

    public static void printConsoleSummary(Aggregation.AggregateStats stats, List<RmqType> algorithms) {
        System.out.println();
        for (int n : stats.sizes()) {
            System.out.printf(Locale.ROOT, "Dataset size: %d%n", n);
            for (RmqType type : algorithms) {
                System.out.println(summaryLine(stats, n, type));
            }
        }
    }

    // A metric that timed out for this N shows "skipped"; one that never ran shows "N/A".
    static String summaryLine(Aggregation.AggregateStats stats, int n, RmqType type) {
        Aggregation.StatsSnapshot build = stats.snapshot(Metric.BUILD, n, type);
        String buildStr = cell(stats, Metric.BUILD, n, type, "%9.6f", 1.0);
        String memStr;
        if (stats.isSkipped(Metric.BUILD, n, type)) {
            memStr = SKIPPED;
        } else if (build == null || build.memoryMiB() == null) {
            memStr = "N/A";
        } else {
            memStr = String.format(Locale.ROOT, "%7.2f", build.memoryMiB());
        }
        String queryStr = cell(stats, Metric.QUERY, n, type, "%9.2f", 1e6);
        String updateStr = cell(stats, Metric.UPDATE, n, type, "%9.2f", 1e6);

        return String.format(Locale.ROOT, "  %-12s | Build: %s s | Mem: %s MB | Query: %s us | Update: %s us",
                type.displayName(), buildStr, memStr, queryStr, updateStr);
    }

    private static String cell(Aggregation.AggregateStats stats, Metric metric, int n, RmqType type,
                               String format, double scale) {
        if (stats.isSkipped(metric, n, type)) return SKIPPED;
        Aggregation.StatsSnapshot snap = stats.snapshot(metric, n, type);
        return snap == null ? "N/A" : String.format(Locale.ROOT, format, snap.mean() * scale);
    }

    // One row per (metric, N, algorithm) with data; skipped combinations are left out.
    public static List<List<Object>> toRows(Aggregation.AggregateStats stats, List<RmqType> algorithms) {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(new ArrayList<>(CSV_HEADER));
        for (Metric metric : Metric.values()) {
            for (int n : stats.bySize(metric).keySet()) {
                for (RmqType type : algorithms) {
                    Aggregation.StatsSnapshot snap = stats.snapshot(metric, n, type);
                    if (snap == null) continue;
                    List<Object> row = new ArrayList<>(6);
                    row.add(metric.csvLabel());
                    row.add(n);
                    row.add(type.displayName());
                    row.add(snap.mean());
                    row.add(snap.stdDev());
                    row.add(metric == Metric.BUILD ? snap.memoryMiB() : null);
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    public static Path writeCsv(Path csvPath, Aggregation.AggregateStats stats, List<RmqType> algorithms) throws IOException {
        CsvUtil.writeRows(csvPath, toRows(stats, algorithms));
        RmqLogger.info("Results saved to " + csvPath.toAbsolutePath());
        return csvPath;
    }
}
