import utilities.Aggregation;
import utilities.BenchmarkOptions;
import utilities.BenchmarkReporter;
import utilities.BenchmarkRunner;
import utilities.DatasetLoader;
import utilities.RmqLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Benchmark driver: loads the JSON datasets, times build / query / update for every
 * selected RMQ strategy and exports the aggregated results as CSV.
 * <p>
 * Example: {@code --data-dir datasets --runs 5 --queries 500 --updates 500 --timeout 120}
 */
public final class Main {

    public static void main(String[] args) throws IOException {
        BenchmarkOptions options = BenchmarkOptions.parse(args);

        System.out.printf(Locale.ROOT,
                "Data dir: %s%nRuns: %d  Queries: %d  Updates: %d  Timeout: %ds  Seed: %d%n",
                options.dataDir(), options.runs(), options.queries(), options.updates(),
                options.timeoutSeconds(), options.seed());

        List<DatasetLoader.Dataset> datasets = DatasetLoader.loadAll(options.dataDir(), options.distribution());
        if (datasets.isEmpty()) {
            RmqLogger.warning("No datasets found under " + options.dataDir().toAbsolutePath());
            return;
        }

        Aggregation.AggregateStats stats = new BenchmarkRunner(options).run(datasets);
        BenchmarkReporter.printConsoleSummary(stats, options.algorithms());

        if (options.exportCsv() && stats.hasData()) {
            Path csv = BenchmarkReporter.writeCsv(options.outputCsv(), stats, options.algorithms());
            System.out.println("Results saved to " + csv);
        }
    }
}
