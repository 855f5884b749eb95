package datagenerators;

import com.google.gson.stream.JsonWriter;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import utilities.RmqLogger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes synthetic datasets as JSON arrays to {@code <outputDir>/<distribution>_<size>.json}.
 * The generator owns its RNG, so two generators with the same seed produce the same files.
 */
public class DatasetGenerator {

    public static final List<Integer> DEFAULT_SIZES = List.of(1_000, 10_000, 100_000, 1_000_000, 10_000_000);

    private final Path outputDir;
    private final RandomGenerator rng;

    public DatasetGenerator(Path outputDir, long seed) {
        this.outputDir = outputDir;
        this.rng = new Well19937c(seed);
    }

    public List<Path> generateAll(List<Distribution> distributions, List<Integer> sizes) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>(distributions.size() * sizes.size());
        for (Distribution distribution : distributions) {
            for (int size : sizes) {
                written.add(generate(distribution, size));
            }
        }
        RmqLogger.info("Dataset generation complete, saved in " + outputDir.toAbsolutePath());
        return written;
    }

    public Path generate(Distribution distribution, int size) throws IOException {
        double[] data = distribution.sample(size, rng);
        Path file = outputDir.resolve(distribution.fileToken() + "_" + size + ".json");
        Files.createDirectories(outputDir);
        write(file, data, distribution.integral());
        RmqLogger.info("Generated " + file.getFileName());
        return file;
    }

    static void write(Path file, double[] data, boolean integral) throws IOException {
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             JsonWriter writer = new JsonWriter(bw)) {
            writer.beginArray();
            for (double v : data) {
                if (integral) {
                    writer.value((long) v);
                } else {
                    writer.value(v);
                }
            }
            writer.endArray();
        }
    }
}
