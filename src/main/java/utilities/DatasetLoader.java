package utilities;

import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.MalformedJsonException;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads datasets stored as JSON arrays of numbers ({@code <distribution>_<size>.json}).
 */
public final class DatasetLoader {
    private DatasetLoader() {}

    public record Dataset(String name, String distribution, double[] values) {
        public int size() { return values.length; }
    }

    public static List<Dataset> loadAll(Path dir) throws IOException {
        return loadAll(dir, null);
    }

    // Datasets ordered by size, then by name. distribution == null keeps every file.
    public static List<Dataset> loadAll(Path dir, String distribution) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("Dataset directory not found: " + dir.toAbsolutePath());
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".json"))
                    .filter(path -> distribution == null
                            || distribution.equals(distributionOf(path.getFileName().toString())))
                    .collect(Collectors.toList());
        }
        List<Dataset> out = new ArrayList<>(files.size());
        for (Path file : files) {
            out.add(load(file));
            RmqLogger.debug("Loaded " + file.getFileName() + " (" + out.get(out.size() - 1).size() + " values)");
        }
        out.sort(Comparator.comparingInt(Dataset::size).thenComparing(Dataset::name));
        return out;
    }

    public static Dataset load(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        String name = fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
        double[] values = readArray(file);
        if (values.length == 0) {
            throw new IllegalArgumentException("Dataset " + fileName + " is empty");
        }
        int declared = declaredSize(name);
        if (declared >= 0 && declared != values.length) {
            RmqLogger.warning("Dataset " + fileName + " declares " + declared + " values but holds " + values.length);
        }
        return new Dataset(name, distributionOf(fileName), values);
    }

    // Streams the array so that 10^7 element files do not need a DOM.
    static double[] readArray(Path file) throws IOException {
        DoubleArrayList values = new DoubleArrayList();
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             JsonReader reader = new JsonReader(br)) {
            if (reader.peek() != JsonToken.BEGIN_ARRAY) {
                throw new IllegalArgumentException("Dataset " + file.getFileName() + " is not a JSON array");
            }
            reader.beginArray();
            while (reader.hasNext()) {
                if (reader.peek() != JsonToken.NUMBER) {
                    throw new IllegalArgumentException("Dataset " + file.getFileName()
                            + " has a non-numeric element at index " + values.size());
                }
                values.add(reader.nextDouble());
            }
            reader.endArray();
        } catch (IllegalStateException | JsonParseException | MalformedJsonException e) {
            throw new IllegalArgumentException("Malformed dataset " + file.getFileName(), e);
        }
        return values.toDoubleArray();
    }

    // "random_uniform_1000.json" -> "random_uniform"
    static String distributionOf(String fileName) {
        String base = fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
        int us = base.lastIndexOf('_');
        if (us < 0) return base;
        String tail = base.substring(us + 1);
        return tail.chars().allMatch(Character::isDigit) && !tail.isEmpty() ? base.substring(0, us) : base;
    }

    // Trailing "_<digits>" of the name, or -1 when there is none.
    static int declaredSize(String name) {
        int us = name.lastIndexOf('_');
        String tail = name.substring(us + 1);
        if (tail.isEmpty() || !tail.chars().allMatch(Character::isDigit)) return -1;
        try {
            return Integer.parseInt(tail);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}
