package utilities;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

// Minimal RFC 4180 style writer used for the benchmark export.
public final class CsvUtil {
    private CsvUtil() {}

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final String LINE_SEPARATOR = "\n";

    // Write multiple rows (list of lists) to a file, creating parent directories.
    public static void writeRows(Path file, List<? extends List<?>> rows) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeRows(bw, rows);
        }
    }

    // Write multiple rows to an existing Writer (caller closes).
    public static void writeRows(Writer writer, List<? extends List<?>> rows) throws IOException {
        Objects.requireNonNull(writer, "writer");
        Objects.requireNonNull(rows, "rows");
        for (List<?> row : rows) {
            writer.write(toCsvLine(row));
            writer.write(LINE_SEPARATOR);
        }
        writer.flush();
    }

    public static String toCsvLine(List<?> row) {
        Objects.requireNonNull(row, "row");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.size(); i++) {
            if (i > 0) sb.append(DELIMITER);
            sb.append(quoteIfNeeded(stringify(row.get(i))));
        }
        return sb.toString();
    }

    // null becomes an empty field.
    private static String stringify(Object value) {
        if (value == null) return "";
        return String.valueOf(value);
    }

    private static String quoteIfNeeded(String field) {
        boolean containsDelimiter = field.indexOf(DELIMITER) >= 0;
        boolean containsQuote = field.indexOf(QUOTE) >= 0;
        boolean containsNewline = field.indexOf('\n') >= 0 || field.indexOf('\r') >= 0;

        if (containsDelimiter || containsQuote || containsNewline) {
            String doubled = field.replace(String.valueOf(QUOTE), String.valueOf(QUOTE) + QUOTE);
            return QUOTE + doubled + QUOTE;
        }
        return field;
    }
}
