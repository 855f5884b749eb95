import datagenerators.DatasetGenerator;
import datagenerators.Distribution;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

// Generate synthetic datasets under <out>/<distribution>_<size>.json.
public class GenerateDatasets {

    public static void main(String[] args) throws IOException {
        System.out.println("Generating datasets...");

        Path out = Path.of("datasets");
        long seed = 42;
        List<Integer> sizes = DatasetGenerator.DEFAULT_SIZES;
        List<Distribution> distributions = Arrays.asList(Distribution.values());

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
                case "out" -> out = Path.of(value);
                case "seed" -> seed = Long.parseLong(value);
                case "sizes" -> {
                    sizes = new ArrayList<>();
                    for (String s : value.split(",")) sizes.add(Integer.parseInt(s.trim()));
                }
                case "distributions" -> {
                    distributions = new ArrayList<>();
                    for (String s : value.split(",")) distributions.add(Distribution.fromString(s.trim()));
                }
                default -> throw new IllegalArgumentException("Unknown option --" + key);
            }
        }

        List<Path> written = new DatasetGenerator(out, seed).generateAll(distributions, sizes);
        System.out.println("Done, wrote " + written.size() + " file(s) to " + out.toAbsolutePath());
    }
}
