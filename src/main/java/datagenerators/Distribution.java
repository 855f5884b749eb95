package datagenerators;

import org.apache.commons.math3.distribution.UniformIntegerDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.EnumSet;

// Value distributions for synthetic RMQ datasets.
public enum Distribution {
    RANDOM_UNIFORM("random_uniform", false),
    RANDOM_INT("random_int", true),
    SORTED_ASCENDING("sorted_ascending", false),
    SORTED_DESCENDING("sorted_descending", false),
    REPEATED_VALUES("repeated_values", false);

    static final double LOW = -1000.0;
    static final double HIGH = 1000.0;
    private static final double[] REPEATED = {1.0, 2.0, 3.0, 4.0, 5.0};

    private final String fileToken;
    private final boolean integral;

    Distribution(String fileToken, boolean integral) {
        this.fileToken = fileToken;
        this.integral = integral;
    }

    public String fileToken() { return fileToken; }

    // Integral datasets are written without a fractional part.
    public boolean integral() { return integral; }

    public double[] sample(int n, RandomGenerator rng) {
        if (n <= 0) throw new IllegalArgumentException("n must be positive");
        double[] out = new double[n];
        switch (this) {
            case RANDOM_UNIFORM -> {
                UniformRealDistribution dist = new UniformRealDistribution(rng, LOW, HIGH);
                for (int i = 0; i < n; i++) out[i] = dist.sample();
            }
            case RANDOM_INT -> {
                // [-1000, 1000)
                UniformIntegerDistribution dist = new UniformIntegerDistribution(rng, (int) LOW, (int) HIGH - 1);
                for (int i = 0; i < n; i++) out[i] = dist.sample();
            }
            case SORTED_ASCENDING -> linspace(out, LOW, HIGH);
            case SORTED_DESCENDING -> linspace(out, HIGH, LOW);
            case REPEATED_VALUES -> {
                for (int i = 0; i < n; i++) out[i] = REPEATED[rng.nextInt(REPEATED.length)];
            }
        }
        return out;
    }

    // Evenly spaced, both endpoints included; a single element takes the start value.
    private static void linspace(double[] out, double start, double end) {
        int n = out.length;
        if (n == 1) {
            out[0] = start;
            return;
        }
        double step = (end - start) / (n - 1);
        for (int i = 0; i < n; i++) out[i] = start + i * step;
        out[n - 1] = end;
    }

    public static Distribution fromString(String value) {
        return EnumSet.allOf(Distribution.class).stream()
                .filter(d -> d.fileToken.equalsIgnoreCase(value) || d.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown distribution: " + value));
    }
}
