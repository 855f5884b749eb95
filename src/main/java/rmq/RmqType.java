package rmq;

import java.util.EnumSet;
import java.util.function.Function;

// The four interchangeable strategies; the harness iterates over values().
public enum RmqType {
    NAIVE("Naive", "naive", NaiveRmq::new),
    SQRT_DECOMPOSITION("SRD", "srd", SqrtDecompositionRmq::new),
    SEGMENT_TREE("SegmentTree", "segment_tree", SegmentTreeRmq::new),
    SPARSE_TABLE("SparseTable", "sparse_table", SparseTableRmq::new);

    private final String displayName;
    private final String csvLabel;
    private final Function<double[], RangeMinimumQuery> constructor;

    RmqType(String displayName, String csvLabel, Function<double[], RangeMinimumQuery> constructor) {
        this.displayName = displayName;
        this.csvLabel = csvLabel;
        this.constructor = constructor;
    }

    public String displayName() { return displayName; }
    public String csvLabel() { return csvLabel; }

    public RangeMinimumQuery build(double[] values) {
        return constructor.apply(values);
    }

    public static RmqType fromString(String value) {
        return EnumSet.allOf(RmqType.class).stream()
                .filter(type -> type.csvLabel().equalsIgnoreCase(value)
                        || type.displayName().equalsIgnoreCase(value)
                        || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown algorithm: " + value));
    }
}
