package utilities;

import org.openjdk.jol.info.GraphLayout;
import rmq.RangeMinimumQuery;

// JOL based memory accounting for built structures.
public final class MemUtil {

    private static final double MIB = 1024.0 * 1024.0;

    private MemUtil() {}

    // Retained size of the whole object graph reachable from the structure.
    public static long retainedBytes(RangeMinimumQuery rmq) {
        return GraphLayout.parseInstance(rmq).totalSize();
    }

    public static double retainedMiB(RangeMinimumQuery rmq) {
        return retainedBytes(rmq) / MIB;
    }
}
