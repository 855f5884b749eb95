package rmq;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

// All strategies must agree with a direct scan under interleaved updates and queries.
class CrossStrategyEquivalenceTest {

    private static double scan(double[] a, int l, int r) {
        double min = Double.POSITIVE_INFINITY;
        for (int i = l; i <= r; i++) min = Math.min(min, a[i]);
        return min;
    }

    @Test
    void randomizedAgainstDirectScan() {
        RandomGenerator rng = new Well19937c(7);
        int[] sizes = {1, 2, 3, 4, 5, 7, 8, 9, 15, 16, 17, 31, 32, 33, 100, 257};
        for (int n : sizes) {
            double[] reference = new double[n];
            for (int i = 0; i < n; i++) reference[i] = rng.nextDouble() * 2000 - 1000;

            Map<RmqType, RangeMinimumQuery> all = new EnumMap<>(RmqType.class);
            for (RmqType type : RmqType.values()) all.put(type, type.build(reference));

            for (int step = 0; step < 300; step++) {
                if (rng.nextInt(3) == 0) {
                    int idx = rng.nextInt(n);
                    double v = rng.nextDouble() * 2000 - 1000;
                    reference[idx] = v;
                    for (RangeMinimumQuery rmq : all.values()) rmq.update(idx, v);
                } else {
                    int a = rng.nextInt(n);
                    int b = rng.nextInt(n);
                    int l = Math.min(a, b);
                    int r = Math.max(a, b);
                    double expected = scan(reference, l, r);
                    for (Map.Entry<RmqType, RangeMinimumQuery> e : all.entrySet()) {
                        assertEquals(expected, e.getValue().query(l, r),
                                e.getKey() + " n=" + n + " [" + l + "," + r + "]");
                    }
                }
            }
            for (RangeMinimumQuery rmq : all.values()) {
                assertArrayEquals(reference, rmq.toArray());
            }
        }
    }

    @Test
    void everyRangeAgreesOnRepeatedValues() {
        double[] data = {3, 1, 1, 2, 5, 1, 4, 4, 2, 3, 1};
        for (RmqType type : RmqType.values()) {
            RangeMinimumQuery rmq = type.build(data);
            for (int l = 0; l < data.length; l++) {
                for (int r = l; r < data.length; r++) {
                    assertEquals(scan(data, l, r), rmq.query(l, r), type + " [" + l + "," + r + "]");
                }
            }
        }
    }

    @Test
    void increasingUpdatesOnly() {
        // Every update raises a value, which only works when block/tree minima are recomputed.
        double[] data = new double[50];
        for (int i = 0; i < data.length; i++) data[i] = i;
        Map<RmqType, RangeMinimumQuery> all = new EnumMap<>(RmqType.class);
        for (RmqType type : RmqType.values()) all.put(type, type.build(data));

        for (int i = 0; i < data.length; i++) {
            data[i] = 1000 + i;
            for (RangeMinimumQuery rmq : all.values()) rmq.update(i, 1000 + i);
            double expected = scan(data, 0, data.length - 1);
            for (Map.Entry<RmqType, RangeMinimumQuery> e : all.entrySet()) {
                assertEquals(expected, e.getValue().query(0, data.length - 1), e.getKey() + " after raising " + i);
            }
        }
    }
}
