package utilities;

import org.junit.jupiter.api.Test;
import rmq.RmqType;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkOptionsTest {

    @Test
    void defaults() {
        BenchmarkOptions o = BenchmarkOptions.defaults();
        assertEquals(Path.of("datasets"), o.dataDir());
        assertEquals(Path.of("results", "benchmark_results.csv"), o.outputCsv());
        assertNull(o.distribution());
        assertEquals(5, o.runs());
        assertEquals(500, o.queries());
        assertEquals(500, o.updates());
        assertEquals(120, o.timeoutSeconds());
        assertEquals(42, o.seed());
        assertEquals(List.of(RmqType.values()), o.algorithms());
        assertTrue(o.measureMemory());
        assertTrue(o.exportCsv());
    }

    @Test
    void parsesBothForms() {
        BenchmarkOptions o = BenchmarkOptions.parse(new String[]{
                "--data-dir=data", "--runs", "3", "--queries=10", "--updates", "0",
                "--timeout=5", "--seed", "7", "--algorithms", "segment_tree,srd", "--memory=false",
                "--distribution", "random_int", "--out", "x.csv"});
        assertEquals(Path.of("data"), o.dataDir());
        assertEquals(3, o.runs());
        assertEquals(10, o.queries());
        assertEquals(0, o.updates());
        assertEquals(5, o.timeoutSeconds());
        assertEquals(7, o.seed());
        assertEquals(List.of(RmqType.SEGMENT_TREE, RmqType.SQRT_DECOMPOSITION), o.algorithms());
        assertFalse(o.measureMemory());
        assertEquals("random_int", o.distribution());
        assertEquals(Path.of("x.csv"), o.outputCsv());
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> BenchmarkOptions.parse(new String[]{"--bogus=1"}));
        assertThrows(IllegalArgumentException.class, () -> BenchmarkOptions.parse(new String[]{"--runs"}));
        assertThrows(IllegalArgumentException.class, () -> BenchmarkOptions.parse(new String[]{"--runs=0"}));
        assertThrows(IllegalArgumentException.class, () -> BenchmarkOptions.parse(new String[]{"--timeout=0"}));
        assertThrows(IllegalArgumentException.class, () -> BenchmarkOptions.parse(new String[]{"--algorithms=fenwick"}));
    }
}
