package utilities;

import org.junit.jupiter.api.Test;
import rmq.RmqType;
import utilities.BenchmarkEnums.Metric;

import static org.junit.jupiter.api.Assertions.*;

class AggregationTest {

    @Test
    void meanAndPopulationStdDev() {
        Aggregation.AggregateStats stats = new Aggregation.AggregateStats();
        assertFalse(stats.hasData());
        stats.accumulate(Metric.QUERY, 100, RmqType.NAIVE, 2.0);
        stats.accumulate(Metric.QUERY, 100, RmqType.NAIVE, 4.0);
        stats.accumulate(Metric.QUERY, 100, RmqType.NAIVE, 4.0);
        stats.accumulate(Metric.QUERY, 100, RmqType.NAIVE, 4.0);
        stats.accumulate(Metric.QUERY, 100, RmqType.NAIVE, 5.0);
        stats.accumulate(Metric.QUERY, 100, RmqType.NAIVE, 5.0);
        stats.accumulate(Metric.QUERY, 100, RmqType.NAIVE, 7.0);
        stats.accumulate(Metric.QUERY, 100, RmqType.NAIVE, 9.0);

        Aggregation.StatsSnapshot snap = stats.snapshot(Metric.QUERY, 100, RmqType.NAIVE);
        assertNotNull(snap);
        assertEquals(5.0, snap.mean(), 1e-12);
        assertEquals(2.0, snap.stdDev(), 1e-12);
        assertEquals(8, snap.count());
        assertNull(snap.memoryMiB());
        assertTrue(stats.hasData());
    }

    @Test
    void memoryAttachesToBuild() {
        Aggregation.AggregateStats stats = new Aggregation.AggregateStats();
        stats.accumulate(Metric.BUILD, 10, RmqType.SPARSE_TABLE, 0.5);
        stats.recordMemory(10, RmqType.SPARSE_TABLE, 1.25);
        assertEquals(1.25, stats.snapshot(Metric.BUILD, 10, RmqType.SPARSE_TABLE).memoryMiB());
        assertEquals(0.0, stats.snapshot(Metric.BUILD, 10, RmqType.SPARSE_TABLE).stdDev());
    }

    @Test
    void missingCellsAndSkips() {
        Aggregation.AggregateStats stats = new Aggregation.AggregateStats();
        assertNull(stats.snapshot(Metric.UPDATE, 10, RmqType.NAIVE));
        stats.markSkipped(Metric.UPDATE, 10, RmqType.SPARSE_TABLE);
        assertTrue(stats.isSkipped(Metric.UPDATE, 10, RmqType.SPARSE_TABLE));
        assertFalse(stats.isSkipped(Metric.UPDATE, 10, RmqType.NAIVE));
        assertFalse(stats.isSkipped(Metric.QUERY, 10, RmqType.SPARSE_TABLE));
        assertTrue(stats.bySize(Metric.UPDATE).isEmpty());
    }
}
