package com.tsquery.backend.execute;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Before;
import org.junit.Test;

import com.tsquery.backend.aggregator.AggregateConfig;
import com.tsquery.backend.cache.TableBuilderCache;
import com.tsquery.backend.integral.IntegralSpec;
import com.tsquery.backend.integral.IntegralTransformation;
import com.tsquery.backend.table.ColumnMeta;
import com.tsquery.backend.table.ColumnType;
import com.tsquery.backend.table.GroupKey;
import com.tsquery.backend.table.Table;
import com.tsquery.common.exception.GroupStateException;

import static com.tsquery.backend.table.Tables.col;
import static com.tsquery.backend.table.Tables.cols;
import static com.tsquery.backend.table.Tables.table;
import static com.tsquery.backend.table.Tables.window;
import static org.junit.Assert.*;

public class AggregateTransformationTest {

    private static final List<String> KEY = List.of("_start", "_stop");
    private static final List<ColumnMeta> INPUT = cols(
            col("_start", ColumnType.TIME),
            col("_stop", ColumnType.TIME),
            col("_time", ColumnType.TIME),
            col("_value", ColumnType.FLOAT));

    private CollectingDataset dataset;
    private TableBuilderCache cache;
    private IntegralTransformation tx;

    @Before
    public void setUp() {
        dataset = new CollectingDataset();
        cache = new TableBuilderCache();
        tx = new IntegralTransformation(dataset, cache,
                new IntegralSpec(Duration.ofNanos(1), "_time", AggregateConfig.DEFAULT));
    }

    private static Table points(long start, long stop, long... timeValuePairs) {
        Object[][] rows = new Object[timeValuePairs.length / 2][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new Object[]{start, stop, timeValuePairs[2 * i], (double) timeValuePairs[2 * i + 1]};
        }
        return table(KEY, INPUT, rows);
    }

    private List<GroupKey> emittedKeys() {
        return dataset.getTables().stream().map(Table::key).collect(Collectors.toList());
    }

    @Test
    public void testGroupLifecycle() throws Exception {
        GroupKey key = window(1, 3);
        assertNull(tx.state(key));

        tx.process(points(1, 3, 1, 2, 2, 1));
        assertEquals(GroupState.ACCUMULATING, tx.state(key));
        assertTrue(cache.contains(key));
        assertTrue(dataset.getTables().isEmpty());

        tx.finish(key, null);
        assertEquals(GroupState.FINALIZED, tx.state(key));
        assertFalse(cache.contains(key));
        assertEquals(1, dataset.getTables().size());

        Table out = dataset.getTables().get(0);
        assertEquals(key, out.key());
        assertEquals(1, out.numRows());
        assertEquals(1.5, (Double) out.getValue(out.colIndex("_value"), 0), 0);
        assertEquals(-1, out.colIndex("_time"));
    }

    @Test
    public void testFinishGroupTwiceFails() throws Exception {
        GroupKey key = window(1, 3);
        tx.process(points(1, 3, 1, 2));
        tx.finish(key, null);
        assertThrows(GroupStateException.class, () -> tx.finish(key, null));
        assertEquals(1, dataset.getTables().size());
    }

    @Test
    public void testProcessAfterFinalizeFails() throws Exception {
        GroupKey key = window(1, 3);
        tx.process(points(1, 3, 1, 2));
        tx.finish(key, null);
        assertThrows(GroupStateException.class, () -> tx.process(points(1, 3, 2, 1)));
    }

    @Test
    public void testFinishUnseenGroupEmitsNothing() throws Exception {
        tx.finish(window(1, 3), null);
        assertNull(tx.state(window(1, 3)));
        assertTrue(dataset.getTables().isEmpty());
    }

    @Test
    public void testEmptyTableLeavesGroupUnseen() throws Exception {
        GroupKey key = window(10, 20);
        tx.process(table(key, INPUT));
        assertNull(tx.state(key));
        assertFalse(cache.contains(key));
        tx.finish(null);
        assertTrue(dataset.getTables().isEmpty());
    }

    @Test
    public void testGroupErrorAbortsEverything() throws Exception {
        tx.process(points(1, 3, 1, 2));
        tx.process(points(3, 5, 3, 2));
        tx.finish(window(1, 3), null);

        Exception err = new RuntimeException("upstream broke");
        tx.finish(window(3, 5), err);

        assertEquals(GroupState.FINALIZED, tx.state(window(1, 3)));
        assertEquals(GroupState.ABANDONED, tx.state(window(3, 5)));
        assertEquals(0, cache.size());
        assertTrue(dataset.isFinished());
        assertSame(err, dataset.getError());
        assertEquals(List.of(window(1, 3)), emittedKeys());
        assertTrue(tx.isFinished());
    }

    @Test
    public void testStreamErrorDiscardsPartialGroups() throws Exception {
        tx.process(points(1, 3, 1, 2));
        Exception err = new IllegalStateException("source closed");
        tx.finish(err);

        assertEquals(GroupState.ABANDONED, tx.state(window(1, 3)));
        assertTrue(dataset.getTables().isEmpty());
        assertSame(err, dataset.getError());
    }

    @Test
    public void testCallsAfterFinishFail() throws Exception {
        tx.finish(null);
        assertThrows(GroupStateException.class, () -> tx.process(points(1, 3, 1, 2)));
        assertThrows(GroupStateException.class, () -> tx.finish(null));
        assertThrows(GroupStateException.class, () -> tx.updateWatermark(5));
        assertThrows(GroupStateException.class, () -> tx.retractTable(window(1, 3)));
    }

    @Test
    public void testFinishFlushesInFirstSeenOrder() throws Exception {
        tx.process(points(5, 9, 5, 1));
        tx.process(points(1, 5, 1, 1));
        tx.process(points(9, 12, 9, 1));
        tx.process(points(1, 5, 2, 1));
        tx.finish(null);

        assertEquals(List.of(window(5, 9), window(1, 5), window(9, 12)), emittedKeys());
        assertTrue(dataset.isFinished());
        assertNull(dataset.getError());
    }

    @Test
    public void testRetractDropsGroup() throws Exception {
        GroupKey key = window(1, 3);
        tx.process(points(1, 3, 1, 2));
        tx.retractTable(key);

        assertEquals(GroupState.RETRACTED, tx.state(key));
        assertFalse(cache.contains(key));
        assertEquals(List.of(key), dataset.getRetractions());
        assertThrows(GroupStateException.class, () -> tx.process(points(1, 3, 2, 1)));

        tx.finish(null);
        assertTrue(dataset.getTables().isEmpty());
    }

    @Test
    public void testWatermarkClosesFinishedWindows() throws Exception {
        tx.process(points(1, 5, 1, 2, 3, 2));
        tx.process(points(5, 10, 6, 1));
        tx.updateWatermark(5);

        assertEquals(GroupState.FINALIZED, tx.state(window(1, 5)));
        assertEquals(GroupState.ACCUMULATING, tx.state(window(5, 10)));
        assertEquals(List.of(window(1, 5)), emittedKeys());
        assertEquals(List.of(5L), dataset.getWatermarks());

        tx.finish(null);
        assertEquals(List.of(window(1, 5), window(5, 10)), emittedKeys());
    }

    @Test
    public void testWatermarkIgnoresGroupsWithoutStop() throws Exception {
        List<ColumnMeta> schema = cols(col("host", ColumnType.STRING), col("_time", ColumnType.TIME),
                col("_value", ColumnType.FLOAT));
        tx.process(table(List.of("host"), schema, new Object[]{"a", 1L, 1.0}));
        tx.updateWatermark(Long.MAX_VALUE);
        assertTrue(dataset.getTables().isEmpty());
        assertEquals(List.of(Long.MAX_VALUE), dataset.getWatermarks());
    }

    @Test
    public void testCacheCapacityLimitsOpenGroups() throws Exception {
        TableBuilderCache small = new TableBuilderCache(1);
        IntegralTransformation limited = new IntegralTransformation(new CollectingDataset(), small, new IntegralSpec());
        limited.process(points(1, 3, 1, 2));
        assertThrows(RuntimeException.class, () -> limited.process(points(3, 5, 3, 2)));
        assertNull(limited.state(window(3, 5)));
    }

    @Test
    public void testPassThrough() throws Exception {
        TransformationTestHelper.passThrough((d, c) -> new IntegralTransformation(d, c, new IntegralSpec()));
    }
}
