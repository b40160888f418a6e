package com.tsquery.backend.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import static com.tsquery.backend.table.Tables.col;
import static com.tsquery.backend.table.Tables.cols;
import static com.tsquery.backend.table.Tables.window;
import static org.junit.Assert.*;

public class GroupKeyTest {

    @Test
    public void testEqualByContent() {
        GroupKey a = window(1L, 3L);
        GroupKey b = window(1L, 3L);
        assertNotSame(a, b);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        Map<GroupKey, String> map = new HashMap<>();
        map.put(a, "first");
        assertEquals("first", map.get(b));
        assertNotEquals(a, window(1L, 4L));
    }

    @Test
    public void testTypeIsPartOfIdentity() {
        GroupKey time = GroupKey.of(cols(col("k", ColumnType.TIME)), List.of(5L));
        GroupKey integer = GroupKey.of(cols(col("k", ColumnType.INT)), List.of(5L));
        assertNotEquals(time, integer);
        assertNotEquals(0, time.compareTo(integer));
    }

    @Test
    public void testOrdering() {
        List<GroupKey> keys = new ArrayList<>();
        keys.add(window(2L, 3L));
        keys.add(window(1L, 5L));
        keys.add(window(1L, 3L));
        keys.add(GroupKey.empty());
        keys.sort(null);
        assertEquals(GroupKey.empty(), keys.get(0));
        assertEquals(window(1L, 3L), keys.get(1));
        assertEquals(window(1L, 5L), keys.get(2));
        assertEquals(window(2L, 3L), keys.get(3));
    }

    @Test
    public void testLabelComparedBeforeValue() {
        GroupKey a = GroupKey.of(cols(col("a", ColumnType.INT)), List.of(100L));
        GroupKey b = GroupKey.of(cols(col("b", ColumnType.INT)), List.of(1L));
        assertTrue(a.compareTo(b) < 0);
        assertTrue(b.compareTo(a) > 0);
    }

    @Test
    public void testNullSortsFirst() {
        GroupKey withNull = GroupKey.of(cols(col("host", ColumnType.STRING)), Arrays.asList((Object) null));
        GroupKey withValue = GroupKey.of(cols(col("host", ColumnType.STRING)), List.of("a"));
        assertTrue(withNull.compareTo(withValue) < 0);
        assertEquals("{host=}", withNull.toString());
    }

    @Test
    public void testUnsignedOrdering() {
        // -1 作为无符号数是最大值
        GroupKey max = GroupKey.of(cols(col("u", ColumnType.UINT)), List.of(-1L));
        GroupKey one = GroupKey.of(cols(col("u", ColumnType.UINT)), List.of(1L));
        assertTrue(one.compareTo(max) < 0);
        assertEquals("{u=18446744073709551615}", max.toString());
    }

    @Test
    public void testAccessors() {
        GroupKey key = window(1L, 3L);
        assertEquals(List.of("_start", "_stop"), key.labels());
        assertEquals(2, key.size());
        assertEquals(1, key.indexOf("_stop"));
        assertEquals(-1, key.indexOf("_time"));
        assertTrue(key.hasColumn("_start"));
        assertEquals(3L, key.value("_stop"));
        assertEquals("{_start=1,_stop=3}", key.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsWrongValueType() {
        GroupKey.of(cols(col("k", ColumnType.TIME)), List.of(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsArityMismatch() {
        GroupKey.of(cols(col("a", ColumnType.INT), col("b", ColumnType.INT)), List.of(1L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsDuplicateLabels() {
        GroupKey.of(cols(col("a", ColumnType.INT), col("a", ColumnType.INT)), List.of(1L, 2L));
    }
}
