package com.tsquery.common;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.tsquery.backend.table.ColumnType;
import com.tsquery.backend.table.Table;

import static com.tsquery.backend.table.Tables.col;
import static com.tsquery.backend.table.Tables.cols;
import static com.tsquery.backend.table.Tables.table;
import static org.junit.Assert.*;

public class TextTableFormatterTest {

    @Test
    public void testGrid() {
        String text = TextTableFormatter.format(List.of("id", "name"),
                List.of(List.of("1", "alice"), Arrays.asList("22", null)));
        String expected = String.join("\n",
                "+----+-------+",
                "| id | name  |",
                "+----+-------+",
                "| 1  | alice |",
                "| 22 |       |",
                "+----+-------+");
        assertEquals(expected, text);
    }

    @Test
    public void testTableHeadersCarryTypes() {
        Table t = table(List.of("host"), cols(col("host", ColumnType.STRING), col("n", ColumnType.UINT)),
                new Object[]{"a", -1L});
        String text = TextTableFormatter.format(t);
        assertTrue(text.contains("| host(string) | n(uint)              |"));
        assertTrue(text.contains("| a            | 18446744073709551615 |"));
    }

    @Test
    public void testEmptyResultSummary() {
        String text = new String(new ConsoleResultFormatter().format(ExecResult.from(null, 0)));
        assertEquals("0 rows in set (0.00 sec)", text);
    }
}
