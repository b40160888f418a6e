package com.tsquery.common;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import com.tsquery.backend.table.Table;

/**
 * 控制台结果格式化器
 */
public class ConsoleResultFormatter implements ResultFormatter {

    @Override
    public byte[] format(ExecResult result) {
        StringBuilder sb = new StringBuilder();
        for (Table table : result.getTables()) {
            sb.append("Table: ").append(table.key()).append("\n");
            sb.append(TextTableFormatter.format(table)).append("\n");
        }
        int rows = Math.max(result.getResultRows(), 0);
        String summary = rows + (rows == 1 ? " row" : " rows") +
                " in set (" + formatSeconds(result.getElapsedNanos()) + " sec)";
        sb.append(summary);
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String formatSeconds(long nanos) {
        double seconds = nanos / 1_000_000_000d;
        return String.format(Locale.ROOT, "%.2f", seconds);
    }
}
