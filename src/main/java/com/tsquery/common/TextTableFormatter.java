package com.tsquery.common;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Strings;

import com.tsquery.backend.table.ColumnMeta;
import com.tsquery.backend.table.Table;

/**
 * 将表渲染为类似 MySQL CLI 的 ASCII 表格。
 */
public final class TextTableFormatter {
    private TextTableFormatter() {}

    /**
     * 渲染一张数据表，列头形如 {@code _value(float)}。
     */
    public static String format(Table table) {
        List<String> headers = new ArrayList<>();
        for (ColumnMeta col : table.cols()) {
            headers.add(col.getLabel() + "(" + col.getType().name().toLowerCase() + ")");
        }
        List<List<String>> rows = new ArrayList<>();
        for (int r = 0; r < table.numRows(); r++) {
            List<String> row = new ArrayList<>(headers.size());
            for (int c = 0; c < table.cols().size(); c++) {
                row.add(table.cols().get(c).getType().format(table.getValue(c, r)));
            }
            rows.add(row);
        }
        return format(headers, rows);
    }

    public static String format(List<String> headers, List<List<String>> rows) {
        int columnCount = headers.size();
        int[] widths = new int[columnCount];
        for (int i = 0; i < columnCount; i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < columnCount; i++) {
                String value = Strings.nullToEmpty(row.get(i));
                if(value.length() > widths[i]) {
                    widths[i] = value.length();
                }
            }
        }
        StringBuilder sb = new StringBuilder();
        String horizontal = buildHorizontal(widths);
        sb.append(horizontal).append("\n");
        sb.append(buildRow(headers, widths)).append("\n");
        sb.append(horizontal).append("\n");
        for (List<String> row : rows) {
            sb.append(buildRow(row, widths)).append("\n");
        }
        sb.append(horizontal);
        return sb.toString();
    }

    private static String buildHorizontal(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append(Strings.repeat("-", width + 2)).append("+");
        }
        return sb.toString();
    }

    private static String buildRow(List<String> values, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < widths.length; i++) {
            sb.append(" ");
            sb.append(Strings.padEnd(Strings.nullToEmpty(values.get(i)), widths[i], ' '));
            sb.append(" |");
        }
        return sb.toString();
    }
}
