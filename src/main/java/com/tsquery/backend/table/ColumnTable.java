package com.tsquery.backend.table;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import com.tsquery.common.TextTableFormatter;

/**
 * {@link Table} 的列式实现，每一列一个数组。只能由 {@link TableBuilder#build()} 创建。
 */
public final class ColumnTable implements Table {
    private final GroupKey key;
    private final ImmutableList<ColumnMeta> cols;
    private final Object[][] columns;
    private final int numRows;

    ColumnTable(GroupKey key, List<ColumnMeta> cols, Object[][] columns, int numRows) {
        this.key = key;
        this.cols = ImmutableList.copyOf(cols);
        this.columns = columns;
        this.numRows = numRows;
    }

    @Override
    public GroupKey key() {
        return key;
    }

    @Override
    public List<ColumnMeta> cols() {
        return cols;
    }

    @Override
    public int numRows() {
        return numRows;
    }

    @Override
    public int colIndex(String label) {
        for (int i = 0; i < cols.size(); i++) {
            if(cols.get(i).getLabel().equals(label)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public Object getValue(int col, int row) {
        if(row < 0 || row >= numRows) {
            throw new IndexOutOfBoundsException("row " + row + " out of range [0, " + numRows + ")");
        }
        return columns[col][row];
    }

    @Override
    public List<Object> column(int col) {
        return Collections.unmodifiableList(Arrays.asList(columns[col]));
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnTable that = (ColumnTable) o;
        return numRows == that.numRows
                && key.equals(that.key)
                && cols.equals(that.cols)
                && Arrays.deepEquals(columns, that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, cols, numRows, Arrays.deepHashCode(columns));
    }

    @Override
    public String toString() {
        return "Table" + key + "\n" + TextTableFormatter.format(this);
    }
}
