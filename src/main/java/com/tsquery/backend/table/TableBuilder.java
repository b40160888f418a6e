package com.tsquery.backend.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;

import com.tsquery.common.exception.ShapeMismatchException;

/**
 * 可变的表构建器：先追加列和行，最后 {@link #build()} 冻结为不可变的 {@link ColumnTable}。
 * build 是单向的，之后构建器不可再使用。
 */
public class TableBuilder {
    private final GroupKey key;
    private final List<ColumnMeta> cols = new ArrayList<>();
    private final List<List<Object>> columns = new ArrayList<>();
    private int numRows = 0;
    private boolean built = false;

    public TableBuilder(GroupKey key) {
        this.key = key;
    }

    public GroupKey key() {
        return key;
    }

    /**
     * 追加一列，返回列下标。只能在追加任何行之前调用。
     */
    public int addColumn(ColumnMeta col) {
        checkState(!built, "table builder for %s already built", key);
        checkState(numRows == 0, "cannot add column %s after rows were appended", col.getLabel());
        if(colIndex(col.getLabel()) >= 0) {
            throw new IllegalArgumentException("duplicate column " + col.getLabel());
        }
        cols.add(col);
        columns.add(new ArrayList<>());
        return cols.size() - 1;
    }

    /**
     * 按键的顺序追加所有分组键列
     */
    public void addKeyColumns() {
        for (ColumnMeta col : key.cols()) {
            addColumn(col);
        }
    }

    public void appendRow(List<?> values) {
        checkState(!built, "table builder for %s already built", key);
        if(values.size() != cols.size()) {
            throw new ShapeMismatchException("row has " + values.size()
                    + " values but table " + key + " has " + cols.size() + " columns");
        }
        for (int i = 0; i < values.size(); i++) {
            Object v = values.get(i);
            ColumnMeta col = cols.get(i);
            if(v != null && !col.getType().accepts(v)) {
                throw new ShapeMismatchException("value " + v + " (" + v.getClass().getSimpleName()
                        + ") does not fit column " + col);
            }
        }
        for (int i = 0; i < values.size(); i++) {
            columns.get(i).add(values.get(i));
        }
        numRows++;
    }

    public List<ColumnMeta> cols() {
        return Collections.unmodifiableList(cols);
    }

    public int colIndex(String label) {
        for (int i = 0; i < cols.size(); i++) {
            if(cols.get(i).getLabel().equals(label)) {
                return i;
            }
        }
        return -1;
    }

    public int numRows() {
        return numRows;
    }

    public boolean isBuilt() {
        return built;
    }

    /**
     * 冻结为不可变表。校验分组键列存在、类型一致且每一行取值等于键值。
     */
    public Table build() {
        checkState(!built, "table builder for %s already built", key);
        for (int k = 0; k < key.size(); k++) {
            ColumnMeta keyCol = key.cols().get(k);
            int idx = colIndex(keyCol.getLabel());
            if(idx < 0 || cols.get(idx).getType() != keyCol.getType()) {
                throw new ShapeMismatchException("table " + key + " is missing key column " + keyCol);
            }
            Object expected = key.values().get(k);
            for (Object v : columns.get(idx)) {
                boolean same = expected == null ? v == null : expected.equals(v);
                if(!same) {
                    throw new ShapeMismatchException("key column " + keyCol.getLabel()
                            + " holds " + v + " but the group key is " + key);
                }
            }
        }
        Object[][] data = new Object[cols.size()][];
        for (int i = 0; i < cols.size(); i++) {
            data[i] = columns.get(i).toArray();
        }
        built = true;
        columns.clear();
        return new ColumnTable(key, cols, data, numRows);
    }
}
