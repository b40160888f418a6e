package com.tsquery.backend.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * 分组键：有序的 (列, 值) 序列，标识一张表所属的逻辑序列。
 * <p>
 * 不同输入表中同一分组的键是不同的实例，因此相等性与哈希完全基于内容
 * （列名、类型、值），排序按位置逐个比较：先列名，再类型，再按类型比较值（null 最小）。
 * </p>
 */
public final class GroupKey implements Comparable<GroupKey> {

    private static final GroupKey EMPTY = new GroupKey(ImmutableList.of(), Collections.emptyList());

    private final ImmutableList<ColumnMeta> cols;
    private final List<Object> values;

    private GroupKey(ImmutableList<ColumnMeta> cols, List<Object> values) {
        this.cols = cols;
        this.values = values;
    }

    public static GroupKey empty() {
        return EMPTY;
    }

    public static GroupKey of(List<ColumnMeta> cols, List<?> values) {
        if(cols.size() != values.size()) {
            throw new IllegalArgumentException("group key has " + cols.size()
                    + " columns but " + values.size() + " values");
        }
        List<String> seen = new ArrayList<>();
        for (int i = 0; i < cols.size(); i++) {
            ColumnMeta col = cols.get(i);
            Object v = values.get(i);
            if(seen.contains(col.getLabel())) {
                throw new IllegalArgumentException("duplicate group key column " + col.getLabel());
            }
            seen.add(col.getLabel());
            if(v != null && !col.getType().accepts(v)) {
                throw new IllegalArgumentException("value " + v + " is not a valid "
                        + col.getType() + " for group key column " + col.getLabel());
            }
        }
        return new GroupKey(ImmutableList.copyOf(cols), Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public List<ColumnMeta> cols() {
        return cols;
    }

    public List<Object> values() {
        return values;
    }

    public List<String> labels() {
        List<String> labels = new ArrayList<>(cols.size());
        for (ColumnMeta col : cols) {
            labels.add(col.getLabel());
        }
        return labels;
    }

    public int size() {
        return cols.size();
    }

    public int indexOf(String label) {
        for (int i = 0; i < cols.size(); i++) {
            if(cols.get(i).getLabel().equals(label)) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasColumn(String label) {
        return indexOf(label) >= 0;
    }

    public Object value(String label) {
        int idx = indexOf(label);
        if(idx < 0) {
            throw new IllegalArgumentException("group key has no column " + label);
        }
        return values.get(idx);
    }

    @Override
    public int compareTo(GroupKey other) {
        int n = Math.min(size(), other.size());
        for (int i = 0; i < n; i++) {
            ColumnMeta l = cols.get(i);
            ColumnMeta r = other.cols.get(i);
            int c = l.getLabel().compareTo(r.getLabel());
            if(c != 0) {
                return c;
            }
            c = l.getType().compareTo(r.getType());
            if(c != 0) {
                return c;
            }
            c = compareValues(l.getType(), values.get(i), other.values.get(i));
            if(c != 0) {
                return c;
            }
        }
        return Integer.compare(size(), other.size());
    }

    private static int compareValues(ColumnType type, Object left, Object right) {
        if(left == null) {
            return right == null ? 0 : -1;
        }
        if(right == null) {
            return 1;
        }
        return type.compare(left, right);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(o == null || getClass() != o.getClass()) {
            return false;
        }
        GroupKey that = (GroupKey) o;
        return cols.equals(that.cols) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cols, values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < cols.size(); i++) {
            if(i > 0) {
                sb.append(",");
            }
            ColumnMeta col = cols.get(i);
            sb.append(col.getLabel()).append("=").append(col.getType().format(values.get(i)));
        }
        return sb.append("}").toString();
    }
}
