package com.tsquery.backend.table;

import java.util.Objects;

/**
 * 列元信息：列名 + 语义类型。
 */
public final class ColumnMeta {
    private final String label;
    private final ColumnType type;

    public ColumnMeta(String label, ColumnType type) {
        this.label = Objects.requireNonNull(label, "label");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static ColumnMeta of(String label, ColumnType type) {
        return new ColumnMeta(label, type);
    }

    public String getLabel() {
        return label;
    }

    public ColumnType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnMeta that = (ColumnMeta) o;
        return label.equals(that.label) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, type);
    }

    @Override
    public String toString() {
        return new StringBuilder("(")
                .append(label)
                .append(", ")
                .append(type.name().toLowerCase())
                .append(")")
                .toString();
    }
}
