package com.tsquery.backend.aggregator;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import com.tsquery.backend.table.Table;
import com.tsquery.common.exception.ConfigurationException;

/**
 * 参与聚合的列，默认只聚合 {@code _value}。
 * 分组键列原样带入结果；时间列以及其它未聚合的列不出现在结果里。
 */
public final class AggregateConfig {

    public static final AggregateConfig DEFAULT = new AggregateConfig(List.of(Table.DEFAULT_VALUE_LABEL));

    private final ImmutableList<String> columns;

    public AggregateConfig(List<String> columns) {
        if(columns == null || columns.isEmpty()) {
            throw new ConfigurationException("at least one aggregate column is required");
        }
        Set<String> seen = new HashSet<>();
        for (String col : columns) {
            if(Strings.isNullOrEmpty(col) || col.trim().isEmpty()) {
                throw new ConfigurationException("aggregate column label must not be blank");
            }
            if(!seen.add(col)) {
                throw new ConfigurationException("duplicate aggregate column " + col);
            }
        }
        this.columns = ImmutableList.copyOf(columns);
    }

    public static AggregateConfig of(String... columns) {
        return new AggregateConfig(List.of(columns));
    }

    public List<String> getColumns() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(o == null || getClass() != o.getClass()) {
            return false;
        }
        return columns.equals(((AggregateConfig) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "AggregateConfig" + columns;
    }
}
