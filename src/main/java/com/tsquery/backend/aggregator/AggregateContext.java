package com.tsquery.backend.aggregator;

import java.util.ArrayList;
import java.util.List;

import com.tsquery.backend.table.ColumnMeta;
import com.tsquery.backend.table.ColumnType;
import com.tsquery.backend.table.Table;
import com.tsquery.common.exception.ConfigurationException;

/**
 * 单个分组的聚合器列表，与聚合列一一对应。
 * <p>
 * 各列的聚合器相互独立，只共享分组键和输出行。
 * </p>
 */
public class AggregateContext {
    private final String timeColumn;
    private final AggregateConfig config;
    private final List<Aggregator> aggregators;

    public AggregateContext(String timeColumn, AggregateConfig config, List<Aggregator> aggregators) {
        if(aggregators.size() != config.getColumns().size()) {
            throw new IllegalArgumentException("expected " + config.getColumns().size()
                    + " aggregators, got " + aggregators.size());
        }
        this.timeColumn = timeColumn;
        this.config = config;
        this.aggregators = aggregators;
    }

    public static AggregateContext of(String timeColumn, AggregateConfig config, AggregatorFactory factory) {
        List<Aggregator> list = new ArrayList<>();
        // 每个聚合列各自一个聚合器
        for (String col : config.getColumns()) {
            list.add(factory.create(col));
        }
        return new AggregateContext(timeColumn, config, list);
    }

    /**
     * 按行顺序把一张表的数据喂给各聚合器。
     * 时间为 null 的行整行跳过；值为 null 只跳过该列。
     */
    public void accept(Table table) {
        int timeIdx = timeIndex(table, timeColumn);
        int[] valueIdx = valueIndexes(table, config);
        for (int row = 0; row < table.numRows(); row++) {
            Object t = table.getValue(timeIdx, row);
            if(t == null) {
                continue;
            }
            long time = (Long) t;
            for (int i = 0; i < aggregators.size(); i++) {
                Object v = table.getValue(valueIdx[i], row);
                if(v == null) {
                    continue;
                }
                ColumnType type = table.cols().get(valueIdx[i]).getType();
                aggregators.get(i).accept(time, type.toDouble(v));
            }
        }
    }

    public List<String> labels() {
        List<String> labels = new ArrayList<>();
        for (Aggregator agg : aggregators) {
            labels.add(agg.label());
        }
        return labels;
    }

    /** 结果列定义，顺序与聚合列一致 */
    public List<ColumnMeta> resultColumns() {
        List<ColumnMeta> cols = new ArrayList<>();
        for (Aggregator agg : aggregators) {
            cols.add(new ColumnMeta(agg.label(), agg.type()));
        }
        return cols;
    }

    public List<Object> values() {
        List<Object> values = new ArrayList<>();
        for (Aggregator agg : aggregators) {
            values.add(agg.value());
        }
        return values;
    }

    /**
     * 校验输入表结构：时间列存在且为 TIME，聚合列存在、为数值类型且不是分组键列。
     */
    public static void validateSchema(Table table, String timeColumn, AggregateConfig config) {
        timeIndex(table, timeColumn);
        valueIndexes(table, config);
    }

    private static int timeIndex(Table table, String timeColumn) {
        int idx = table.colIndex(timeColumn);
        if(idx < 0) {
            throw new ConfigurationException("time column \"" + timeColumn + "\" not found in table " + table.key());
        }
        ColumnType type = table.cols().get(idx).getType();
        if(type != ColumnType.TIME) {
            throw new ConfigurationException("time column \"" + timeColumn + "\" has type " + type + ", expected TIME");
        }
        return idx;
    }

    private static int[] valueIndexes(Table table, AggregateConfig config) {
        List<String> columns = config.getColumns();
        int[] idx = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            String label = columns.get(i);
            int j = table.colIndex(label);
            if(j < 0) {
                throw new ConfigurationException("aggregate column \"" + label + "\" not found in table " + table.key());
            }
            ColumnType type = table.cols().get(j).getType();
            if(!type.isNumeric()) {
                throw new ConfigurationException("aggregate column \"" + label + "\" has non-numeric type " + type);
            }
            if(table.key().hasColumn(label)) {
                throw new ConfigurationException("aggregate column \"" + label + "\" is part of the group key");
            }
            idx[i] = j;
        }
        return idx;
    }
}
