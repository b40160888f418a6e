package com.tsquery.backend.integral;

import java.time.Duration;
import java.util.Objects;

import com.google.common.base.Strings;

import com.tsquery.backend.aggregator.AggregateConfig;
import com.tsquery.backend.table.Table;
import com.tsquery.common.exception.ConfigurationException;

/**
 * integral 算子的配置（已解码的结构，序列化不在本模块）。
 * <ul>
 *     <li>unit：结果的时间单位，默认 1ns，即不缩放</li>
 *     <li>timeColumn：时间列，默认 {@code _time}</li>
 *     <li>aggregateConfig：被积分的列，默认 {@code _value}</li>
 * </ul>
 */
public class IntegralSpec {

    public static final Duration DEFAULT_UNIT = Duration.ofNanos(1);

    private Duration unit = DEFAULT_UNIT;
    private String timeColumn = Table.DEFAULT_TIME_COL_LABEL;
    private AggregateConfig aggregateConfig = AggregateConfig.DEFAULT;

    public IntegralSpec() {}

    public IntegralSpec(Duration unit, String timeColumn, AggregateConfig aggregateConfig) {
        this.unit = unit;
        this.timeColumn = timeColumn;
        this.aggregateConfig = aggregateConfig;
    }

    /**
     * 校验配置：unit 为正，时间列非空且不在聚合列中。
     */
    public void validate() {
        if(unit == null || unit.isZero() || unit.isNegative()) {
            throw new ConfigurationException("unit must be a positive duration, got " + unit);
        }
        try {
            unit.toNanos();
        } catch (ArithmeticException e) {
            throw new ConfigurationException("unit " + unit + " does not fit in 64-bit nanoseconds");
        }
        if(Strings.isNullOrEmpty(timeColumn) || timeColumn.trim().isEmpty()) {
            throw new ConfigurationException("time column label must not be blank");
        }
        if(aggregateConfig == null) {
            throw new ConfigurationException("aggregate config is required");
        }
        if(aggregateConfig.getColumns().contains(timeColumn)) {
            throw new ConfigurationException("time column \"" + timeColumn + "\" cannot be aggregated");
        }
    }

    public long unitNanos() {
        return unit.toNanos();
    }

    public Duration getUnit() {
        return unit;
    }

    public void setUnit(Duration unit) {
        this.unit = unit;
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    public void setTimeColumn(String timeColumn) {
        this.timeColumn = timeColumn;
    }

    public AggregateConfig getAggregateConfig() {
        return aggregateConfig;
    }

    public void setAggregateConfig(AggregateConfig aggregateConfig) {
        this.aggregateConfig = aggregateConfig;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(o == null || getClass() != o.getClass()) {
            return false;
        }
        IntegralSpec that = (IntegralSpec) o;
        return Objects.equals(unit, that.unit)
                && Objects.equals(timeColumn, that.timeColumn)
                && Objects.equals(aggregateConfig, that.aggregateConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, timeColumn, aggregateConfig);
    }

    @Override
    public String toString() {
        return "IntegralSpec{" +
                "unit=" + unit +
                ", timeColumn=" + timeColumn +
                ", columns=" + (aggregateConfig == null ? null : aggregateConfig.getColumns()) +
                '}';
    }
}
