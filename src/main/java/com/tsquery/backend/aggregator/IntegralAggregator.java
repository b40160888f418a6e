package com.tsquery.backend.aggregator;

import com.tsquery.backend.table.ColumnType;
import com.tsquery.common.exception.UnsortedInputException;

/**
 * 梯形法数值积分：相邻两点之间的面积为 0.5 * (v + prevValue) * dt。
 * <p>
 * 时间为 64 位有符号纳秒，dt 用 {@link Math#subtractExact} 计算，溢出直接抛出。
 * 累加和以"值 x 纳秒"为单位，{@link #value()} 时再除以配置的时间单位（纳秒数）。
 * 时间倒序的输入被拒绝（{@link UnsortedInputException}），相同时间戳允许，dt 为 0。
 * </p>
 */
public class IntegralAggregator implements Aggregator {
    private final String label;
    private final double unit;

    private boolean first = true;
    private long prevTime;
    private double prevValue;
    private double sum = 0;

    /**
     * @param label 结果列名，与被聚合的输入列同名
     * @param unitNanos 时间单位（纳秒），必须为正
     */
    public IntegralAggregator(String label, long unitNanos) {
        if(unitNanos <= 0) {
            throw new IllegalArgumentException("unit must be positive, got " + unitNanos + "ns");
        }
        this.label = label;
        this.unit = (double) unitNanos;
    }

    @Override
    public void accept(long time, double value) {
        if(first) {
            prevTime = time;
            prevValue = value;
            first = false;
            return;
        }
        long dt = Math.subtractExact(time, prevTime);
        if(dt < 0) {
            throw new UnsortedInputException(label, prevTime, time);
        }
        sum += 0.5 * (value + prevValue) * dt;
        prevTime = time;
        prevValue = value;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public ColumnType type() {
        return ColumnType.FLOAT;
    }

    @Override
    public Object value() {
        return sum / unit;
    }

    @Override
    public String toString() {
        return "IntegralAggregator{" +
                "label=" + label +
                ", sum=" + sum +
                ", unit=" + unit +
                '}';
    }
}
