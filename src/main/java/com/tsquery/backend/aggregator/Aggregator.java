package com.tsquery.backend.aggregator;

import com.tsquery.backend.table.ColumnType;

/**
 * 聚合器接口，封装单个分组、单个聚合列上的累加状态与运算。
 */
public interface Aggregator {
    /** 每个数据点调用一次，时间为纳秒，值已拓宽为 double */
    void accept(long time, double value);

    /** 结果列名 */
    String label();

    /** 结果列类型 */
    ColumnType type();

    /** 最终聚合值，分组结束时读取一次 */
    Object value();
}
