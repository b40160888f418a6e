package com.tsquery.backend.aggregator;

/**
 * 为某个聚合列创建新的聚合器实例，每个分组、每列各一个。
 */
@FunctionalInterface
public interface AggregatorFactory {

    Aggregator create(String label);
}
