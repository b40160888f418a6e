package com.tsquery.backend.integral;

import com.tsquery.backend.aggregator.Aggregator;
import com.tsquery.backend.aggregator.IntegralAggregator;
import com.tsquery.backend.cache.TableBuilderCache;
import com.tsquery.backend.execute.AggregateTransformation;
import com.tsquery.backend.execute.Dataset;

/**
 * 对每个分组、每个聚合列做梯形积分，结果除以配置的时间单位。
 * 配置在构造时校验，非法时抛 ConfigurationException。
 */
public class IntegralTransformation extends AggregateTransformation {
    private final IntegralSpec spec;
    private final long unitNanos;

    public IntegralTransformation(Dataset dataset, TableBuilderCache cache, IntegralSpec spec) {
        super(dataset, cache, validated(spec).getAggregateConfig(), spec.getTimeColumn());
        this.spec = spec;
        this.unitNanos = spec.unitNanos();
    }

    private static IntegralSpec validated(IntegralSpec spec) {
        spec.validate();
        return spec;
    }

    @Override
    protected Aggregator createAggregator(String label) {
        return new IntegralAggregator(label, unitNanos);
    }

    public IntegralSpec getSpec() {
        return spec;
    }
}
