package com.tsquery.api.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;

import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import com.tsquery.backend.aggregator.AggregateConfig;
import com.tsquery.backend.integral.IntegralSpec;
import com.tsquery.backend.table.Table;

@Validated
@ConfigurationProperties(prefix = "tsquery.integral")
public class IntegralProperties {

    /**
     * 结果时间单位，如 1s、1m；不带单位的数字按纳秒解释
     */
    @DurationUnit(ChronoUnit.NANOS)
    @DurationMin(nanos = 1)
    private Duration unit = IntegralSpec.DEFAULT_UNIT;

    /**
     * 时间列名
     */
    @NotBlank(message = "timeColumn 不能为空")
    private String timeColumn = Table.DEFAULT_TIME_COL_LABEL;

    /**
     * 参与积分的列
     */
    @NotEmpty(message = "columns 至少包含一列")
    private List<String> columns = new ArrayList<>(List.of(Table.DEFAULT_VALUE_LABEL));

    /**
     * 同时进行中的分组上限，0 表示不限制
     */
    @Min(0)
    private int maxGroups = 0;

    public IntegralSpec toSpec() {
        return new IntegralSpec(unit, timeColumn, new AggregateConfig(columns));
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

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public int getMaxGroups() {
        return maxGroups;
    }

    public void setMaxGroups(int maxGroups) {
        this.maxGroups = maxGroups;
    }
}
