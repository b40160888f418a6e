package com.tsquery.common;

import java.util.Collections;
import java.util.List;

import com.tsquery.backend.table.Table;

/**
 * 一次查询执行后的结构化结果：每个分组一张输出表。
 * 供不同的输出层自定义格式化逻辑
 */
public class ExecResult {

    private final List<Table> tables;
    private final long elapsedNanos;

    private ExecResult(List<Table> tables, long elapsedNanos) {
        this.tables = tables;
        this.elapsedNanos = elapsedNanos;
    }

    public static ExecResult from(List<Table> tables, long elapsedNanos) {
        List<Table> effective = tables == null ? Collections.emptyList() : List.copyOf(tables);
        return new ExecResult(effective, elapsedNanos);
    }

    public List<Table> getTables() {
        return tables;
    }

    /** 所有输出表的总行数 */
    public int getResultRows() {
        int rows = 0;
        for (Table t : tables) {
            rows += t.numRows();
        }
        return rows;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }
}
