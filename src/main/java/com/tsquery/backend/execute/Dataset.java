package com.tsquery.backend.execute;

import com.tsquery.backend.table.GroupKey;
import com.tsquery.backend.table.Table;

/**
 * 算子的下游边界，接收已完成的表以及控制信号。
 */
public interface Dataset {

    void process(Table table) throws Exception;

    void retractTable(GroupKey key) throws Exception;

    void updateWatermark(long mark) throws Exception;

    void updateProcessingTime(long time) throws Exception;

    void finish(Exception err) throws Exception;
}
