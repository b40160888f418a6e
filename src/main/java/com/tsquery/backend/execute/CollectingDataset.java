package com.tsquery.backend.execute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.tsquery.backend.table.GroupKey;
import com.tsquery.backend.table.Table;

/**
 * 记录收到的全部输出与控制信号的下游，供批量执行器与测试使用。
 */
public class CollectingDataset implements Dataset {
    private final List<Table> tables = new ArrayList<>();
    private final List<GroupKey> retractions = new ArrayList<>();
    private final List<Long> watermarks = new ArrayList<>();
    private final List<Long> processingTimes = new ArrayList<>();
    private boolean finished = false;
    private Exception error;

    @Override
    public void process(Table table) {
        if(finished) {
            throw new IllegalStateException("dataset already finished, cannot accept table " + table.key());
        }
        tables.add(table);
    }

    @Override
    public void retractTable(GroupKey key) {
        retractions.add(key);
        tables.removeIf(t -> t.key().equals(key));
    }

    @Override
    public void updateWatermark(long mark) {
        watermarks.add(mark);
    }

    @Override
    public void updateProcessingTime(long time) {
        processingTimes.add(time);
    }

    @Override
    public void finish(Exception err) {
        if(finished) {
            throw new IllegalStateException("dataset already finished");
        }
        finished = true;
        error = err;
    }

    /** 按收到顺序 */
    public List<Table> getTables() {
        return Collections.unmodifiableList(tables);
    }

    /** 按分组键升序 */
    public List<Table> getSortedTables() {
        List<Table> sorted = new ArrayList<>(tables);
        sorted.sort(Comparator.comparing(Table::key));
        return sorted;
    }

    public List<GroupKey> getRetractions() {
        return Collections.unmodifiableList(retractions);
    }

    public List<Long> getWatermarks() {
        return Collections.unmodifiableList(watermarks);
    }

    public List<Long> getProcessingTimes() {
        return Collections.unmodifiableList(processingTimes);
    }

    public boolean isFinished() {
        return finished;
    }

    public Exception getError() {
        return error;
    }
}
