package com.tsquery.backend.execute;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tsquery.backend.aggregator.AggregateConfig;
import com.tsquery.backend.aggregator.AggregateContext;
import com.tsquery.backend.aggregator.Aggregator;
import com.tsquery.backend.cache.TableBuilderCache;
import com.tsquery.backend.table.ColumnMeta;
import com.tsquery.backend.table.ColumnType;
import com.tsquery.backend.table.GroupKey;
import com.tsquery.backend.table.Table;
import com.tsquery.backend.table.TableBuilder;
import com.tsquery.common.exception.GroupStateException;

/**
 * 分组流式聚合的通用状态机：每个分组一行输出。
 * <p>
 * 子类只需提供 {@link #createAggregator(String)}，分组状态、输出构建器缓存以及与下游的交互都在这里完成。
 * </p>
 * 分组状态：
 * <ul>
 *     <li>Unseen：状态表中没有该键（零行的表不会让分组离开 Unseen）</li>
 *     <li>ACCUMULATING：已收到数据，聚合器与输出构建器均已创建</li>
 *     <li>FINALIZED / ABANDONED / RETRACTED：终态，之后对该键的 process / finish 一律失败</li>
 * </ul>
 * 非线程安全，见 {@link Transformation}。
 */
public abstract class AggregateTransformation implements Transformation {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregateTransformation.class);

    private final Dataset dataset;
    private final TableBuilderCache cache;
    private final AggregateConfig config;
    private final String timeColumn;

    /** 分组状态表，终态条目保留下来用于快速失败 */
    private final Map<GroupKey, GroupEntry> groups = new HashMap<>();

    /** 整个输入流是否已结束（正常结束或中止） */
    private boolean finished = false;

    private static class GroupEntry {
        GroupState state;
        AggregateContext context;

        GroupEntry(GroupState state, AggregateContext context) {
            this.state = state;
            this.context = context;
        }
    }

    protected AggregateTransformation(Dataset dataset, TableBuilderCache cache,
                                      AggregateConfig config, String timeColumn) {
        this.dataset = dataset;
        this.cache = cache;
        this.config = config;
        this.timeColumn = timeColumn;
    }

    /** 为一个分组的一个聚合列创建聚合器 */
    protected abstract Aggregator createAggregator(String label);

    @Override
    public void retractTable(GroupKey key) throws Exception {
        ensureRunning();
        GroupEntry entry = groups.get(key);
        cache.discard(key);
        if(entry == null) {
            groups.put(key, new GroupEntry(GroupState.RETRACTED, null));
        } else {
            entry.state = GroupState.RETRACTED;
            entry.context = null;
        }
        LOGGER.debug("Retracted group {}", key);
        dataset.retractTable(key);
    }

    @Override
    public void process(Table table) throws Exception {
        ensureRunning();
        GroupKey key = table.key();
        GroupEntry entry = groups.get(key);
        if(entry != null && entry.state.isTerminal()) {
            throw new GroupStateException("group " + key + " is " + entry.state + ", cannot process more tables");
        }
        AggregateContext.validateSchema(table, timeColumn, config);
        if(table.isEmpty()) {
            LOGGER.debug("Skipping empty table for group {}", key);
            return;
        }
        if(entry == null) {
            AggregateContext context = AggregateContext.of(timeColumn, config, this::createAggregator);
            TableBuilderCache.BuilderResult res = cache.getOrCreateBuilder(key, () -> newBuilder(key, context));
            if(!res.created) {
                throw new GroupStateException("output builder for unseen group " + key + " already exists");
            }
            entry = new GroupEntry(GroupState.ACCUMULATING, context);
            groups.put(key, entry);
            LOGGER.debug("Started group {}", key);
        }
        entry.context.accept(table);
    }

    @Override
    public void updateWatermark(long mark) throws Exception {
        ensureRunning();
        List<GroupKey> closed = new ArrayList<>();
        cache.forEach((key, builder) -> {
            if(isAccumulating(key) && stopsAtOrBefore(key, mark)) {
                closed.add(key);
            }
        });
        for (GroupKey key : closed) {
            finalizeGroup(key, groups.get(key));
        }
        dataset.updateWatermark(mark);
    }

    @Override
    public void updateProcessingTime(long time) throws Exception {
        ensureRunning();
        dataset.updateProcessingTime(time);
    }

    @Override
    public void finish(GroupKey key, Exception err) throws Exception {
        ensureRunning();
        if(err != null) {
            abort(key, err);
            return;
        }
        GroupEntry entry = groups.get(key);
        if(entry == null) {
            LOGGER.debug("Group {} finished without any rows, nothing to emit", key);
            return;
        }
        if(entry.state.isTerminal()) {
            throw new GroupStateException("group " + key + " is already " + entry.state);
        }
        finalizeGroup(key, entry);
    }

    @Override
    public void finish(Exception err) throws Exception {
        ensureRunning();
        if(err != null) {
            abort(null, err);
            return;
        }
        // 按分组首次出现的顺序刷出剩余分组
        List<GroupKey> remaining = new ArrayList<>();
        cache.forEach((key, builder) -> {
            if(isAccumulating(key)) {
                remaining.add(key);
            }
        });
        for (GroupKey key : remaining) {
            finalizeGroup(key, groups.get(key));
        }
        finished = true;
        dataset.finish(null);
    }

    /** 分组当前状态，Unseen 返回 null */
    public GroupState state(GroupKey key) {
        GroupEntry entry = groups.get(key);
        return entry == null ? null : entry.state;
    }

    public boolean isFinished() {
        return finished;
    }

    public AggregateConfig getConfig() {
        return config;
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    private void finalizeGroup(GroupKey key, GroupEntry entry) throws Exception {
        List<Object> row = new ArrayList<>(key.values());
        row.addAll(entry.context.values());
        cache.appendRow(key, row);
        Table table = cache.finalizeTable(key);
        entry.state = GroupState.FINALIZED;
        entry.context = null;
        LOGGER.debug("Finalized group {}", key);
        dataset.process(table);
    }

    /**
     * 上游失败：丢弃所有进行中的分组与构建器，不输出任何部分结果，然后把同一个异常交给下游。
     */
    private void abort(GroupKey key, Exception err) throws Exception {
        int abandoned = 0;
        for (GroupEntry entry : groups.values()) {
            if(entry.state == GroupState.ACCUMULATING) {
                entry.state = GroupState.ABANDONED;
                entry.context = null;
                abandoned++;
            }
        }
        if(key != null && !groups.containsKey(key)) {
            groups.put(key, new GroupEntry(GroupState.ABANDONED, null));
        }
        cache.clear();
        finished = true;
        LOGGER.warn("Aborting after upstream failure ({} groups abandoned): {}", abandoned, err.getMessage());
        dataset.finish(err);
    }

    private TableBuilder newBuilder(GroupKey key, AggregateContext context) {
        TableBuilder builder = new TableBuilder(key);
        builder.addKeyColumns();
        for (ColumnMeta col : context.resultColumns()) {
            builder.addColumn(col);
        }
        return builder;
    }

    private boolean isAccumulating(GroupKey key) {
        GroupEntry entry = groups.get(key);
        return entry != null && entry.state == GroupState.ACCUMULATING;
    }

    private static boolean stopsAtOrBefore(GroupKey key, long mark) {
        int idx = key.indexOf(Table.DEFAULT_STOP_COL_LABEL);
        if(idx < 0 || key.cols().get(idx).getType() != ColumnType.TIME) {
            return false;
        }
        Object stop = key.values().get(idx);
        return stop != null && (Long) stop <= mark;
    }

    private void ensureRunning() {
        if(finished) {
            throw new GroupStateException("transformation already finished");
        }
    }
}
