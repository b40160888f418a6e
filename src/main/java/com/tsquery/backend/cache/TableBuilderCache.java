package com.tsquery.backend.cache;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tsquery.backend.table.GroupKey;
import com.tsquery.backend.table.Table;
import com.tsquery.backend.table.TableBuilder;
import com.tsquery.common.Error;

/**
 * 输出表构建器缓存：分组键 -> 尚未完成的 {@link TableBuilder}。
 * <p>
 * 每个分组键在首次出现时懒加载一个构建器，分组结束时 {@link #finalizeTable} 冻结为不可变表并移出缓存。
 * LinkedHashMap 维护插入顺序，{@link #forEach} 按该顺序遍历，用于收尾时刷出剩余分组。
 * </p>
 * 非线程安全：缓存只归属于驱动它的那一个 transformation。
 */
public class TableBuilderCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableBuilderCache.class);

    /** 键按内容比较，不依赖实例引用 */
    private final Map<GroupKey, TableBuilder> cache = new LinkedHashMap<>();

    /** 最大分组数（0 表示不限制） */
    private final int capacity;

    public TableBuilderCache() {
        this(0);
    }

    public TableBuilderCache(int capacity) {
        if(capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * getOrCreateBuilder 的结果：构建器 + 是否为本次新建。
     */
    public static class BuilderResult {
        public final TableBuilder builder;
        public final boolean created;

        BuilderResult(TableBuilder builder, boolean created) {
            this.builder = builder;
            this.created = created;
        }
    }

    /**
     * 获取分组的构建器：
     * - 命中：直接返回，created = false
     * - 未命中：调用 factory 创建并登记，created = true；容量已满时抛 CacheFullException
     */
    public BuilderResult getOrCreateBuilder(GroupKey key, Supplier<TableBuilder> factory) throws Exception {
        TableBuilder hit = cache.get(key);
        if(hit != null) {
            return new BuilderResult(hit, false);
        }
        if(capacity > 0 && cache.size() >= capacity) {
            throw Error.CacheFullException;
        }
        TableBuilder builder = factory.get();
        if(!key.equals(builder.key())) {
            throw new IllegalStateException("builder factory produced a builder for " + builder.key()
                    + " while creating " + key);
        }
        cache.put(key, builder);
        LOGGER.debug("Created table builder for {} ({} in flight)", key, cache.size());
        return new BuilderResult(builder, true);
    }

    /**
     * 向分组的构建器追加一行；列数不匹配时抛 ShapeMismatchException。
     */
    public void appendRow(GroupKey key, List<?> values) throws Exception {
        TableBuilder builder = cache.get(key);
        if(builder == null) {
            throw Error.BuilderNotFoundException;
        }
        builder.appendRow(values);
    }

    /**
     * 冻结分组的构建器并移出缓存。
     */
    public Table finalizeTable(GroupKey key) throws Exception {
        TableBuilder builder = cache.get(key);
        if(builder == null) {
            throw Error.BuilderNotFoundException;
        }
        Table table = builder.build();
        cache.remove(key);
        LOGGER.debug("Finalized table builder for {} with {} rows", key, table.numRows());
        return table;
    }

    /**
     * 丢弃构建器而不生成表，返回是否存在过。
     */
    public boolean discard(GroupKey key) {
        TableBuilder removed = cache.remove(key);
        if(removed != null) {
            LOGGER.debug("Discarded table builder for {}", key);
        }
        return removed != null;
    }

    /**
     * 按插入顺序遍历当前缓存的快照，回调中允许 finalize / discard。
     */
    public void forEach(BiConsumer<GroupKey, TableBuilder> fn) {
        List<Map.Entry<GroupKey, TableBuilder>> snapshot = new ArrayList<>(cache.entrySet());
        for (Map.Entry<GroupKey, TableBuilder> en : snapshot) {
            fn.accept(en.getKey(), en.getValue());
        }
    }

    public boolean contains(GroupKey key) {
        return cache.containsKey(key);
    }

    public int size() {
        return cache.size();
    }

    public int capacity() {
        return capacity;
    }

    /** 清空所有构建器 */
    public void clear() {
        if(!cache.isEmpty()) {
            LOGGER.debug("Clearing {} table builders", cache.size());
        }
        cache.clear();
    }
}
