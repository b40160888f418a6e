package com.tsquery.backend.execute;

import com.tsquery.backend.table.GroupKey;
import com.tsquery.backend.table.Table;

/**
 * 由上游驱动的流式算子。
 * <p>
 * 同一个实例只能由一个线程按上游投递顺序调用，调用之间不会并发。
 * 并行只通过为不同数据分区创建独立实例实现。
 * </p>
 */
public interface Transformation {

    /** 之前输出的分组作废，丢弃其状态且不再输出 */
    void retractTable(GroupKey key) throws Exception;

    /** 同步消费一张输入表 */
    void process(Table table) throws Exception;

    void updateWatermark(long mark) throws Exception;

    void updateProcessingTime(long time) throws Exception;

    /**
     * 某个分组不会再有输入。
     *
     * @param err 非 null 表示上游失败，本次运行中止
     */
    void finish(GroupKey key, Exception err) throws Exception;

    /**
     * 整个输入流结束。
     *
     * @param err 非 null 表示上游失败，丢弃所有未完成分组
     */
    void finish(Exception err) throws Exception;
}
