package com.tsquery.backend.query;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tsquery.backend.cache.TableBuilderCache;
import com.tsquery.backend.execute.CollectingDataset;
import com.tsquery.backend.integral.IntegralSpec;
import com.tsquery.backend.integral.IntegralTransformation;
import com.tsquery.backend.table.Table;
import com.tsquery.common.ExecResult;

/**
 * Executor 负责把一批已排好序的输入表交给一个新的 integral 算子，
 * 收集每个分组的输出并返回结构化的 {@link ExecResult}。
 * <p>
 * 特点：
 * <ul>
 *     <li>每次 execute 都创建独立的算子、构建器缓存和下游，调用之间不共享状态</li>
 *     <li>执行中任何异常都会先通知算子中止（丢弃未完成分组），再抛给调用方</li>
 * </ul>
 */
public class Executor {

    private static final Logger LOGGER = LoggerFactory.getLogger(Executor.class);

    private final IntegralSpec spec;
    /** 构建器缓存容量，0 表示不限制 */
    private final int maxGroups;

    public Executor(IntegralSpec spec) {
        this(spec, 0);
    }

    public Executor(IntegralSpec spec, int maxGroups) {
        spec.validate();
        this.spec = spec;
        this.maxGroups = maxGroups;
    }

    /**
     * 执行一次积分查询。
     *
     * @param input 输入表，同一分组内按时间升序
     * @return 按分组键排序的输出
     * @throws Exception 配置、数据或结构错误
     */
    public ExecResult execute(List<Table> input) throws Exception {
        LOGGER.info("Execute integral over {} tables: {}", input.size(), spec);
        long start = System.nanoTime();

        CollectingDataset dataset = new CollectingDataset();
        IntegralTransformation transformation =
                new IntegralTransformation(dataset, new TableBuilderCache(maxGroups), spec);
        try {
            for (Table table : input) {
                transformation.process(table);
            }
            transformation.finish(null);
        } catch (Exception e) {
            LOGGER.error("Integral execution failed: {}", e.getMessage());
            if(!transformation.isFinished()) {
                transformation.finish(e);
            }
            throw e;
        }

        List<Table> output = dataset.getSortedTables();
        long elapsed = System.nanoTime() - start;
        LOGGER.info("Integral produced {} tables in {} ms", output.size(), elapsed / 1_000_000);
        return ExecResult.from(output, elapsed);
    }

    public IntegralSpec getSpec() {
        return spec;
    }

    public int getMaxGroups() {
        return maxGroups;
    }
}
