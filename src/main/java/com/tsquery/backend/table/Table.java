package com.tsquery.backend.table;

import java.util.List;

/**
 * 不可变的列式数据表，所有行共享同一个分组键。
 * <p>
 * 约定：每一行的值个数等于列数；分组键中的列必须出现在表结构中，且在每一行上取值等于键值。
 * </p>
 */
public interface Table {

    String DEFAULT_TIME_COL_LABEL = "_time";
    String DEFAULT_VALUE_LABEL = "_value";
    String DEFAULT_START_COL_LABEL = "_start";
    String DEFAULT_STOP_COL_LABEL = "_stop";

    GroupKey key();

    List<ColumnMeta> cols();

    int numRows();

    /** 列下标，不存在返回 -1 */
    int colIndex(String label);

    Object getValue(int col, int row);

    /** 某一列的只读视图 */
    List<Object> column(int col);

    default boolean isEmpty() {
        return numRows() == 0;
    }
}
