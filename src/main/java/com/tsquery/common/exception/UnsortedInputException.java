package com.tsquery.common.exception;

/**
 * 同一分组内时间戳出现倒序。
 */
public class UnsortedInputException extends RuntimeException {

    private final String column;
    private final long previousTime;
    private final long time;

    public UnsortedInputException(String column, long previousTime, long time) {
        super("输入未按时间排序: 列 " + column + " 在 " + previousTime + " 之后收到 " + time);
        this.column = column;
        this.previousTime = previousTime;
        this.time = time;
    }

    public String getColumn() {
        return column;
    }

    public long getPreviousTime() {
        return previousTime;
    }

    public long getTime() {
        return time;
    }
}
