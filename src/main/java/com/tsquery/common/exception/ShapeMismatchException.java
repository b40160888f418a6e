package com.tsquery.common.exception;

/**
 * 追加到输出表的行与表结构不一致（列数或值类型不匹配）。
 * 属于列跟踪逻辑的缺陷，不是数据问题，不做重试。
 */
public class ShapeMismatchException extends RuntimeException {

    public ShapeMismatchException(String message) {
        super("表结构不匹配: " + message);
    }
}
