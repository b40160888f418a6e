package com.tsquery.common;

/**
 * 预分配的通用异常，不携带上下文信息。
 * 需要携带上下文的错误见 {@link com.tsquery.common.exception} 包。
 */
public class Error {
    // cache
    public static final Exception CacheFullException = new RuntimeException("Table builder cache is full!");
    public static final Exception BuilderNotFoundException = new RuntimeException("No table builder for group key!");
}
