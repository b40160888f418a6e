package com.tsquery.common;

/**
 * 定义执行结果到字节输出的转换，便于不同调用方实现自定义格式。
 */
public interface ResultFormatter {

    byte[] format(ExecResult result);
}
