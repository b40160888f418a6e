package com.tsquery.common.exception;

/**
 * 算子配置非法：时间单位非正、聚合列为空或在输入表中不存在等。
 * 在处理任何数据之前抛出，算子实例不可继续使用。
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super("配置错误: " + message);
    }
}
