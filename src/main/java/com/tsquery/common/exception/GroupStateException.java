package com.tsquery.common.exception;

/**
 * 违反分组状态机约定，例如对已结束的分组再次 finish。
 */
public class GroupStateException extends IllegalStateException {

    public GroupStateException(String message) {
        super(message);
    }
}
