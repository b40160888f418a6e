package com.tsquery.backend.execute;

/**
 * 分组生命周期。未出现在状态表中的分组即为 Unseen。
 * 除 ACCUMULATING 外都是终态。
 */
public enum GroupState {
    ACCUMULATING,
    FINALIZED,
    ABANDONED,
    RETRACTED;

    public boolean isTerminal() {
        return this != ACCUMULATING;
    }
}
