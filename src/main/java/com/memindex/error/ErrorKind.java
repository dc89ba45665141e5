package com.memindex.error;

/**
 * 索引过程中可能出现的错误种类。
 *
 * 可恢复的种类在索引会话内部处理（计数、告警日志、回调），不会让整个索引操作失败；
 * 不可恢复的种类会使会话进入损坏状态，调用方必须丢弃该会话并重建。
 */
public enum ErrorKind {
    /** 分配器超出预算，触发强制刷新 */
    RESOURCE_EXHAUSTED(true),
    /** 词项超过最大长度，跳过该词项 */
    OVERSIZED_TERM(true),
    /** 空词项，属于分析链缺陷，跳过该词项 */
    EMPTY_TERM(true),
    /** 不变量被破坏，会话必须丢弃 */
    CORRUPTED_SESSION_STATE(false);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
