package com.memindex.index;

/**
 * 索引会话状态。
 *
 * 正常流转为 IDLE -> ACCUMULATING -> FLUSHING -> IDLE；CORRUPTED 与 CLOSED 为终态。
 */
public enum SessionState {
    /** 没有缓冲的文档 */
    IDLE,
    /** 正在累积文档 */
    ACCUMULATING,
    /** 正在把缓冲的文档写成段 */
    FLUSHING,
    /** 不变量被破坏，会话必须丢弃 */
    CORRUPTED,
    /** 已关闭 */
    CLOSED
}
