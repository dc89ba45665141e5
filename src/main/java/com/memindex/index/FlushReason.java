package com.memindex.index;

/**
 * 段刷新的触发原因。
 */
public enum FlushReason {
    /** 调用方显式请求 */
    EXPLICIT,
    /** 内存占用超过预算 */
    RAM_BUDGET,
    /** 块池剩余的块不足以容纳下一篇文档 */
    POOL_CAPACITY,
    /** 缓冲文档数达到上限 */
    DOC_COUNT,
    /** 会话关闭 */
    CLOSE
}
