package com.memindex.config;

/**
 * 会话中可启用的倒排消费者种类。
 */
public enum ConsumerKind {
    /** 倒排表：文档、词频、位置、偏移 */
    FREQ_PROX,
    /** 单文档词向量 */
    TERM_VECTORS,
    /** 字段长度归一化因子 */
    NORMS
}
