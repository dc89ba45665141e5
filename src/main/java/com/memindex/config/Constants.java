package com.memindex.config;

/**
 * 全局常量定义
 *
 * 包含块池参数、刷新阈值、哈希表参数和输入校验上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 块池参数 ====================
    /** 字节块大小 32KB */
    public static final int DEFAULT_BYTE_BLOCK_SHIFT = 15;
    /** 整数块大小 8K 个 int */
    public static final int DEFAULT_INT_BLOCK_SHIFT = 13;
    /** 字符块大小 16K 个 char */
    public static final int DEFAULT_CHAR_BLOCK_SHIFT = 14;
    /** 每个块池的最大块数 */
    public static final int DEFAULT_MAX_SLABS_PER_POOL = 1 << 16;

    // ==================== 刷新参数 ====================
    /** 关闭某一种自动刷新条件 */
    public static final int DISABLE_AUTO_FLUSH = -1;
    /** 内存预算（16MB），超过后在文档边界强制刷新 */
    public static final long DEFAULT_RAM_BUDGET_BYTES = 16L * 1024 * 1024;
    /** 缓冲文档数上限，默认不启用 */
    public static final int DEFAULT_MAX_BUFFERED_DOCS = DISABLE_AUTO_FLUSH;

    // ==================== 词项参数 ====================
    /** 最大词项长度（UTF-16 码元数） */
    public static final int DEFAULT_MAX_TERM_LENGTH = 255;
    /** 词项长度的绝对上限，受长度字符限制 */
    public static final int MAX_TERM_LENGTH_LIMIT = Character.MAX_VALUE;

    // ==================== 哈希表参数 ====================
    /** 初始槽位数 */
    public static final int DEFAULT_HASH_INITIAL_CAPACITY = 16;
    /** 负载因子 */
    public static final float DEFAULT_HASH_LOAD_FACTOR = 0.7f;
    /** 扩容倍数 */
    public static final int DEFAULT_HASH_GROWTH_FACTOR = 2;

    // ==================== 输入校验 ====================
    /** 位置上限，位置增量左移一位后仍需落在 int 范围内 */
    public static final int MAX_POSITION = (1 << 30) - 1;
    /** 段名前缀 */
    public static final String SEGMENT_NAME_PREFIX = "_";
}
