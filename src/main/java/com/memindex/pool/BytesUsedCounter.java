package com.memindex.pool;

/**
 * 内存占用计数器，由同一会话内的所有块池与倒排数组共享。
 *
 * 只在单个写线程内使用，因此不做同步。
 */
public final class BytesUsedCounter {
    private long bytesUsed;

    public long addAndGet(long delta) {
        bytesUsed += delta;
        return bytesUsed;
    }

    public long get() {
        return bytesUsed;
    }
}
