package com.memindex.hash;

import com.memindex.pool.ByteBlockPool;

/**
 * 一个词项在三个块池中的定位句柄。
 *
 * @param textStart 词项文本在字符池中的起点
 * @param intStart 词项整数记录在整数池中的起点
 * @param byteStart 词项第一条字节流在字节池中的起点
 */
public record PostingHandle(int textStart, int intStart, int byteStart) {

    public PostingHandle {
        if (textStart < 0 || intStart < 0 || byteStart < 0) {
            throw new IllegalArgumentException("句柄偏移不能为负数: text=" + textStart
                + ", int=" + intStart + ", byte=" + byteStart);
        }
    }

    /**
     * 第 stream 条字节流的起点。
     */
    public int streamStart(int stream) {
        return byteStart + stream * ByteBlockPool.FIRST_LEVEL_SIZE;
    }
}
