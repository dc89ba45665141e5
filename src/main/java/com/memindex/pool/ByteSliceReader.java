package com.memindex.pool;

import com.memindex.error.CorruptedSessionStateException;

/**
 * 沿切片链表顺序读取一条字节流，直到写入时记录的结束地址。
 */
public final class ByteSliceReader {
    private ByteBlockPool pool;
    private byte[] buffer;
    private int bufferOffset;
    private int upto;
    private int limit;
    private int level;
    private int endIndex;

    /**
     * 定位到一条字节流。
     *
     * @param pool 字节块池
     * @param startIndex 流的第一个切片起点
     * @param endIndex 流的当前写入地址（不含）
     */
    public void init(ByteBlockPool pool, int startIndex, int endIndex) {
        if (startIndex < 0 || endIndex < startIndex) {
            throw new CorruptedSessionStateException("切片地址非法: start=" + startIndex + ", end=" + endIndex);
        }
        if (endIndex > pool.highWaterMark()) {
            throw new CorruptedSessionStateException("切片结束地址越过块池上界: end=" + endIndex
                + ", highWaterMark=" + pool.highWaterMark());
        }
        this.pool = pool;
        this.endIndex = endIndex;

        level = 0;
        int bufferUpto = startIndex >> pool.blockShift;
        bufferOffset = bufferUpto << pool.blockShift;
        buffer = pool.buffers[bufferUpto];
        upto = startIndex & pool.blockMask;

        int firstSize = ByteBlockPool.LEVEL_SIZE_ARRAY[0];
        if (startIndex + firstSize >= endIndex) {
            // 整条流都在第一个切片里
            limit = endIndex & pool.blockMask;
        } else {
            limit = upto + firstSize - 4;
        }
    }

    public boolean eof() {
        return upto + bufferOffset == endIndex;
    }

    public byte readByte() {
        if (eof()) {
            throw new CorruptedSessionStateException("切片流已读完: end=" + endIndex);
        }
        if (upto == limit) {
            nextSlice();
        }
        return buffer[upto++];
    }

    public void readBytes(byte[] target, int targetOffset, int length) {
        while (length > 0) {
            int numLeft = limit - upto;
            if (numLeft < length) {
                System.arraycopy(buffer, upto, target, targetOffset, numLeft);
                targetOffset += numLeft;
                length -= numLeft;
                nextSlice();
            } else {
                System.arraycopy(buffer, upto, target, targetOffset, length);
                upto += length;
                break;
            }
        }
    }

    private void nextSlice() {
        int nextIndex = ((buffer[limit] & 0xff) << 24) + ((buffer[1 + limit] & 0xff) << 16)
            + ((buffer[2 + limit] & 0xff) << 8) + (buffer[3 + limit] & 0xff);

        level = ByteBlockPool.NEXT_LEVEL_ARRAY[level];
        int newSize = ByteBlockPool.LEVEL_SIZE_ARRAY[level];

        int bufferUpto = nextIndex >> pool.blockShift;
        bufferOffset = bufferUpto << pool.blockShift;
        buffer = pool.buffers[bufferUpto];
        upto = nextIndex & pool.blockMask;

        if (nextIndex + newSize >= endIndex) {
            // 最后一个切片
            limit = endIndex - bufferOffset;
        } else {
            // 预留转发地址的 4 个字节
            limit = upto + newSize - 4;
        }
    }
}
