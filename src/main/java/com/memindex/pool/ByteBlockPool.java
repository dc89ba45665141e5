package com.memindex.pool;

import java.util.Arrays;

/**
 * 字节块池，承载每个词项的追加式字节流。
 *
 * 字节流以切片链表的形式存放：每个切片末尾写入一个非零的级别标记，写到标记处时分配下一级
 * 更大的切片，并在旧切片最后 4 个字节写入新切片的绝对地址。因此块必须在复用前清零。
 */
public final class ByteBlockPool extends BlockPool {

    /** 每一级切片的下一级 */
    static final int[] NEXT_LEVEL_ARRAY = {1, 2, 3, 4, 5, 6, 7, 8, 9, 9};

    /** 每一级切片的大小，第一级 5 字节，最大 200 字节 */
    static final int[] LEVEL_SIZE_ARRAY = {5, 14, 20, 30, 40, 40, 80, 80, 120, 200};

    public static final int FIRST_LEVEL_SIZE = LEVEL_SIZE_ARRAY[0];

    public static final int MAX_LEVEL_SIZE = LEVEL_SIZE_ARRAY[LEVEL_SIZE_ARRAY.length - 1];

    byte[][] buffers = new byte[10][];
    byte[] buffer;

    public ByteBlockPool(int blockShift, int maxBlocks, BytesUsedCounter bytesUsed) {
        super(blockShift, Byte.BYTES, maxBlocks, bytesUsed);
        if (blockSize < MAX_LEVEL_SIZE) {
            throw new IllegalArgumentException("字节块大小 " + blockSize + " 小于最大切片 " + MAX_LEVEL_SIZE);
        }
    }

    /**
     * 分配一个新切片，并在末尾写入第一级标记。
     *
     * @param size 切片大小
     * @return 切片起始绝对地址
     */
    public int newSlice(int size) {
        int start = allocate(size);
        buffer[(start & blockMask) + size - 1] = 16;
        return start;
    }

    /**
     * 连续分配 count 个第一级切片，第 i 条流从 {@code 返回值 + i * FIRST_LEVEL_SIZE} 开始。
     *
     * @param count 流的条数
     * @return 第一个切片的起始绝对地址
     */
    public int newSlices(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("切片流条数必须为正数: " + count);
        }
        int start = allocate(count * FIRST_LEVEL_SIZE);
        int pos = start & blockMask;
        for (int stream = 1; stream <= count; stream++) {
            buffer[pos + stream * FIRST_LEVEL_SIZE - 1] = 16;
        }
        return start;
    }

    /**
     * 写到切片末尾标记时分配下一级切片，并把标记前 3 个字节搬到新切片开头。
     *
     * @param slice 当前切片所在块
     * @param sliceUpto 末尾标记在块内的位置
     * @return 新切片中可写位置（头块内偏移）
     */
    int allocSlice(byte[] slice, int sliceUpto) {
        int level = slice[sliceUpto] & 15;
        int newLevel = NEXT_LEVEL_ARRAY[level];
        int newSize = LEVEL_SIZE_ARRAY[newLevel];

        if (upto > blockSize - newSize) {
            nextBuffer();
        }

        int newUpto = upto;
        int address = newUpto + offset;
        upto += newSize;

        buffer[newUpto] = slice[sliceUpto - 3];
        buffer[newUpto + 1] = slice[sliceUpto - 2];
        buffer[newUpto + 2] = slice[sliceUpto - 1];

        // 旧切片最后 4 个字节改写为转发地址
        slice[sliceUpto - 3] = (byte) (address >>> 24);
        slice[sliceUpto - 2] = (byte) (address >>> 16);
        slice[sliceUpto - 1] = (byte) (address >>> 8);
        slice[sliceUpto] = (byte) address;

        buffer[upto - 1] = (byte) (16 | newLevel);

        return newUpto + 3;
    }

    /**
     * 向切片流写入一个字节。
     *
     * @param address 当前写入地址
     * @param value 字节值
     * @return 写入后的下一个地址
     */
    public int writeByte(int address, byte value) {
        byte[] block = buffers[address >> blockShift];
        int pos = address & blockMask;
        if (block[pos] != 0) {
            pos = allocSlice(block, pos);
            block = buffer;
            address = pos + offset;
        }
        block[pos] = value;
        return address + 1;
    }

    /**
     * 从指定绝对偏移读取字节，允许跨块。
     */
    public void readBytes(int address, byte[] target, int targetOffset, int length) {
        int bytesLeft = length;
        int bufferIndex = address >> blockShift;
        int pos = address & blockMask;
        while (bytesLeft > 0) {
            byte[] block = buffers[bufferIndex++];
            int chunk = Math.min(bytesLeft, blockSize - pos);
            System.arraycopy(block, pos, target, targetOffset, chunk);
            targetOffset += chunk;
            bytesLeft -= chunk;
            pos = 0;
        }
    }

    /**
     * 读取单个字节。
     */
    public byte readByte(int address) {
        return buffers[address >> blockShift][address & blockMask];
    }

    @Override
    protected void installBlock(int index) {
        if (index == buffers.length) {
            buffers = Arrays.copyOf(buffers, oversize(index + 1));
        }
        buffer = buffers[index] = new byte[blockSize];
    }

    @Override
    protected void selectHead(int index) {
        buffer = index < 0 ? null : buffers[index];
    }

    @Override
    protected void zeroFill(int index, int length) {
        Arrays.fill(buffers[index], 0, length, (byte) 0);
    }

    @Override
    protected void releaseBlocks(int from, int to) {
        Arrays.fill(buffers, from, to, null);
    }
}
