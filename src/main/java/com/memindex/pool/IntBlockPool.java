package com.memindex.pool;

import java.util.Arrays;

/**
 * 整数块池，存放每个词项的定长整数记录（各字节流的当前写入地址）。
 */
public final class IntBlockPool extends BlockPool {

    int[][] buffers = new int[10][];

    public IntBlockPool(int blockShift, int maxBlocks, BytesUsedCounter bytesUsed) {
        super(blockShift, Integer.BYTES, maxBlocks, bytesUsed);
    }

    public int get(int address) {
        return buffers[address >> blockShift][address & blockMask];
    }

    public void set(int address, int value) {
        buffers[address >> blockShift][address & blockMask] = value;
    }

    @Override
    protected void installBlock(int index) {
        if (index == buffers.length) {
            buffers = Arrays.copyOf(buffers, oversize(index + 1));
        }
        buffers[index] = new int[blockSize];
    }

    @Override
    protected void zeroFill(int index, int length) {
        Arrays.fill(buffers[index], 0, length, 0);
    }

    @Override
    protected void releaseBlocks(int from, int to) {
        Arrays.fill(buffers, from, to, null);
    }
}
