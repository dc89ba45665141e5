package com.memindex.pool;

import com.memindex.error.CorruptedSessionStateException;
import com.memindex.error.ResourceExhaustedException;

/**
 * 定长块池的公共簿记逻辑，三种类型化块池（byte/int/char）共享同一套游标与地址规则。
 *
 * 地址是绝对偏移：{@code 块序号 << blockShift | 块内偏移}。块一旦分配就不会被移动，
 * 因此发出的地址在 {@link #reset()} 之前始终有效。单个逻辑值不会跨块存放。
 */
public abstract class BlockPool {
    protected final int blockShift;
    protected final int blockSize;
    protected final int blockMask;

    private final int unitBytes;
    private final int maxBlocks;
    private final BytesUsedCounter bytesUsed;

    /** 当前头块序号，-1 表示尚未分配任何块 */
    protected int bufferUpto = -1;
    /** 头块内的下一个空闲位置 */
    protected int upto;
    /** 头块起始处的绝对偏移 */
    protected int offset;

    protected BlockPool(int blockShift, int unitBytes, int maxBlocks, BytesUsedCounter bytesUsed) {
        if (blockShift < 1 || blockShift > 30) {
            throw new IllegalArgumentException("blockShift 必须在 [1, 30] 之间: " + blockShift);
        }
        if (maxBlocks <= 0) {
            throw new IllegalArgumentException("maxBlocks 必须为正数: " + maxBlocks);
        }
        if (bytesUsed == null) {
            throw new IllegalArgumentException("bytesUsed 计数器不能为空");
        }
        this.blockShift = blockShift;
        this.blockSize = 1 << blockShift;
        this.blockMask = blockSize - 1;
        this.unitBytes = unitBytes;
        // 所有地址必须落在 int 的非负区间内
        this.maxBlocks = Math.min(maxBlocks, 1 << (31 - blockShift));
        this.bytesUsed = bytesUsed;
        this.upto = blockSize;
        this.offset = -blockSize;
    }

    /**
     * 在池中预留 size 个连续单元并返回起始绝对偏移。
     * 头块剩余空间不足时启用新块，已分配的数据不会被移动。
     *
     * @param size 单元数，必须在 [1, blockSize] 之间
     * @return 起始绝对偏移
     */
    public final int allocate(int size) {
        if (size <= 0 || size > blockSize) {
            throw new IllegalArgumentException("分配大小必须在 [1, " + blockSize + "] 之间: " + size);
        }
        if (upto > blockSize - size) {
            nextBuffer();
        }
        int start = upto;
        upto += size;
        return start + offset;
    }

    /**
     * 启用下一个块作为头块。
     *
     * @throws ResourceExhaustedException 块数达到上限时抛出
     */
    public final void nextBuffer() {
        int next = bufferUpto + 1;
        if (next >= maxBlocks) {
            throw new ResourceExhaustedException(
                getClass().getSimpleName() + " 块数达到上限 " + maxBlocks + "，无法继续分配", bytesUsed.get());
        }
        installBlock(next);
        bufferUpto = next;
        upto = 0;
        offset += blockSize;
        bytesUsed.addAndGet((long) blockSize * unitBytes);
    }

    /**
     * 重置到初始状态并复用第一个块。
     */
    public final void reset() {
        reset(true);
    }

    /**
     * 重置到大小为 0 的状态。除复用的第一个块外，其余块全部释放并从计数器中扣除。
     *
     * @param reuseFirst 是否保留并清零第一个块
     */
    public final void reset(boolean reuseFirst) {
        if (bufferUpto == -1) {
            return;
        }
        int firstReleased = reuseFirst ? 1 : 0;
        if (reuseFirst) {
            int usedInFirst = bufferUpto == 0 ? upto : blockSize;
            zeroFill(0, usedInFirst);
        }
        if (bufferUpto >= firstReleased) {
            releaseBlocks(firstReleased, bufferUpto + 1);
            bytesUsed.addAndGet(-(long) (bufferUpto + 1 - firstReleased) * blockSize * unitBytes);
        }
        if (reuseFirst) {
            bufferUpto = 0;
            upto = 0;
            offset = 0;
            selectHead(0);
        } else {
            bufferUpto = -1;
            upto = blockSize;
            offset = -blockSize;
            selectHead(-1);
        }
    }

    /**
     * 已发出地址的上界（不含）。
     */
    public final int highWaterMark() {
        return bufferUpto == -1 ? 0 : offset + upto;
    }

    /**
     * 校验地址仍指向本池已分配的区域。
     *
     * @throws CorruptedSessionStateException 地址越界，通常意味着句柄引用了已重置的块池
     */
    public final void checkAddress(int address) {
        if (address < 0 || address >= highWaterMark()) {
            throw new CorruptedSessionStateException(getClass().getSimpleName() + " 地址越界: address="
                + address + ", highWaterMark=" + highWaterMark());
        }
    }

    public final int blockSize() {
        return blockSize;
    }

    public final int blockCount() {
        return bufferUpto + 1;
    }

    public final int maxBlocks() {
        return maxBlocks;
    }

    /**
     * 还能启用的新块数，不含当前头块的剩余空间。
     */
    public final int freeBlocks() {
        return maxBlocks - blockCount();
    }

    /**
     * 在单次分配不超过 maxAllocation 个单元的前提下，剩余新块至少还能容纳多少个单元。
     * 单个分配不跨块，所以每块按最坏情况浪费 maxAllocation - 1 个单元计算。
     */
    public final long guaranteedCapacity(int maxAllocation) {
        if (maxAllocation <= 0 || maxAllocation > blockSize) {
            throw new IllegalArgumentException("分配大小必须在 [1, " + blockSize + "] 之间: " + maxAllocation);
        }
        return (long) freeBlocks() * (blockSize - maxAllocation + 1);
    }

    /**
     * 块数上限对应的字节数。
     */
    public final long capacityBytes() {
        return (long) maxBlocks * blockSize * unitBytes;
    }

    /** 在给定序号处放入一个新块并把它设为头块 */
    protected abstract void installBlock(int index);

    /** 把头块引用切换到给定序号，-1 表示无头块；只有需要直接写头块的子类才覆盖 */
    protected void selectHead(int index) {
    }

    /** 将指定块的 [0, length) 清零 */
    protected abstract void zeroFill(int index, int length);

    /** 释放 [from, to) 范围内的块 */
    protected abstract void releaseBlocks(int from, int to);

    /**
     * 计算扩容后的块数组长度。
     */
    protected static int oversize(int minLength) {
        return Math.max(minLength, minLength + (minLength >> 1));
    }
}
