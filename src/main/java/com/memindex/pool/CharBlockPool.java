package com.memindex.pool;

import java.util.Arrays;

/**
 * 字符块池，存放词项文本。
 *
 * 每个词项的存放布局为：一个长度字符 + 文本字符，整体不跨块。多个哈希表可以共享同一个字符池，
 * 以便不同消费者不重复保存相同的词项文本。
 */
public final class CharBlockPool extends BlockPool {

    char[][] buffers = new char[10][];

    public CharBlockPool(int blockShift, int maxBlocks, BytesUsedCounter bytesUsed) {
        super(blockShift, Character.BYTES, maxBlocks, bytesUsed);
    }

    /**
     * 可存放的最长文本。
     */
    public int maxTextLength() {
        return Math.min(blockSize - 1, Character.MAX_VALUE);
    }

    /**
     * 复制一段文本到池中。
     *
     * @return 文本起始绝对偏移（指向长度字符）
     */
    public int addText(char[] text, int textOffset, int length) {
        if (length > maxTextLength()) {
            throw new IllegalArgumentException("文本长度 " + length + " 超过字符块容量 " + maxTextLength());
        }
        int textStart = allocate(length + 1);
        char[] block = buffers[textStart >> blockShift];
        int pos = textStart & blockMask;
        block[pos] = (char) length;
        System.arraycopy(text, textOffset, block, pos + 1, length);
        return textStart;
    }

    public int textLength(int textStart) {
        checkAddress(textStart);
        return buffers[textStart >> blockShift][textStart & blockMask];
    }

    public String text(int textStart) {
        checkAddress(textStart);
        char[] block = buffers[textStart >> blockShift];
        int pos = textStart & blockMask;
        return new String(block, pos + 1, block[pos]);
    }

    /**
     * 比较池中文本与给定文本是否相同。
     */
    public boolean textEquals(int textStart, char[] other, int otherOffset, int otherLength) {
        char[] block = buffers[textStart >> blockShift];
        int pos = textStart & blockMask;
        if (block[pos] != otherLength) {
            return false;
        }
        return Arrays.equals(block, pos + 1, pos + 1 + otherLength, other, otherOffset, otherOffset + otherLength);
    }

    /**
     * 计算池中文本的哈希值，与 {@link #hash(char[], int, int)} 对同一内容给出相同结果。
     */
    public int hashText(int textStart) {
        char[] block = buffers[textStart >> blockShift];
        int pos = textStart & blockMask;
        return hash(block, pos + 1, block[pos]);
    }

    /**
     * 按码点顺序比较两段池中文本，结果与比较其 UTF-8 字节的字典序一致。
     */
    public int compareText(int leftStart, int rightStart) {
        char[] leftBlock = buffers[leftStart >> blockShift];
        int leftPos = leftStart & blockMask;
        char[] rightBlock = buffers[rightStart >> blockShift];
        int rightPos = rightStart & blockMask;

        int leftLength = leftBlock[leftPos];
        int rightLength = rightBlock[rightPos];
        int limit = Math.min(leftLength, rightLength);
        for (int index = 1; index <= limit; index++) {
            char left = leftBlock[leftPos + index];
            char right = rightBlock[rightPos + index];
            if (left != right) {
                return codePointOrder(left) - codePointOrder(right);
            }
        }
        return leftLength - rightLength;
    }

    /**
     * 文本内容哈希。
     */
    public static int hash(char[] text, int textOffset, int length) {
        int code = 0;
        int end = textOffset + length;
        for (int index = textOffset; index < end; index++) {
            code = 31 * code + text[index];
        }
        // murmur3 fmix32，避免低位聚集
        code ^= code >>> 16;
        code *= 0x85ebca6b;
        code ^= code >>> 13;
        code *= 0xc2b2ae35;
        code ^= code >>> 16;
        return code;
    }

    /**
     * 把 UTF-16 码元映射为码点顺序：代理区移到 U+E000..U+FFFF 之后。
     */
    private static int codePointOrder(char value) {
        if (value < 0xD800) {
            return value;
        }
        return value >= 0xE000 ? value - 0x800 : value + 0x2000;
    }

    @Override
    protected void installBlock(int index) {
        if (index == buffers.length) {
            buffers = Arrays.copyOf(buffers, oversize(index + 1));
        }
        buffers[index] = new char[blockSize];
    }

    @Override
    protected void zeroFill(int index, int length) {
        Arrays.fill(buffers[index], 0, length, (char) 0);
    }

    @Override
    protected void releaseBlocks(int from, int to) {
        Arrays.fill(buffers, from, to, null);
    }
}
