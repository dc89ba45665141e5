package com.memindex.hash;

import com.memindex.error.EmptyTermException;
import com.memindex.error.OversizedTermException;
import com.memindex.error.ResourceExhaustedException;
import com.memindex.pool.BytesUsedCounter;
import com.memindex.pool.CharBlockPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * 词项哈希表：把词项文本映射为稠密的词项编号。
 *
 * 采用开放寻址，槽位数为 2 的幂，探测步长 {@code ((code >> 8) + code) | 1} 恒为奇数，
 * 因此一定能遍历所有槽位。冲突时回到字符池比较文本内容。扩容只重建槽位数组，
 * 词项编号与池中的数据都不变。
 *
 * @param <P> 倒排数组类型，由 {@link PostingFactory} 创建
 */
public final class TermHashTable<P extends PostingsArray> {
    private static final Logger logger = LoggerFactory.getLogger(TermHashTable.class);

    private static final int MAX_HASH_SIZE = 1 << 30;
    private static final int INITIAL_POSTINGS_SIZE = 2;

    private final CharBlockPool charPool;
    private final PostingFactory<P> factory;
    private final BytesUsedCounter bytesUsed;
    private final int initialCapacity;
    private final float loadFactor;
    private final int growthFactor;
    private final int maxTermLength;

    private int hashSize;
    private int hashMask;
    private int growThreshold;
    private int[] ids;
    private int count;
    private P postings;

    public TermHashTable(CharBlockPool charPool, PostingFactory<P> factory, int initialCapacity,
                         float loadFactor, int growthFactor, int maxTermLength, BytesUsedCounter bytesUsed) {
        if (Integer.bitCount(initialCapacity) != 1 || initialCapacity < 2) {
            throw new IllegalArgumentException("初始容量必须是不小于 2 的 2 的幂: " + initialCapacity);
        }
        if (!(loadFactor > 0f && loadFactor < 1f)) {
            throw new IllegalArgumentException("负载因子必须在 (0, 1) 之间: " + loadFactor);
        }
        if (Integer.bitCount(growthFactor) != 1 || growthFactor < 2) {
            throw new IllegalArgumentException("扩容倍数必须是不小于 2 的 2 的幂: " + growthFactor);
        }
        if (maxTermLength <= 0) {
            throw new IllegalArgumentException("最大词项长度必须为正数: " + maxTermLength);
        }
        this.charPool = charPool;
        this.factory = factory;
        this.bytesUsed = bytesUsed;
        this.initialCapacity = initialCapacity;
        this.loadFactor = loadFactor;
        this.growthFactor = growthFactor;
        this.maxTermLength = Math.min(maxTermLength, charPool.maxTextLength());
        installSlots(initialCapacity);
    }

    /**
     * 查找或创建词项。
     *
     * @return 新建时返回词项编号（非负），已存在时返回 {@code -(termId + 1)}
     * @throws EmptyTermException 文本为空
     * @throws OversizedTermException 文本超过最大词项长度
     */
    public int findOrCreate(char[] text, int textOffset, int length) {
        checkTermLength(length);
        int code = CharBlockPool.hash(text, textOffset, length);
        int slot = code & hashMask;
        int termId = ids[slot];
        while (termId != -1 && !charPool.textEquals(postings.textStarts[termId], text, textOffset, length)) {
            code += ((code >> 8) + code) | 1;
            slot = code & hashMask;
            termId = ids[slot];
        }
        if (termId != -1) {
            return -(termId + 1);
        }
        // 先写文本：分配失败时表本身保持不变
        int textStart = charPool.addText(text, textOffset, length);
        return insert(slot, textStart);
    }

    /**
     * 以字符池中已有的文本查找或创建词项，供共享字符池的后续消费者使用。
     *
     * @return 约定同 {@link #findOrCreate(char[], int, int)}
     */
    public int findOrCreateByTextStart(int textStart) {
        checkTermLength(charPool.textLength(textStart));
        int code = charPool.hashText(textStart);
        int slot = code & hashMask;
        int termId = ids[slot];
        while (termId != -1 && !sameText(postings.textStarts[termId], textStart)) {
            code += ((code >> 8) + code) | 1;
            slot = code & hashMask;
            termId = ids[slot];
        }
        if (termId != -1) {
            return -(termId + 1);
        }
        return insert(slot, textStart);
    }

    /**
     * 只查找不创建。
     *
     * @return 词项编号，不存在时返回 -1
     */
    public int find(char[] text, int textOffset, int length) {
        if (length <= 0 || length > maxTermLength) {
            return -1;
        }
        int code = CharBlockPool.hash(text, textOffset, length);
        int slot = code & hashMask;
        int termId = ids[slot];
        while (termId != -1 && !charPool.textEquals(postings.textStarts[termId], text, textOffset, length)) {
            code += ((code >> 8) + code) | 1;
            slot = code & hashMask;
            termId = ids[slot];
        }
        return termId;
    }

    public int find(String term) {
        return find(term.toCharArray(), 0, term.length());
    }

    public PostingHandle handle(int termId) {
        checkTermId(termId);
        return new PostingHandle(postings.textStarts[termId], postings.intStarts[termId], postings.byteStarts[termId]);
    }

    public String termText(int termId) {
        checkTermId(termId);
        return charPool.text(postings.textStarts[termId]);
    }

    public int size() {
        return count;
    }

    /**
     * 当前槽位数。
     */
    public int capacity() {
        return hashSize;
    }

    public int maxTermLength() {
        return maxTermLength;
    }

    /**
     * 当前的倒排数组。扩容会替换数组对象，调用方不要跨插入持有它。
     */
    public P postings() {
        return postings;
    }

    /**
     * 按词项的码点顺序返回全部词项编号。
     */
    public int[] sortedTermIds() {
        int[] termIds = new int[count];
        for (int termId = 0; termId < count; termId++) {
            termIds[termId] = termId;
        }
        if (count > 1) {
            TermIdSorter.sort(termIds, count, postings.textStarts, charPool);
        }
        return termIds;
    }

    /**
     * 清空全部词项。倒排数组保留复用；槽位数组在过于稀疏时收缩回初始容量附近。
     */
    public void clear() {
        clear(false);
    }

    /**
     * 清空全部词项。
     *
     * @param releaseMemory 为 true 时丢弃倒排数组并把槽位数组收回初始容量，占用从计数器中扣除；
     *                      段刷新后使用，使内存回到预算以下
     */
    public void clear(boolean releaseMemory) {
        int previous = count;
        count = 0;
        if (releaseMemory && postings != null) {
            bytesUsed.addAndGet(-(long) postings.size * postings.bytesPerPosting());
            postings = null;
        }
        int targetSize = hashSize;
        while (targetSize > initialCapacity && (releaseMemory || previous < (targetSize >> 3))) {
            targetSize >>= 1;
        }
        if (targetSize != hashSize) {
            logger.debug("收缩哈希槽位: {} -> {}", hashSize, targetSize);
            bytesUsed.addAndGet(-(long) hashSize * Integer.BYTES);
            installSlots(targetSize);
        } else {
            Arrays.fill(ids, -1);
        }
    }

    private int insert(int slot, int textStart) {
        int termId = count;
        ensurePostings(termId);
        postings.textStarts[termId] = textStart;
        ids[slot] = termId;
        count++;
        factory.newPosting(postings, termId);
        if (count > growThreshold) {
            rehash(hashSize * growthFactor);
        }
        return termId;
    }

    private void ensurePostings(int termId) {
        if (postings == null) {
            postings = factory.newPostingsArray(INITIAL_POSTINGS_SIZE);
            bytesUsed.addAndGet((long) postings.size * postings.bytesPerPosting());
        } else if (termId >= postings.size) {
            int newSize = Math.max(termId + 1, postings.size + (postings.size >> 1));
            P grown = factory.newPostingsArray(newSize);
            postings.copyTo(grown, count);
            bytesUsed.addAndGet((long) (newSize - postings.size) * grown.bytesPerPosting());
            postings = grown;
        }
    }

    private void rehash(int newSize) {
        if (newSize > MAX_HASH_SIZE || newSize <= 0) {
            throw new ResourceExhaustedException("哈希槽位数超过上限 " + MAX_HASH_SIZE, bytesUsed.get());
        }
        logger.debug("哈希表扩容: {} -> {}, 词项数 {}", hashSize, newSize, count);
        int newMask = newSize - 1;
        int[] newIds = new int[newSize];
        Arrays.fill(newIds, -1);
        for (int slot = 0; slot < hashSize; slot++) {
            int termId = ids[slot];
            if (termId == -1) {
                continue;
            }
            int code = charPool.hashText(postings.textStarts[termId]);
            int newSlot = code & newMask;
            while (newIds[newSlot] != -1) {
                code += ((code >> 8) + code) | 1;
                newSlot = code & newMask;
            }
            newIds[newSlot] = termId;
        }
        bytesUsed.addAndGet((long) (newSize - hashSize) * Integer.BYTES);
        ids = newIds;
        hashSize = newSize;
        hashMask = newMask;
        growThreshold = (int) (newSize * loadFactor);
    }

    private void installSlots(int size) {
        ids = new int[size];
        Arrays.fill(ids, -1);
        hashSize = size;
        hashMask = size - 1;
        growThreshold = (int) (size * loadFactor);
        bytesUsed.addAndGet((long) size * Integer.BYTES);
    }

    private boolean sameText(int left, int right) {
        return left == right || charPool.compareText(left, right) == 0;
    }

    /**
     * 校验词项长度，不修改任何状态。
     *
     * @throws EmptyTermException 长度为 0
     * @throws OversizedTermException 超过最大词项长度
     */
    public void checkTermLength(int length) {
        if (length == 0) {
            throw new EmptyTermException();
        }
        if (length > maxTermLength) {
            throw new OversizedTermException(length, maxTermLength);
        }
    }

    private void checkTermId(int termId) {
        if (termId < 0 || termId >= count) {
            throw new IllegalArgumentException("词项编号越界: " + termId + ", 词项数 " + count);
        }
    }
}
