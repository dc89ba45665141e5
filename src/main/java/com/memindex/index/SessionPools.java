package com.memindex.index;

import com.memindex.config.ConsumerKind;
import com.memindex.config.FieldOptions;
import com.memindex.config.IndexOptions;
import com.memindex.config.IndexingConfig;
import com.memindex.document.IndexDocument;
import com.memindex.document.IndexField;
import com.memindex.pool.ByteBlockPool;
import com.memindex.pool.BytesUsedCounter;
import com.memindex.pool.CharBlockPool;
import com.memindex.pool.IntBlockPool;
import com.memindex.pool.VarIntCodec;
import com.memindex.text.Token;

/**
 * 一个会话拥有的全部块池。
 *
 * 字符池由所有字段共享；倒排表与词向量各有一组整数池和字节池。
 */
final class SessionPools {
    /** 一条切片链前两级的大小之和：新词项的第一级切片加上第一次升级 */
    private static final int SLICE_CHAIN_HEAD = ByteBlockPool.FIRST_LEVEL_SIZE + 14;
    /** 文档结束时每个词项写入文档流的上限：两个 VInt */
    private static final int DOC_RECORD_BYTES = 10;

    private final IndexingConfig config;
    final CharBlockPool charPool;
    final IntBlockPool freqProxInts;
    final ByteBlockPool freqProxBytes;
    final IntBlockPool vectorInts;
    final ByteBlockPool vectorBytes;

    SessionPools(IndexingConfig config, BytesUsedCounter bytesUsed) {
        this.config = config;
        int maxSlabs = config.getMaxSlabsPerPool();
        this.charPool = new CharBlockPool(config.getCharBlockShift(), maxSlabs, bytesUsed);
        this.freqProxInts = new IntBlockPool(config.getIntBlockShift(), maxSlabs, bytesUsed);
        this.freqProxBytes = new ByteBlockPool(config.getByteBlockShift(), maxSlabs, bytesUsed);
        this.vectorInts = new IntBlockPool(config.getIntBlockShift(), maxSlabs, bytesUsed);
        this.vectorBytes = new ByteBlockPool(config.getByteBlockShift(), maxSlabs, bytesUsed);
    }

    /**
     * 按最坏情况估算一篇文档在字符池与倒排块池中的占用，判断剩余的块是否一定放得下。
     * 每个词项都按新词项计算，切片链按两倍放大。词向量池在每篇文档后重置，不参与估算。
     */
    boolean hasHeadroomFor(IndexDocument document) {
        boolean freqProxEnabled = config.isEnabled(ConsumerKind.FREQ_PROX);
        boolean vectorsEnabled = config.isEnabled(ConsumerKind.TERM_VECTORS);
        long chars = 0;
        int maxTextAllocation = 1;
        long ints = 0;
        long bytes = 0;
        for (IndexField field : document.fields()) {
            FieldOptions options = config.optionsFor(field.name());
            IndexOptions indexOptions = options.getIndexOptions();
            boolean hashed = indexOptions.isIndexed() && (freqProxEnabled || (vectorsEnabled && options.isTermVectors()));
            if (!hashed) {
                continue;
            }
            int streams = indexOptions.hasPositions() ? 2 : 1;
            for (Token token : field.tokens()) {
                int textAllocation = token.term().length() + 1;
                if (textAllocation > charPool.maxTextLength() + 1) {
                    // 超出字符块容量的词项会被跳过
                    continue;
                }
                chars += textAllocation;
                maxTextAllocation = Math.max(maxTextAllocation, textAllocation);
                if (!freqProxEnabled) {
                    continue;
                }
                ints += streams;
                long written = DOC_RECORD_BYTES;
                if (indexOptions.hasPositions()) {
                    written += VarIntCodec.varIntSize(token.position() << 1 | 1);
                    byte[] payload = token.payload();
                    if (payload != null) {
                        written += VarIntCodec.varIntSize(payload.length) + payload.length;
                    }
                    if (indexOptions.hasOffsets()) {
                        written += VarIntCodec.varIntSize(token.startOffset())
                            + VarIntCodec.varIntSize(token.endOffset() - token.startOffset());
                    }
                }
                bytes += (long) streams * SLICE_CHAIN_HEAD + 2 * written;
            }
        }
        return chars <= charPool.guaranteedCapacity(maxTextAllocation)
            && ints <= freqProxInts.guaranteedCapacity(2)
            && bytes <= freqProxBytes.guaranteedCapacity(ByteBlockPool.MAX_LEVEL_SIZE);
    }

    /**
     * 每篇文档之后重置词向量池。
     */
    void resetTermVectors() {
        vectorInts.reset();
        vectorBytes.reset();
    }

    /**
     * 段刷新之后重置全部块池，保留各自的第一个块。
     */
    void resetAfterFlush() {
        charPool.reset();
        freqProxInts.reset();
        freqProxBytes.reset();
        resetTermVectors();
    }

    /**
     * 会话关闭时释放全部块。
     */
    void release() {
        charPool.reset(false);
        freqProxInts.reset(false);
        freqProxBytes.reset(false);
        vectorInts.reset(false);
        vectorBytes.reset(false);
    }
}
