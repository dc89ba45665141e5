package com.memindex.index;

import com.memindex.config.ConsumerKind;
import com.memindex.pool.BytesUsedCounter;
import com.memindex.segment.SegmentWriter;

import java.io.IOException;
import java.util.Arrays;

/**
 * 归一化因子消费者：不使用词项哈希表，每篇文档保留一个字节。
 *
 * 未出现该字段的文档取 0。
 */
public class NormsConsumer implements PostingListConsumer {
    private static final int INITIAL_CAPACITY = 64;

    private final String fieldName;
    private final NormEncoder encoder;
    private final BytesUsedCounter bytesUsed;
    private byte[] norms;

    public NormsConsumer(String fieldName, NormEncoder encoder, BytesUsedCounter bytesUsed) {
        if (encoder == null) {
            throw new IllegalArgumentException("归一化编码器不能为空");
        }
        this.fieldName = fieldName;
        this.encoder = encoder;
        this.bytesUsed = bytesUsed;
        this.norms = new byte[INITIAL_CAPACITY];
        bytesUsed.addAndGet(norms.length);
    }

    @Override
    public ConsumerKind kind() {
        return ConsumerKind.NORMS;
    }

    @Override
    public String fieldName() {
        return fieldName;
    }

    @Override
    public void startDocument(FieldInvertState state) {
        int docId = state.docId();
        if (docId >= norms.length) {
            int newLength = Math.max(docId + 1, norms.length + (norms.length >> 1));
            bytesUsed.addAndGet(newLength - norms.length);
            norms = Arrays.copyOf(norms, newLength);
        }
    }

    @Override
    public void finishDocument(FieldInvertState state) {
        norms[state.docId()] = encoder.encode(state.length());
    }

    @Override
    public void flush(SegmentWriter writer, int numDocs) throws IOException {
        byte[] segmentNorms = new byte[numDocs];
        System.arraycopy(norms, 0, segmentNorms, 0, Math.min(numDocs, norms.length));
        writer.norms().addNorms(fieldName, segmentNorms);
    }

    @Override
    public void reset() {
        bytesUsed.addAndGet(INITIAL_CAPACITY - norms.length);
        norms = new byte[INITIAL_CAPACITY];
    }
}
