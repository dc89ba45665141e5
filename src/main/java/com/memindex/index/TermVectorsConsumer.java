package com.memindex.index;

import com.memindex.config.ConsumerKind;
import com.memindex.config.FieldOptions;
import com.memindex.config.IndexingConfig;
import com.memindex.hash.PostingsArray;
import com.memindex.pool.ByteBlockPool;
import com.memindex.pool.ByteSliceReader;
import com.memindex.pool.BytesUsedCounter;
import com.memindex.pool.CharBlockPool;
import com.memindex.pool.IntBlockPool;
import com.memindex.pool.VarIntCodec;
import com.memindex.segment.SegmentWriter;
import com.memindex.segment.TermVectorsWriter;
import com.memindex.text.Token;

import java.io.IOException;

/**
 * 词向量消费者：只记录当前文档，文档结束后由会话调用 {@link #writeDocument(TermVectorsWriter)}
 * 按词项顺序写出，随后清空词表。所有词向量字段共用一组整数池与字节池，会话在每篇文档之后重置它们。
 *
 * 字节流 0 记录位置与载荷，字节流 1 记录偏移，编码方式与倒排表的位置流相同。
 */
public class TermVectorsConsumer extends TermsHashConsumer<TermVectorsConsumer.TermVectorsPostingsArray> {
    private static final int POSITION_STREAM = 0;
    private static final int OFFSET_STREAM = 1;

    private final boolean hasPositions;
    private final boolean hasOffsets;
    private final boolean hasPayloads;

    public TermVectorsConsumer(String fieldName, FieldOptions options, CharBlockPool charPool,
                               IntBlockPool intPool, ByteBlockPool bytePool, IndexingConfig config,
                               BytesUsedCounter bytesUsed) {
        super(fieldName, 2, charPool, intPool, bytePool, config, bytesUsed);
        if (!options.isTermVectors()) {
            throw new IllegalArgumentException("字段 " + fieldName + " 未开启词向量");
        }
        this.hasPositions = options.isTermVectorPositions();
        this.hasOffsets = options.isTermVectorOffsets();
        this.hasPayloads = options.isTermVectorPayloads();
    }

    @Override
    public ConsumerKind kind() {
        return ConsumerKind.TERM_VECTORS;
    }

    @Override
    public TermVectorsPostingsArray newPostingsArray(int size) {
        return new TermVectorsPostingsArray(size);
    }

    @Override
    protected void initPosting(TermVectorsPostingsArray postings, int termId) {
        postings.freqs[termId] = 0;
        postings.lastPositions[termId] = 0;
        postings.lastOffsets[termId] = 0;
    }

    @Override
    protected void addOccurrence(int termId, boolean firstInDocument, Token token, FieldInvertState state) {
        TermVectorsPostingsArray postings = table.postings();
        if (firstInDocument) {
            postings.freqs[termId] = 1;
            postings.lastPositions[termId] = 0;
            postings.lastOffsets[termId] = 0;
        } else {
            postings.freqs[termId] = Math.incrementExact(postings.freqs[termId]);
        }

        if (hasPositions) {
            int positionDelta = token.position() - postings.lastPositions[termId];
            byte[] payload = hasPayloads ? token.payload() : null;
            if (payload != null) {
                writeVInt(POSITION_STREAM, (positionDelta << 1) | 1);
                writeVInt(POSITION_STREAM, payload.length);
                writeBytes(POSITION_STREAM, payload, 0, payload.length);
            } else {
                writeVInt(POSITION_STREAM, positionDelta << 1);
            }
            postings.lastPositions[termId] = token.position();
        }
        if (hasOffsets) {
            writeVInt(OFFSET_STREAM, token.startOffset() - postings.lastOffsets[termId]);
            writeVInt(OFFSET_STREAM, token.endOffset() - token.startOffset());
            postings.lastOffsets[termId] = token.startOffset();
        }
    }

    @Override
    protected void finishDocument(int termId, FieldInvertState state) {
        // 词向量在 writeDocument 中整体写出
    }

    /**
     * 当前文档是否有词向量可写。
     */
    public boolean hasPendingTerms() {
        return termCount() > 0;
    }

    /**
     * 写出当前文档的词向量并清空词表。
     */
    public void writeDocument(TermVectorsWriter out) throws IOException {
        int[] termIds = sortedTermIds();
        TermVectorsPostingsArray postings = table.postings();
        ByteSliceReader positionReader = new ByteSliceReader();
        ByteSliceReader offsetReader = new ByteSliceReader();

        out.startField(fieldName, termIds.length, hasPositions, hasOffsets, hasPayloads);
        for (int termId : termIds) {
            int freq = postings.freqs[termId];
            out.startTerm(termText(termId), freq);
            if (hasPositions || hasOffsets) {
                initReader(positionReader, termId, POSITION_STREAM);
                initReader(offsetReader, termId, OFFSET_STREAM);
                int position = 0;
                int startOffset = 0;
                for (int occurrence = 0; occurrence < freq; occurrence++) {
                    byte[] payload = null;
                    if (hasPositions) {
                        int code = VarIntCodec.readVarInt(positionReader);
                        position += code >>> 1;
                        if ((code & 1) != 0) {
                            payload = new byte[VarIntCodec.readVarInt(positionReader)];
                            positionReader.readBytes(payload, 0, payload.length);
                        }
                    }
                    int endOffset = -1;
                    if (hasOffsets) {
                        startOffset += VarIntCodec.readVarInt(offsetReader);
                        endOffset = startOffset + VarIntCodec.readVarInt(offsetReader);
                    }
                    out.addPosition(hasPositions ? position : -1, hasOffsets ? startOffset : -1, endOffset, payload);
                }
            }
            out.finishTerm();
        }
        out.finishField();
        table.clear();
    }

    /**
     * 词向量已在每篇文档结束时写出，段刷新时无事可做。
     */
    @Override
    public void flush(SegmentWriter writer, int numDocs) {
    }

    /**
     * 词向量消费者的私有列。
     */
    public static final class TermVectorsPostingsArray extends PostingsArray {
        final int[] freqs;
        final int[] lastPositions;
        final int[] lastOffsets;

        public TermVectorsPostingsArray(int size) {
            super(size);
            freqs = new int[size];
            lastPositions = new int[size];
            lastOffsets = new int[size];
        }

        @Override
        public int bytesPerPosting() {
            return super.bytesPerPosting() + 3 * Integer.BYTES;
        }

        @Override
        public void copyTo(PostingsArray target, int count) {
            super.copyTo(target, count);
            TermVectorsPostingsArray to = (TermVectorsPostingsArray) target;
            System.arraycopy(freqs, 0, to.freqs, 0, count);
            System.arraycopy(lastPositions, 0, to.lastPositions, 0, count);
            System.arraycopy(lastOffsets, 0, to.lastOffsets, 0, count);
        }
    }
}
