package com.memindex.index;

import com.memindex.config.ConsumerKind;
import com.memindex.config.IndexOptions;
import com.memindex.config.IndexingConfig;
import com.memindex.hash.PostingsArray;
import com.memindex.pool.ByteBlockPool;
import com.memindex.pool.ByteSliceReader;
import com.memindex.pool.BytesUsedCounter;
import com.memindex.pool.CharBlockPool;
import com.memindex.pool.IntBlockPool;
import com.memindex.pool.VarIntCodec;
import com.memindex.segment.FieldStats;
import com.memindex.segment.InvertedPostingsWriter;
import com.memindex.segment.SegmentWriter;
import com.memindex.text.Token;

import java.io.IOException;

/**
 * 倒排表消费者：记录每个词项出现的文档、词频、位置、载荷与偏移。
 *
 * 字节流 0 为文档流，在文档结束时为本文档触及的每个词项写一条记录：
 * 记录词频时为 {@code vint(delta << 1 | freq == 1)}，词频不为 1 时再跟 {@code vint(freq)}；
 * 不记录词频时为 {@code vint(delta)}。
 * 字节流 1 为位置流，每次出现写 {@code vint(positionDelta << 1 | hasPayload)}，
 * 有载荷时跟长度与载荷字节，记录偏移时再跟起始偏移增量与偏移长度。位置与偏移的基准在每篇文档开始时归零。
 */
public class FreqProxConsumer extends TermsHashConsumer<FreqProxConsumer.FreqProxPostingsArray> {
    private static final int DOC_STREAM = 0;
    private static final int POSITION_STREAM = 1;

    private final IndexOptions indexOptions;
    private final boolean hasFreqs;
    private final boolean hasPositions;
    private final boolean hasOffsets;

    private int docCount;
    private long sumDocFreq;
    private long sumTotalTermFreq;

    public FreqProxConsumer(String fieldName, IndexOptions indexOptions, CharBlockPool charPool,
                            IntBlockPool intPool, ByteBlockPool bytePool, IndexingConfig config,
                            BytesUsedCounter bytesUsed) {
        super(fieldName, indexOptions.hasPositions() ? 2 : 1, charPool, intPool, bytePool, config, bytesUsed);
        if (!indexOptions.isIndexed()) {
            throw new IllegalArgumentException("字段 " + fieldName + " 未建索引，不能创建倒排消费者");
        }
        this.indexOptions = indexOptions;
        this.hasFreqs = indexOptions.hasFreqs();
        this.hasPositions = indexOptions.hasPositions();
        this.hasOffsets = indexOptions.hasOffsets();
    }

    @Override
    public ConsumerKind kind() {
        return ConsumerKind.FREQ_PROX;
    }

    public IndexOptions indexOptions() {
        return indexOptions;
    }

    @Override
    public FreqProxPostingsArray newPostingsArray(int size) {
        return new FreqProxPostingsArray(size);
    }

    @Override
    protected void initPosting(FreqProxPostingsArray postings, int termId) {
        postings.termFreqs[termId] = 0;
        postings.prevDocIds[termId] = 0;
        postings.docFreqs[termId] = 0;
        postings.totalTermFreqs[termId] = 0;
        postings.lastPositions[termId] = 0;
        postings.lastOffsets[termId] = 0;
    }

    @Override
    protected void addOccurrence(int termId, boolean firstInDocument, Token token, FieldInvertState state) {
        FreqProxPostingsArray postings = table.postings();
        if (firstInDocument) {
            postings.termFreqs[termId] = 1;
            postings.lastPositions[termId] = 0;
            postings.lastOffsets[termId] = 0;
        } else {
            postings.termFreqs[termId] = Math.incrementExact(postings.termFreqs[termId]);
        }
        postings.totalTermFreqs[termId] = Math.incrementExact(postings.totalTermFreqs[termId]);

        if (hasPositions) {
            int positionDelta = token.position() - postings.lastPositions[termId];
            byte[] payload = token.payload();
            if (payload != null) {
                writeVInt(POSITION_STREAM, (positionDelta << 1) | 1);
                writeVInt(POSITION_STREAM, payload.length);
                writeBytes(POSITION_STREAM, payload, 0, payload.length);
            } else {
                writeVInt(POSITION_STREAM, positionDelta << 1);
            }
            postings.lastPositions[termId] = token.position();

            if (hasOffsets) {
                writeVInt(POSITION_STREAM, token.startOffset() - postings.lastOffsets[termId]);
                writeVInt(POSITION_STREAM, token.endOffset() - token.startOffset());
                postings.lastOffsets[termId] = token.startOffset();
            }
        }
    }

    @Override
    public void finishDocument(FieldInvertState state) {
        if (touchedCount() > 0) {
            docCount++;
        }
        super.finishDocument(state);
    }

    @Override
    protected void finishDocument(int termId, FieldInvertState state) {
        FreqProxPostingsArray postings = table.postings();
        int delta = state.docId() - postings.prevDocIds[termId];
        int freq = postings.termFreqs[termId];
        if (hasFreqs) {
            if (freq == 1) {
                writeVInt(DOC_STREAM, (delta << 1) | 1);
            } else {
                writeVInt(DOC_STREAM, delta << 1);
                writeVInt(DOC_STREAM, freq);
            }
        } else {
            writeVInt(DOC_STREAM, delta);
        }
        postings.prevDocIds[termId] = state.docId();
        postings.docFreqs[termId]++;
        sumDocFreq++;
        sumTotalTermFreq += freq;
    }

    /**
     * 按词项递增顺序把倒排写出。
     */
    @Override
    public void flush(SegmentWriter writer, int numDocs) throws IOException {
        InvertedPostingsWriter out = writer.postings();
        int[] termIds = sortedTermIds();
        FreqProxPostingsArray postings = table.postings();
        ByteSliceReader docReader = new ByteSliceReader();
        ByteSliceReader positionReader = new ByteSliceReader();

        out.startField(fieldName, indexOptions);
        for (int termId : termIds) {
            out.startTerm(termText(termId), postings.docFreqs[termId],
                hasFreqs ? postings.totalTermFreqs[termId] : -1);
            initReader(docReader, termId, DOC_STREAM);
            if (hasPositions) {
                initReader(positionReader, termId, POSITION_STREAM);
            }
            int docId = 0;
            while (!docReader.eof()) {
                int code = VarIntCodec.readVarInt(docReader);
                int freq;
                if (hasFreqs) {
                    docId += code >>> 1;
                    freq = (code & 1) != 0 ? 1 : VarIntCodec.readVarInt(docReader);
                } else {
                    docId += code;
                    freq = -1;
                }
                out.startDocument(docId, freq);
                if (hasPositions) {
                    readPositions(positionReader, freq, out);
                }
                out.finishDocument();
            }
            out.finishTerm();
        }
        out.finishField(new FieldStats(docCount, sumDocFreq, hasFreqs ? sumTotalTermFreq : -1));
    }

    private void readPositions(ByteSliceReader reader, int freq, InvertedPostingsWriter out) throws IOException {
        int position = 0;
        int startOffset = 0;
        for (int occurrence = 0; occurrence < freq; occurrence++) {
            int code = VarIntCodec.readVarInt(reader);
            position += code >>> 1;
            byte[] payload = null;
            if ((code & 1) != 0) {
                payload = new byte[VarIntCodec.readVarInt(reader)];
                reader.readBytes(payload, 0, payload.length);
            }
            int endOffset = -1;
            if (hasOffsets) {
                startOffset += VarIntCodec.readVarInt(reader);
                endOffset = startOffset + VarIntCodec.readVarInt(reader);
            }
            out.addPosition(position, payload, hasOffsets ? startOffset : -1, endOffset);
        }
    }

    @Override
    public void reset() {
        super.reset();
        docCount = 0;
        sumDocFreq = 0;
        sumTotalTermFreq = 0;
    }

    /**
     * 词项的文档频率，测试与统计用。
     */
    public int docFreq(int termId) {
        return table.postings().docFreqs[termId];
    }

    /**
     * 倒排消费者的私有列。
     */
    public static final class FreqProxPostingsArray extends PostingsArray {
        /** 当前文档内词频 */
        final int[] termFreqs;
        /** 上一条已写出文档记录的文档号 */
        final int[] prevDocIds;
        final int[] docFreqs;
        final int[] totalTermFreqs;
        /** 当前文档内上一个位置 */
        final int[] lastPositions;
        /** 当前文档内上一个起始偏移 */
        final int[] lastOffsets;

        public FreqProxPostingsArray(int size) {
            super(size);
            termFreqs = new int[size];
            prevDocIds = new int[size];
            docFreqs = new int[size];
            totalTermFreqs = new int[size];
            lastPositions = new int[size];
            lastOffsets = new int[size];
        }

        @Override
        public int bytesPerPosting() {
            return super.bytesPerPosting() + 6 * Integer.BYTES;
        }

        @Override
        public void copyTo(PostingsArray target, int count) {
            super.copyTo(target, count);
            FreqProxPostingsArray to = (FreqProxPostingsArray) target;
            System.arraycopy(termFreqs, 0, to.termFreqs, 0, count);
            System.arraycopy(prevDocIds, 0, to.prevDocIds, 0, count);
            System.arraycopy(docFreqs, 0, to.docFreqs, 0, count);
            System.arraycopy(totalTermFreqs, 0, to.totalTermFreqs, 0, count);
            System.arraycopy(lastPositions, 0, to.lastPositions, 0, count);
            System.arraycopy(lastOffsets, 0, to.lastOffsets, 0, count);
        }
    }
}
