package com.memindex.index;

import com.memindex.config.IndexingConfig;
import com.memindex.hash.PostingFactory;
import com.memindex.hash.PostingsArray;
import com.memindex.hash.TermHashTable;
import com.memindex.pool.ByteBlockPool;
import com.memindex.pool.ByteSliceReader;
import com.memindex.pool.BytesUsedCounter;
import com.memindex.pool.CharBlockPool;
import com.memindex.pool.IntBlockPool;
import com.memindex.pool.VarIntCodec;
import com.memindex.text.Token;

import java.util.Arrays;

/**
 * 基于词项哈希表的消费者基类。
 *
 * 每个新词项在整数池中占 streamCount 个写入游标，在字节池中占 streamCount 个第一级切片。
 * 字段链的第一个消费者按文本哈希词项，后续消费者以字符池偏移共享同一份文本。
 *
 * @param <P> 倒排数组类型
 */
public abstract class TermsHashConsumer<P extends PostingsArray> implements PostingListConsumer, PostingFactory<P> {
    protected final String fieldName;
    protected final TermHashTable<P> table;
    protected final IntBlockPool intPool;
    protected final ByteBlockPool bytePool;

    private final int streamCount;
    private final VarIntCodec.ByteSink[] streamSinks;
    private TermsHashConsumer<?> next;
    private boolean head = true;

    private int[] touchedTermIds = new int[16];
    private int touchedCount;
    private char[] termBuffer = new char[16];
    /** 当前词项整数记录的起点 */
    private int intUpto;

    protected TermsHashConsumer(String fieldName, int streamCount, CharBlockPool charPool, IntBlockPool intPool,
                                ByteBlockPool bytePool, IndexingConfig config, BytesUsedCounter bytesUsed) {
        if (streamCount <= 0) {
            throw new IllegalArgumentException("字节流条数必须为正数: " + streamCount);
        }
        this.fieldName = fieldName;
        this.intPool = intPool;
        this.bytePool = bytePool;
        this.streamCount = streamCount;
        this.streamSinks = new VarIntCodec.ByteSink[streamCount];
        for (int stream = 0; stream < streamCount; stream++) {
            final int target = stream;
            streamSinks[stream] = value -> writeByte(target, value);
        }
        this.table = new TermHashTable<>(charPool, this, config.getHashInitialCapacity(),
            config.getHashLoadFactor(), config.getHashGrowthFactor(), config.getMaxTermLength(), bytesUsed);
    }

    /**
     * 把后续消费者接到本消费者之后。
     */
    void setNext(TermsHashConsumer<?> consumer) {
        if (consumer == this) {
            throw new IllegalArgumentException("消费者不能链接到自身");
        }
        consumer.head = false;
        this.next = consumer;
    }

    public boolean isHead() {
        return head;
    }

    @Override
    public String fieldName() {
        return fieldName;
    }

    /**
     * 作为链首接收一个词项。文本非法时在任何分配之前抛出异常。
     */
    public void add(Token token, FieldInvertState state) {
        String term = token.term();
        int length = term.length();
        table.checkTermLength(length);
        if (length > termBuffer.length) {
            termBuffer = new char[Math.max(length, termBuffer.length << 1)];
        }
        term.getChars(0, length, termBuffer, 0);
        accept(table.findOrCreate(termBuffer, 0, length), token, state);
    }

    /**
     * 作为后续消费者接收链首已写入字符池的词项。
     */
    public void addByTextStart(int textStart, Token token, FieldInvertState state) {
        accept(table.findOrCreateByTextStart(textStart), token, state);
    }

    private void accept(int result, Token token, FieldInvertState state) {
        int termId = result >= 0 ? result : -(result + 1);
        P postings = table.postings();
        intUpto = postings.intStarts[termId];
        boolean firstInDocument = postings.lastDocIds[termId] != state.docId();
        if (firstInDocument) {
            postings.lastDocIds[termId] = state.docId();
            touch(termId);
        }
        addOccurrence(termId, firstInDocument, token, state);
        if (next != null) {
            next.addByTextStart(postings.textStarts[termId], token, state);
        }
    }

    @Override
    public final void newPosting(P postings, int termId) {
        int intStart = intPool.allocate(streamCount);
        int byteStart = bytePool.newSlices(streamCount);
        for (int stream = 0; stream < streamCount; stream++) {
            intPool.set(intStart + stream, byteStart + stream * ByteBlockPool.FIRST_LEVEL_SIZE);
        }
        postings.intStarts[termId] = intStart;
        postings.byteStarts[termId] = byteStart;
        postings.lastDocIds[termId] = -1;
        initPosting(postings, termId);
    }

    @Override
    public void startDocument(FieldInvertState state) {
        touchedCount = 0;
    }

    /**
     * 对当前文档触及的每个词项调用一次 {@link #finishDocument(int, FieldInvertState)}。
     */
    @Override
    public void finishDocument(FieldInvertState state) {
        P postings = table.postings();
        for (int index = 0; index < touchedCount; index++) {
            int termId = touchedTermIds[index];
            intUpto = postings.intStarts[termId];
            finishDocument(termId, state);
        }
        touchedCount = 0;
    }

    /**
     * 段刷新之后调用：倒排数组与多余的槽位一并释放。
     */
    @Override
    public void reset() {
        table.clear(true);
        touchedCount = 0;
    }

    /**
     * 初始化新词项的消费者私有列。
     */
    protected abstract void initPosting(P postings, int termId);

    /**
     * 记录一次出现。
     *
     * @param firstInDocument 该词项是否第一次出现在当前文档
     */
    protected abstract void addOccurrence(int termId, boolean firstInDocument, Token token, FieldInvertState state);

    /**
     * 结束词项在当前文档中的记录。
     */
    protected abstract void finishDocument(int termId, FieldInvertState state);

    protected final void writeByte(int stream, byte value) {
        int cursor = intUpto + stream;
        intPool.set(cursor, bytePool.writeByte(intPool.get(cursor), value));
    }

    protected final void writeBytes(int stream, byte[] values, int offset, int length) {
        int end = offset + length;
        for (int index = offset; index < end; index++) {
            writeByte(stream, values[index]);
        }
    }

    protected final void writeVInt(int stream, int value) {
        VarIntCodec.writeVarInt(value, streamSinks[stream]);
    }

    /**
     * 把读取器定位到词项的第 stream 条字节流。
     */
    protected final void initReader(ByteSliceReader reader, int termId, int stream) {
        P postings = table.postings();
        int start = postings.byteStarts[termId] + stream * ByteBlockPool.FIRST_LEVEL_SIZE;
        int end = intPool.get(postings.intStarts[termId] + stream);
        reader.init(bytePool, start, end);
    }

    public int[] sortedTermIds() {
        return table.sortedTermIds();
    }

    public String termText(int termId) {
        return table.termText(termId);
    }

    public int termCount() {
        return table.size();
    }

    protected final int touchedCount() {
        return touchedCount;
    }

    private void touch(int termId) {
        if (touchedCount == touchedTermIds.length) {
            touchedTermIds = Arrays.copyOf(touchedTermIds, touchedCount << 1);
        }
        touchedTermIds[touchedCount++] = termId;
    }
}
