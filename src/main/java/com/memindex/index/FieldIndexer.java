package com.memindex.index;

import com.memindex.config.ConsumerKind;
import com.memindex.config.FieldOptions;
import com.memindex.config.IndexingConfig;
import com.memindex.document.IndexField;
import com.memindex.error.EmptyTermException;
import com.memindex.error.IndexingException;
import com.memindex.error.OversizedTermException;
import com.memindex.pool.BytesUsedCounter;
import com.memindex.segment.SegmentWriter;
import com.memindex.text.Token;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 一个字段的消费者链。
 *
 * 链首是第一个基于哈希表的消费者（倒排表优先，其次词向量），它负责哈希词项文本，
 * 其余哈希消费者以字符池偏移别名同一词项。归一化因子消费者不在链上，只读取字段长度。
 */
public final class FieldIndexer {

    /**
     * 词项被跳过时的回调。
     */
    @FunctionalInterface
    interface SkippedTokenHandler {
        void onSkipped(String field, Token token, IndexingException error);
    }

    private final String fieldName;
    private final FieldOptions options;
    private final FieldInvertState state;
    private final List<PostingListConsumer> consumers = new ArrayList<>();
    private final TermsHashConsumer<?> head;
    private final TermVectorsConsumer termVectors;
    private final int maxTermLength;
    private boolean seenInSegment;

    FieldIndexer(String fieldName, IndexingConfig config, SessionPools pools, NormEncoder normEncoder,
                 BytesUsedCounter bytesUsed) {
        this.fieldName = fieldName;
        this.options = config.optionsFor(fieldName);
        this.state = new FieldInvertState(fieldName);
        this.maxTermLength = Math.min(config.getMaxTermLength(), pools.charPool.maxTextLength());

        FreqProxConsumer freqProx = null;
        TermVectorsConsumer vectors = null;
        if (options.getIndexOptions().isIndexed()) {
            if (config.isEnabled(ConsumerKind.FREQ_PROX)) {
                freqProx = new FreqProxConsumer(fieldName, options.getIndexOptions(), pools.charPool,
                    pools.freqProxInts, pools.freqProxBytes, config, bytesUsed);
                consumers.add(freqProx);
            }
            if (config.isEnabled(ConsumerKind.TERM_VECTORS) && options.isTermVectors()) {
                vectors = new TermVectorsConsumer(fieldName, options, pools.charPool,
                    pools.vectorInts, pools.vectorBytes, config, bytesUsed);
                consumers.add(vectors);
            }
            if (config.isEnabled(ConsumerKind.NORMS) && options.isNorms()) {
                consumers.add(new NormsConsumer(fieldName, normEncoder, bytesUsed));
            }
        }
        if (freqProx != null && vectors != null) {
            freqProx.setNext(vectors);
        }
        this.head = freqProx != null ? freqProx : vectors;
        this.termVectors = vectors;
    }

    /**
     * 反转字段在一篇文档中的全部词项。过长或为空的词项交给 handler 并跳过。
     *
     * @return 被接受的词项数
     */
    int invert(IndexField field, int docId, SkippedTokenHandler handler) throws IOException {
        state.reset(docId);
        seenInSegment = true;
        for (PostingListConsumer consumer : consumers) {
            consumer.startDocument(state);
        }
        for (Token token : field.tokens()) {
            try {
                if (head != null) {
                    head.add(token, state);
                } else {
                    checkTermLength(token);
                }
            } catch (OversizedTermException | EmptyTermException exception) {
                handler.onSkipped(fieldName, token, exception);
                continue;
            }
            state.accept();
        }
        for (PostingListConsumer consumer : consumers) {
            consumer.finishDocument(state);
        }
        return state.length();
    }

    private void checkTermLength(Token token) {
        int length = token.term().length();
        if (length == 0) {
            throw new EmptyTermException();
        }
        if (length > maxTermLength) {
            throw new OversizedTermException(length, maxTermLength);
        }
    }

    /**
     * 段刷新：字段在本段出现过时才写出。
     */
    void flush(SegmentWriter writer, int numDocs) throws IOException {
        if (!seenInSegment) {
            return;
        }
        for (PostingListConsumer consumer : consumers) {
            consumer.flush(writer, numDocs);
        }
    }

    void reset() {
        for (PostingListConsumer consumer : consumers) {
            consumer.reset();
        }
        seenInSegment = false;
    }

    public String fieldName() {
        return fieldName;
    }

    public FieldOptions options() {
        return options;
    }

    public List<PostingListConsumer> consumers() {
        return List.copyOf(consumers);
    }

    /**
     * 词向量消费者，未开启时为 null。
     */
    TermVectorsConsumer termVectors() {
        return termVectors;
    }

    /**
     * 当前文档是否有待写出的词向量。
     */
    boolean hasPendingTermVectors() {
        return termVectors != null && termVectors.hasPendingTerms();
    }
}
