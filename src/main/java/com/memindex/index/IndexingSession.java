package com.memindex.index;

import com.memindex.config.Constants;
import com.memindex.config.FieldOptions;
import com.memindex.config.IndexingConfig;
import com.memindex.document.IndexDocument;
import com.memindex.document.IndexField;
import com.memindex.error.CorruptedSessionStateException;
import com.memindex.error.IndexingException;
import com.memindex.error.ResourceExhaustedException;
import com.memindex.pool.BytesUsedCounter;
import com.memindex.segment.SegmentInfo;
import com.memindex.segment.SegmentWriter;
import com.memindex.segment.SegmentWriterFactory;
import com.memindex.segment.TermVectorsWriter;
import com.memindex.text.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 索引会话：按提交顺序把文档送入各字段的消费者链，并在文档边界上刷新段。
 *
 * 一个会话只能由一个线程使用。段内文档号从 0 开始，{@link SegmentInfo#docBase()} 把它映射回提交序号。
 * 内存超预算或缓冲文档数达到上限时，在当前文档完成后同步刷新，因此段边界总是落在文档之间。
 * 开始一篇文档之前若块池剩余的块不足以容纳它，先刷新当前段。
 * 刷新后的空块池仍放不下单篇文档、或刷新时输出端失败，会话进入 {@link SessionState#CORRUPTED}，
 * 之后的所有调用都抛出 {@link CorruptedSessionStateException}。
 */
public class IndexingSession implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(IndexingSession.class);

    private final IndexingConfig config;
    private final SegmentWriterFactory writerFactory;
    private final FlushPolicy flushPolicy;
    private final NormEncoder normEncoder;
    private final IndexingListener listener;
    private final BytesUsedCounter bytesUsed = new BytesUsedCounter();
    private final SessionPools pools;
    private final Map<String, FieldIndexer> fields = new LinkedHashMap<>();
    private final IndexingStats stats = new IndexingStats();

    private SessionState state = SessionState.IDLE;
    private CorruptedSessionStateException corruption;
    private SegmentInfo currentSegment;
    private SegmentWriter segmentWriter;
    private int bufferedDocs;
    private long nextDocNumber;
    private int segmentCount;

    public IndexingSession(IndexingConfig config, SegmentWriterFactory writerFactory) {
        this(config, writerFactory, IndexingListener.NO_OP);
    }

    public IndexingSession(IndexingConfig config, SegmentWriterFactory writerFactory, IndexingListener listener) {
        this(config, writerFactory, null, new SmallFloatNormEncoder(), listener);
    }

    /**
     * @param flushPolicy 刷新策略，为 null 时按配置的内存预算与文档数上限
     */
    public IndexingSession(IndexingConfig config, SegmentWriterFactory writerFactory, FlushPolicy flushPolicy,
                           NormEncoder normEncoder, IndexingListener listener) {
        if (config == null) {
            throw new IllegalArgumentException("索引配置不能为空");
        }
        if (writerFactory == null) {
            throw new IllegalArgumentException("段输出工厂不能为空");
        }
        if (normEncoder == null) {
            throw new IllegalArgumentException("归一化编码器不能为空");
        }
        config.validate();
        this.config = config.copy();
        this.writerFactory = writerFactory;
        this.flushPolicy = flushPolicy != null ? flushPolicy : FlushPolicy.fromConfig(this.config);
        this.normEncoder = normEncoder;
        this.listener = listener != null ? listener : IndexingListener.NO_OP;
        this.pools = new SessionPools(this.config, bytesUsed);
        logger.debug("索引会话已创建: 启用消费者 {}, 内存预算 {} 字节, 文档数上限 {}",
            this.config.getConsumers(), this.config.getRamBudgetBytes(), this.config.getMaxBufferedDocs());
    }

    /**
     * 索引一篇文档。
     *
     * @return 文档在整个会话中的提交序号
     * @throws IllegalArgumentException 文档不合法，会话不受影响
     * @throws IllegalStateException 会话正在刷新或已关闭
     * @throws CorruptedSessionStateException 会话已损坏，或本次索引中途失败
     */
    public long addDocument(IndexDocument document) {
        ensureUsable();
        validate(document);
        if (bufferedDocs > 0 && !pools.hasHeadroomFor(document)) {
            forceFlush(FlushReason.POOL_CAPACITY, "块池剩余容量不足以容纳下一篇文档，先刷新当前段");
        }

        int docId = bufferedDocs;
        try {
            if (segmentWriter == null) {
                openSegment();
            }
            state = SessionState.ACCUMULATING;
            int acceptedTokens = 0;
            for (IndexField field : document.fields()) {
                acceptedTokens += fieldIndexer(field.name()).invert(field, docId, this::onTokenSkipped);
            }
            writeTermVectors(document, docId);
            bufferedDocs++;
            stats.documentAdded(acceptedTokens);
            stats.observeRam(bytesUsed.get());
        } catch (IOException | RuntimeException exception) {
            throw corrupt("索引文档失败，段内文档号 " + docId, exception);
        }
        long docNumber = nextDocNumber++;
        maybeFlush();
        return docNumber;
    }

    /**
     * 显式刷新当前段。
     *
     * @return 新段的描述，没有缓冲文档时为空
     */
    public Optional<SegmentInfo> flush() {
        ensureUsable();
        if (bufferedDocs == 0) {
            return Optional.empty();
        }
        return Optional.of(doFlush(FlushReason.EXPLICIT));
    }

    /**
     * 刷新剩余文档并关闭会话。已损坏的会话只释放块池。
     */
    @Override
    public void close() {
        if (state == SessionState.CLOSED) {
            return;
        }
        if (state == SessionState.FLUSHING) {
            throw new IllegalStateException("会话正在刷新，不能关闭");
        }
        if (state != SessionState.CORRUPTED && bufferedDocs > 0) {
            doFlush(FlushReason.CLOSE);
        }
        pools.release();
        if (state == SessionState.CORRUPTED) {
            logger.warn("已损坏的会话被关闭，未刷新的 {} 篇文档被丢弃", bufferedDocs);
            return;
        }
        state = SessionState.CLOSED;
        logger.info("索引会话已关闭: 共 {} 篇文档, {} 个段", stats.getDocumentsAdded(), segmentCount);
    }

    public SessionState state() {
        return state;
    }

    public IndexingStats stats() {
        return stats.snapshot();
    }

    public long ramBytesUsed() {
        return bytesUsed.get();
    }

    public int bufferedDocCount() {
        return bufferedDocs;
    }

    /**
     * 已刷新的段数。
     */
    public int segmentCount() {
        return segmentCount;
    }

    /**
     * 已见过的字段名，按首次出现顺序。
     */
    public List<String> fieldNames() {
        return List.copyOf(fields.keySet());
    }

    private void validate(IndexDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("文档不能为空");
        }
        Set<String> names = new HashSet<>();
        for (IndexField field : document.fields()) {
            if (field == null) {
                throw new IllegalArgumentException("字段不能为空");
            }
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("字段名在同一文档内重复: " + field.name());
            }
            FieldOptions options = config.optionsFor(field.name());
            boolean offsetsIndexed = options.getIndexOptions().hasOffsets() || options.isTermVectorOffsets();
            int lastPosition = 0;
            int lastStartOffset = 0;
            for (Token token : field.tokens()) {
                if (token == null) {
                    throw new IllegalArgumentException("字段 " + field.name() + " 中存在空词项");
                }
                if (token.position() < 0 || token.position() > Constants.MAX_POSITION) {
                    throw new IllegalArgumentException("字段 " + field.name() + " 的位置越界: " + token.position());
                }
                if (token.position() < lastPosition) {
                    throw new IllegalArgumentException("字段 " + field.name() + " 的位置必须非递减: "
                        + lastPosition + " -> " + token.position());
                }
                if (token.startOffset() < 0 || token.endOffset() < token.startOffset()) {
                    throw new IllegalArgumentException("字段 " + field.name() + " 的偏移非法: ["
                        + token.startOffset() + ", " + token.endOffset() + ")");
                }
                if (offsetsIndexed && token.startOffset() < lastStartOffset) {
                    throw new IllegalArgumentException("字段 " + field.name() + " 的起始偏移必须非递减: "
                        + lastStartOffset + " -> " + token.startOffset());
                }
                lastPosition = token.position();
                lastStartOffset = token.startOffset();
            }
        }
    }

    private FieldIndexer fieldIndexer(String fieldName) {
        FieldIndexer indexer = fields.get(fieldName);
        if (indexer == null) {
            indexer = new FieldIndexer(fieldName, config, pools, normEncoder, bytesUsed);
            fields.put(fieldName, indexer);
            logger.debug("新字段 {}: 消费者 {}", fieldName, indexer.consumers().size());
        }
        return indexer;
    }

    private void openSegment() throws IOException {
        currentSegment = SegmentInfo.open(segmentCount, nextDocNumber);
        segmentWriter = writerFactory.open(currentSegment);
        logger.debug("打开段 {}，docBase={}", currentSegment.name(), currentSegment.docBase());
    }

    private void writeTermVectors(IndexDocument document, int docId) throws IOException {
        List<TermVectorsConsumer> pending = new ArrayList<>();
        for (IndexField field : document.fields()) {
            FieldIndexer indexer = fields.get(field.name());
            if (indexer.hasPendingTermVectors()) {
                pending.add(indexer.termVectors());
            }
        }
        if (!pending.isEmpty()) {
            TermVectorsWriter out = segmentWriter.termVectors();
            out.startDocument(docId, pending.size());
            for (TermVectorsConsumer vectors : pending) {
                vectors.writeDocument(out);
            }
            out.finishDocument();
        }
        pools.resetTermVectors();
    }

    private void onTokenSkipped(String field, Token token, IndexingException error) {
        stats.tokenSkipped(error.getKind());
        logger.warn("字段 {} 跳过词项 (位置 {}): {}", field, token.position(), error.getMessage());
        listener.onTokenSkipped(field, token, error);
    }

    private void maybeFlush() {
        Optional<FlushReason> reason = flushPolicy.check(bytesUsed.get(), bufferedDocs);
        if (reason.isEmpty()) {
            return;
        }
        if (reason.get() == FlushReason.RAM_BUDGET) {
            forceFlush(FlushReason.RAM_BUDGET,
                "内存占用 " + bytesUsed.get() + " 字节超过预算 " + flushPolicy.ramBudgetBytes() + " 字节，强制刷新");
        } else {
            logger.debug("缓冲文档数达到 {}，刷新", bufferedDocs);
            doFlush(reason.get());
        }
    }

    /**
     * 资源耗尽时的强制刷新：条件以警告上报，不中断索引。
     */
    private void forceFlush(FlushReason reason, String message) {
        ResourceExhaustedException condition = new ResourceExhaustedException(message, bytesUsed.get());
        logger.warn(condition.getMessage());
        listener.onResourceExhausted(condition);
        doFlush(reason);
    }

    private SegmentInfo doFlush(FlushReason reason) {
        state = SessionState.FLUSHING;
        long ramBefore = bytesUsed.get();
        int numDocs = bufferedDocs;
        try {
            for (FieldIndexer indexer : fields.values()) {
                indexer.flush(segmentWriter, numDocs);
            }
            segmentWriter.finish(numDocs);
        } catch (IOException | RuntimeException exception) {
            throw corrupt("刷新段 " + currentSegment.name() + " 失败", exception);
        }
        SegmentInfo flushed = currentSegment.withDocCount(numDocs);

        for (FieldIndexer indexer : fields.values()) {
            indexer.reset();
        }
        pools.resetAfterFlush();
        segmentWriter = null;
        currentSegment = null;
        bufferedDocs = 0;
        segmentCount++;
        stats.segmentFlushed(reason);
        state = SessionState.IDLE;

        logger.info("段 {} 已刷新: {} 篇文档, 原因 {}, 内存 {} -> {} 字节",
            flushed.name(), numDocs, reason, ramBefore, bytesUsed.get());
        listener.onFlush(flushed, reason);
        return flushed;
    }

    private CorruptedSessionStateException corrupt(String message, Exception cause) {
        state = SessionState.CORRUPTED;
        if (segmentWriter != null) {
            segmentWriter.abort();
        }
        CorruptedSessionStateException error = cause instanceof CorruptedSessionStateException
            ? (CorruptedSessionStateException) cause
            : new CorruptedSessionStateException(message + ": " + cause.getMessage(), cause);
        corruption = error;
        logger.error("会话已损坏: {}", message, cause);
        listener.onCorrupted(error);
        return error;
    }

    private void ensureUsable() {
        switch (state) {
            case CORRUPTED -> throw new CorruptedSessionStateException("会话已损坏，必须丢弃后重建", corruption);
            case CLOSED -> throw new IllegalStateException("会话已关闭");
            case FLUSHING -> throw new IllegalStateException("会话正在刷新，不接受新的请求");
            default -> {
            }
        }
    }
}
