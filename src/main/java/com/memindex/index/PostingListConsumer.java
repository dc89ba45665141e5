package com.memindex.index;

import com.memindex.config.ConsumerKind;
import com.memindex.segment.SegmentWriter;

import java.io.IOException;

/**
 * 字段级的倒排消费者。每个字段为每种启用的消费者各持有一个实例。
 */
public interface PostingListConsumer {

    ConsumerKind kind();

    String fieldName();

    /**
     * 字段在新文档中首次出现。
     */
    void startDocument(FieldInvertState state);

    /**
     * 字段在当前文档中的词项已全部送达。
     */
    void finishDocument(FieldInvertState state) throws IOException;

    /**
     * 把本段累积的数据按词项顺序写出。
     *
     * @param writer 段输出端
     * @param numDocs 段内文档数
     */
    void flush(SegmentWriter writer, int numDocs) throws IOException;

    /**
     * 刷新之后清空内部状态，准备下一段。块池由会话统一重置。
     */
    void reset();
}
