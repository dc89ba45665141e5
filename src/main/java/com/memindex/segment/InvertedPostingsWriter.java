package com.memindex.segment;

import com.memindex.config.IndexOptions;

import java.io.IOException;

/**
 * 倒排表输出。调用顺序：
 * {@code startField (startTerm (startDocument addPosition* finishDocument)+ finishTerm)* finishField}。
 * 同一字段内词项严格递增，同一词项内文档号严格递增。
 */
public interface InvertedPostingsWriter {

    void startField(String field, IndexOptions options) throws IOException;

    /**
     * @param totalTermFreq 总词频，字段不记录词频时为 -1
     */
    void startTerm(String term, int docFreq, long totalTermFreq) throws IOException;

    /**
     * @param freq 文档内词频，字段不记录词频时为 -1
     */
    void startDocument(int docId, int freq) throws IOException;

    /**
     * 只在字段记录位置时调用，每篇文档调用 freq 次。
     *
     * @param payload 载荷，没有时为 null
     * @param startOffset 起始偏移，不记录偏移时为 -1
     * @param endOffset 结束偏移，不记录偏移时为 -1
     */
    void addPosition(int position, byte[] payload, int startOffset, int endOffset) throws IOException;

    void finishDocument() throws IOException;

    void finishTerm() throws IOException;

    void finishField(FieldStats stats) throws IOException;
}
