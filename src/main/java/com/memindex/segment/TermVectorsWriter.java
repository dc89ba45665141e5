package com.memindex.segment;

import java.io.IOException;

/**
 * 词向量输出，逐文档写入。调用顺序：
 * {@code startDocument (startField (startTerm addPosition* finishTerm)* finishField)* finishDocument}。
 */
public interface TermVectorsWriter {

    void startDocument(int docId, int numFields) throws IOException;

    void startField(String field, int numTerms, boolean positions, boolean offsets, boolean payloads)
        throws IOException;

    void startTerm(String term, int freq) throws IOException;

    /**
     * 字段记录位置或偏移时，每个词项调用 freq 次。未记录的项为 -1，没有载荷时 payload 为 null。
     */
    void addPosition(int position, int startOffset, int endOffset, byte[] payload) throws IOException;

    void finishTerm() throws IOException;

    void finishField() throws IOException;

    void finishDocument() throws IOException;
}
