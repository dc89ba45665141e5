package com.memindex.segment;

import java.io.IOException;

/**
 * 一个段的输出端。会话在段的第一篇文档时打开它，刷新结束时调用 {@link #finish(int)}，
 * 出错时调用 {@link #abort()}。
 */
public interface SegmentWriter {

    SegmentInfo info();

    InvertedPostingsWriter postings();

    TermVectorsWriter termVectors();

    NormsWriter norms();

    /**
     * 段内所有数据已写完。
     *
     * @param numDocs 段内文档数
     */
    void finish(int numDocs) throws IOException;

    /**
     * 丢弃尚未完成的输出。
     */
    void abort();
}
