package com.memindex.segment;

import java.util.List;

/**
 * 一个词项刷新后的完整倒排列表。
 *
 * @param term 词项文本
 * @param docFreq 文档频率
 * @param totalTermFreq 总词频，不记录词频时为 -1
 * @param docs 按文档号严格递增的倒排项
 */
public record TermPostings(String term, int docFreq, long totalTermFreq, List<DocPosting> docs) {

    public TermPostings {
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("词项不能为空");
        }
        if (docs == null) {
            throw new IllegalArgumentException("倒排项列表不能为null");
        }
        docs = List.copyOf(docs);
        if (docFreq != docs.size()) {
            throw new IllegalArgumentException("docFreq与倒排项数量不一致: " + docFreq + " vs " + docs.size());
        }
        for (int index = 1; index < docs.size(); index++) {
            if (docs.get(index).docId() <= docs.get(index - 1).docId()) {
                throw new IllegalArgumentException("docId必须严格递增，位置=" + index + ", current=" + docs.get(index).docId());
            }
        }
    }

    /**
     * 返回倒排项数量。
     */
    public int size() {
        return docs.size();
    }

    /**
     * 获取指定位置的文档ID。
     */
    public int docId(int index) {
        return docs.get(index).docId();
    }

    /**
     * 获取指定位置的词频。
     */
    public int termFreq(int index) {
        return docs.get(index).freq();
    }

    public int[] docIds() {
        int[] docIds = new int[docs.size()];
        for (int index = 0; index < docIds.length; index++) {
            docIds[index] = docs.get(index).docId();
        }
        return docIds;
    }
}
