package com.memindex.segment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存中收集到的一个完整段。
 *
 * @param info 段描述
 * @param postings 字段 -> 按词项递增的倒排列表
 * @param fieldStats 字段 -> 倒排统计
 * @param termVectors 按文档号递增的词向量
 * @param norms 字段 -> 每篇文档一个字节的归一化因子
 * @param flushedAt 段完成时间
 */
public record FlushedSegment(
    SegmentInfo info,
    Map<String, List<TermPostings>> postings,
    Map<String, FieldStats> fieldStats,
    List<DocumentTermVectors> termVectors,
    Map<String, byte[]> norms,
    Instant flushedAt
) {
    public FlushedSegment {
        postings = Collections.unmodifiableMap(new LinkedHashMap<>(postings));
        fieldStats = Collections.unmodifiableMap(new LinkedHashMap<>(fieldStats));
        termVectors = List.copyOf(termVectors);
        norms = Collections.unmodifiableMap(new LinkedHashMap<>(norms));
    }

    /**
     * 字段内的词项，按刷新顺序。
     */
    public List<String> terms(String field) {
        List<String> terms = new ArrayList<>();
        for (TermPostings termPostings : postings.getOrDefault(field, List.of())) {
            terms.add(termPostings.term());
        }
        return terms;
    }

    /**
     * 查找词项的倒排列表，不存在时返回 null。
     */
    public TermPostings postings(String field, String term) {
        for (TermPostings termPostings : postings.getOrDefault(field, List.of())) {
            if (termPostings.term().equals(term)) {
                return termPostings;
            }
        }
        return null;
    }

    /**
     * 查找文档的词向量，文档没有词向量时返回 null。
     */
    public DocumentTermVectors termVectors(int docId) {
        for (DocumentTermVectors vectors : termVectors) {
            if (vectors.docId() == docId) {
                return vectors;
            }
        }
        return null;
    }

    public int termCount() {
        int count = 0;
        for (List<TermPostings> terms : postings.values()) {
            count += terms.size();
        }
        return count;
    }
}
