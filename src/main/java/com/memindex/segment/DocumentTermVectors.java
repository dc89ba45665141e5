package com.memindex.segment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一篇文档的全部词向量，按字段组织，字段内词项有序。
 */
public record DocumentTermVectors(int docId, Map<String, List<TermVectorEntry>> fields) {

    public DocumentTermVectors {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public List<TermVectorEntry> field(String name) {
        return fields.getOrDefault(name, List.of());
    }
}
