package com.memindex.segment;

import java.util.List;

/**
 * 单文档词向量中的一个词项。
 */
public record TermVectorEntry(String term, int freq, List<PositionEntry> positions) {

    public TermVectorEntry {
        if (freq <= 0) {
            throw new IllegalArgumentException("词向量词频必须为正数: " + freq);
        }
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
