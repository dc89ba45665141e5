package com.memindex.config;

/**
 * 倒排索引记录的信息粒度，后一级包含前一级的全部信息。
 */
public enum IndexOptions {
    /** 不建倒排 */
    NONE,
    DOCS,
    DOCS_AND_FREQS,
    DOCS_AND_FREQS_AND_POSITIONS,
    DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS;

    public boolean isIndexed() {
        return this != NONE;
    }

    public boolean hasFreqs() {
        return compareTo(DOCS_AND_FREQS) >= 0;
    }

    public boolean hasPositions() {
        return compareTo(DOCS_AND_FREQS_AND_POSITIONS) >= 0;
    }

    public boolean hasOffsets() {
        return this == DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS;
    }
}
