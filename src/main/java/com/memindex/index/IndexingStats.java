package com.memindex.index;

import com.memindex.error.ErrorKind;

/**
 * 会话运行统计。会话对外只返回快照。
 */
public final class IndexingStats {
    private long documentsAdded;
    private long tokensIndexed;
    private long oversizedTermsSkipped;
    private long emptyTermsSkipped;
    private long resourceExhaustedFlushes;
    private long docCountFlushes;
    private long explicitFlushes;
    private long segmentsFlushed;
    private long peakRamBytes;

    void documentAdded(int tokens) {
        documentsAdded++;
        tokensIndexed += tokens;
    }

    void tokenSkipped(ErrorKind kind) {
        if (kind == ErrorKind.OVERSIZED_TERM) {
            oversizedTermsSkipped++;
        } else if (kind == ErrorKind.EMPTY_TERM) {
            emptyTermsSkipped++;
        }
    }

    void segmentFlushed(FlushReason reason) {
        segmentsFlushed++;
        switch (reason) {
            case RAM_BUDGET, POOL_CAPACITY -> resourceExhaustedFlushes++;
            case DOC_COUNT -> docCountFlushes++;
            case EXPLICIT -> explicitFlushes++;
            default -> {
            }
        }
    }

    void observeRam(long ramBytes) {
        peakRamBytes = Math.max(peakRamBytes, ramBytes);
    }

    IndexingStats snapshot() {
        IndexingStats copy = new IndexingStats();
        copy.documentsAdded = documentsAdded;
        copy.tokensIndexed = tokensIndexed;
        copy.oversizedTermsSkipped = oversizedTermsSkipped;
        copy.emptyTermsSkipped = emptyTermsSkipped;
        copy.resourceExhaustedFlushes = resourceExhaustedFlushes;
        copy.docCountFlushes = docCountFlushes;
        copy.explicitFlushes = explicitFlushes;
        copy.segmentsFlushed = segmentsFlushed;
        copy.peakRamBytes = peakRamBytes;
        return copy;
    }

    public long getDocumentsAdded() {
        return documentsAdded;
    }

    /**
     * 被接受的词项数，不含被跳过的词项。
     */
    public long getTokensIndexed() {
        return tokensIndexed;
    }

    public long getOversizedTermsSkipped() {
        return oversizedTermsSkipped;
    }

    public long getEmptyTermsSkipped() {
        return emptyTermsSkipped;
    }

    public long getSkippedTokens() {
        return oversizedTermsSkipped + emptyTermsSkipped;
    }

    /**
     * 因内存超预算或块池容量不足而强制刷新的次数。
     */
    public long getResourceExhaustedFlushes() {
        return resourceExhaustedFlushes;
    }

    public long getDocCountFlushes() {
        return docCountFlushes;
    }

    public long getExplicitFlushes() {
        return explicitFlushes;
    }

    public long getSegmentsFlushed() {
        return segmentsFlushed;
    }

    public long getPeakRamBytes() {
        return peakRamBytes;
    }
}
