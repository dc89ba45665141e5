package com.memindex.index;

import com.memindex.config.Constants;
import com.memindex.config.IndexingConfig;

import java.util.Optional;

/**
 * 刷新策略，在每篇文档完成后由会话查询。
 */
public interface FlushPolicy {

    /**
     * @param ramBytesUsed 会话当前内存占用
     * @param bufferedDocs 当前段已缓冲的文档数
     * @return 需要刷新时返回原因
     */
    Optional<FlushReason> check(long ramBytesUsed, int bufferedDocs);

    /**
     * 内存预算，-1 表示不按内存刷新。
     */
    long ramBudgetBytes();

    static FlushPolicy fromConfig(IndexingConfig config) {
        return new RamOrDocCount(config.getRamBudgetBytes(), config.getMaxBufferedDocs());
    }

    /**
     * 内存超过预算或缓冲文档数达到上限时刷新，任一项为 -1 表示关闭该条件。
     */
    record RamOrDocCount(long ramBudgetBytes, int maxBufferedDocs) implements FlushPolicy {

        public RamOrDocCount {
            if (ramBudgetBytes != Constants.DISABLE_AUTO_FLUSH && ramBudgetBytes <= 0) {
                throw new IllegalArgumentException("内存预算必须为正数或 -1: " + ramBudgetBytes);
            }
            if (maxBufferedDocs != Constants.DISABLE_AUTO_FLUSH && maxBufferedDocs <= 0) {
                throw new IllegalArgumentException("缓冲文档数上限必须为正数或 -1: " + maxBufferedDocs);
            }
        }

        @Override
        public Optional<FlushReason> check(long ramBytesUsed, int bufferedDocs) {
            if (maxBufferedDocs != Constants.DISABLE_AUTO_FLUSH && bufferedDocs >= maxBufferedDocs) {
                return Optional.of(FlushReason.DOC_COUNT);
            }
            if (ramBudgetBytes != Constants.DISABLE_AUTO_FLUSH && ramBytesUsed >= ramBudgetBytes) {
                return Optional.of(FlushReason.RAM_BUDGET);
            }
            return Optional.empty();
        }
    }
}
