package com.memindex.index;

import com.memindex.error.CorruptedSessionStateException;
import com.memindex.error.IndexingException;
import com.memindex.error.ResourceExhaustedException;
import com.memindex.segment.SegmentInfo;
import com.memindex.text.Token;

/**
 * 会话事件回调。可恢复的错误只通过这里与统计计数对外可见。
 */
public interface IndexingListener {

    IndexingListener NO_OP = new IndexingListener() {
    };

    /**
     * 词项被跳过（过长或为空），同一文档的其余词项照常索引。
     */
    default void onTokenSkipped(String field, Token token, IndexingException error) {
    }

    /**
     * 内存占用超过预算，随后会强制刷新。
     */
    default void onResourceExhausted(ResourceExhaustedException condition) {
    }

    default void onFlush(SegmentInfo segment, FlushReason reason) {
    }

    /**
     * 会话进入损坏状态。
     */
    default void onCorrupted(CorruptedSessionStateException error) {
    }
}
