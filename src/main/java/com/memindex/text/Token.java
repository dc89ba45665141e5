package com.memindex.text;

/**
 * 分析链产出的一个词项。
 *
 * @param term 词项文本
 * @param position 位置序号
 * @param startOffset 原文起始偏移
 * @param endOffset 原文结束偏移（不含）
 * @param payload 可选载荷，没有时为 null
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset,
    byte[] payload
) {
    public Token {
        if (term == null) {
            throw new IllegalArgumentException("词项文本不能为空");
        }
        if (payload != null && payload.length == 0) {
            payload = null;
        }
    }

    public Token(String term, int position, int startOffset, int endOffset) {
        this(term, position, startOffset, endOffset, null);
    }

    public boolean hasPayload() {
        return payload != null;
    }
}
