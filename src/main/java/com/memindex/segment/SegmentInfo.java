package com.memindex.segment;

import com.memindex.config.Constants;

/**
 * 段描述：段名、序号、全局文档起点与文档数。
 *
 * 段内文档号从 0 开始，{@code docBase + 段内文档号} 即该文档在整个会话中的提交序号。
 *
 * @param name 段名
 * @param ordinal 段序号，从 0 开始
 * @param docBase 段内第一篇文档的全局序号
 * @param docCount 段内文档数，段尚未完成时为 0
 */
public record SegmentInfo(String name, int ordinal, long docBase, int docCount) {

    public SegmentInfo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("段名不能为空");
        }
        if (ordinal < 0 || docBase < 0 || docCount < 0) {
            throw new IllegalArgumentException("段序号、文档起点与文档数不能为负数: ordinal=" + ordinal
                + ", docBase=" + docBase + ", docCount=" + docCount);
        }
    }

    /**
     * 创建一个尚未写入文档的段。
     */
    public static SegmentInfo open(int ordinal, long docBase) {
        return new SegmentInfo(Constants.SEGMENT_NAME_PREFIX + Integer.toString(ordinal, Character.MAX_RADIX),
            ordinal, docBase, 0);
    }

    public SegmentInfo withDocCount(int newDocCount) {
        return new SegmentInfo(name, ordinal, docBase, newDocCount);
    }
}
