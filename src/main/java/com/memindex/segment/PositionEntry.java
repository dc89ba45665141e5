package com.memindex.segment;

/**
 * 一次出现的位置信息。未记录的项取 -1，没有载荷时 payload 为 null。
 */
public record PositionEntry(int position, int startOffset, int endOffset, byte[] payload) {
}
