package com.memindex.segment;

import java.io.IOException;

/**
 * 为每个新段创建输出端。
 */
@FunctionalInterface
public interface SegmentWriterFactory {

    SegmentWriter open(SegmentInfo info) throws IOException;
}
