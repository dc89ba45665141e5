package com.memindex.segment;

import java.io.IOException;

/**
 * 归一化因子输出，每个字段一次，数组下标为段内文档号。
 */
public interface NormsWriter {

    void addNorms(String field, byte[] norms) throws IOException;
}
