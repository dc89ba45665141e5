package com.memindex.index;

/**
 * 把字段长度压缩成一个字节的归一化因子。
 */
public interface NormEncoder {

    byte encode(int fieldLength);

    /**
     * 还原出的近似长度。
     */
    int decode(byte norm);
}
