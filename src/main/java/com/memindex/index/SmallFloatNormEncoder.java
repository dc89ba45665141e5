package com.memindex.index;

/**
 * 默认的归一化因子编码：4 位尾数的有损整数压缩。
 *
 * 小于 24 的长度原样保存，更大的长度只保留最高 4 个有效位，单调且可还原出近似值。
 */
public final class SmallFloatNormEncoder implements NormEncoder {

    private static final int MAX_INT4 = longToInt4(Integer.MAX_VALUE);
    private static final int NUM_FREE_VALUES = 255 - MAX_INT4;

    @Override
    public byte encode(int fieldLength) {
        if (fieldLength < 0) {
            throw new IllegalArgumentException("字段长度不能为负数: " + fieldLength);
        }
        if (fieldLength < NUM_FREE_VALUES) {
            return (byte) fieldLength;
        }
        return (byte) (NUM_FREE_VALUES + longToInt4(fieldLength - NUM_FREE_VALUES));
    }

    @Override
    public int decode(byte norm) {
        int value = Byte.toUnsignedInt(norm);
        if (value < NUM_FREE_VALUES) {
            return value;
        }
        return Math.toIntExact(NUM_FREE_VALUES + int4ToLong(value - NUM_FREE_VALUES));
    }

    private static int longToInt4(long value) {
        int numBits = 64 - Long.numberOfLeadingZeros(value);
        if (numBits < 4) {
            // 次正规值，原样保存
            return Math.toIntExact(value);
        }
        int shift = numBits - 4;
        // 只保留最高 4 位，最高位隐含
        int encoded = Math.toIntExact(value >>> shift) & 0x07;
        // 0 留给次正规值
        encoded |= (shift + 1) << 3;
        return encoded;
    }

    private static long int4ToLong(int value) {
        long bits = value & 0x07;
        int shift = (value >>> 3) - 1;
        if (shift == -1) {
            return bits;
        }
        return (bits | 0x08) << shift;
    }
}
