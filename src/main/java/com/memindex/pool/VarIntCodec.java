package com.memindex.pool;

/**
 * VarInt变长整数编解码器
 *
 * 编码规则：每字节7位有效数据，最高位为续接标志
 * - 最高位为1：表示后续还有字节
 * - 最高位为0：表示这是最后一个字节
 *
 * 倒排流中的文档增量、位置增量都是小整数，用VarInt写入字节切片可大幅节省块池空间。
 */
public final class VarIntCodec {

    /**
     * 字节写入目标，一般是某个词项的某条切片流。
     */
    @FunctionalInterface
    public interface ByteSink {
        void writeByte(byte value);
    }

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将int值编码为VarInt并写入目标
     *
     * @param value 要编码的值（必须非负）
     * @param sink 写入目标
     * @throws IllegalArgumentException 如果value为负数
     */
    public static void writeVarInt(int value, ByteSink sink) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        while ((value & ~0x7F) != 0) {
            sink.writeByte((byte) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        sink.writeByte((byte) value);
    }

    /**
     * 从切片读取器读取VarInt并解码为int
     *
     * @param reader 切片读取器
     * @return 解码后的值
     * @throws IllegalStateException 如果VarInt超过32位范围
     */
    public static int readVarInt(ByteSliceReader reader) {
        int result = 0;
        int shift = 0;
        while (shift < 32) {
            int b = reader.readByte() & 0xFF;
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new IllegalStateException("VarInt超过32位范围");
    }

    /**
     * 计算int值编码为VarInt所需的字节数
     *
     * @param value 要编码的值（必须非负）
     * @return 所需字节数
     * @throws IllegalArgumentException 如果value为负数
     */
    public static int varIntSize(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        int size = 1;
        while ((value & ~0x7F) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }
}
