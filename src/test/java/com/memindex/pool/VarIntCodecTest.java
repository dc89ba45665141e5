package com.memindex.pool;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * VarInt编码单元测试
 */
class VarIntCodecTest {

    private static byte[] encode(int value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        VarIntCodec.writeVarInt(value, out::write);
        return out.toByteArray();
    }

    @ParameterizedTest
    @CsvSource({
        "0, 1",
        "127, 1",
        "128, 2",
        "16383, 2",
        "16384, 3",
        "2097151, 3",
        "2097152, 4",
        "268435455, 4",
        "268435456, 5",
        "2147483647, 5"
    })
    @DisplayName("VarInt大小计算测试")
    void testVarIntSize(int value, int expectedSize) {
        assertEquals(expectedSize, VarIntCodec.varIntSize(value));
        assertEquals(expectedSize, encode(value).length);
    }

    @Test
    @DisplayName("VarInt低位在前，续接位在最高位")
    void testVarIntByteLayout() {
        assertArrayEquals(new byte[]{0x00}, encode(0));
        assertArrayEquals(new byte[]{0x7F}, encode(127));
        assertArrayEquals(new byte[]{(byte) 0x80, 0x01}, encode(128));
        assertArrayEquals(new byte[]{(byte) 0xAC, 0x02}, encode(300));
    }

    @Test
    @DisplayName("VarInt负数应该抛出异常")
    void testVarIntNegativeValue() {
        assertThrows(IllegalArgumentException.class, () -> VarIntCodec.writeVarInt(-1, value -> { }));
        assertThrows(IllegalArgumentException.class, () -> VarIntCodec.varIntSize(-5));
    }

    @Test
    @DisplayName("超过32位的VarInt应该抛出异常")
    void testVarIntOverflow() {
        ByteBlockPool pool = new ByteBlockPool(8, 10, new BytesUsedCounter());
        int start = pool.newSlice(ByteBlockPool.FIRST_LEVEL_SIZE);
        int address = start;
        for (int i = 0; i < 6; i++) {
            address = pool.writeByte(address, (byte) 0xFF);
        }
        ByteSliceReader reader = new ByteSliceReader();
        reader.init(pool, start, address);
        assertThrows(IllegalStateException.class, () -> VarIntCodec.readVarInt(reader));
    }
}
