package com.memindex.pool;

import com.memindex.error.CorruptedSessionStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 字节切片写入与读取测试
 */
class ByteSliceTest {

    private static int writeAll(ByteBlockPool pool, int address, byte[] data) {
        for (byte value : data) {
            address = pool.writeByte(address, value);
        }
        return address;
    }

    private static byte[] randomBytes(int length, long seed) {
        byte[] data = new byte[length];
        new Random(seed).nextBytes(data);
        // 0 与标记字节无关，但写一些固定值便于排查
        data[0] = 1;
        return data;
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4, 5, 18, 100, 1000, 5000})
    @DisplayName("单条流沿切片链写入后可原样读出")
    void testSingleStream(int length) {
        ByteBlockPool pool = new ByteBlockPool(8, 1000, new BytesUsedCounter());
        byte[] data = randomBytes(length, length);
        int start = pool.newSlice(ByteBlockPool.FIRST_LEVEL_SIZE);
        int end = writeAll(pool, start, data);

        ByteSliceReader reader = new ByteSliceReader();
        reader.init(pool, start, end);
        byte[] read = new byte[length];
        for (int i = 0; i < length; i++) {
            assertFalse(reader.eof());
            read[i] = reader.readByte();
        }
        assertTrue(reader.eof());
        assertArrayEquals(data, read);
    }

    @Test
    @DisplayName("多条交错写入的流互不干扰")
    void testInterleavedStreams() {
        ByteBlockPool pool = new ByteBlockPool(8, 1000, new BytesUsedCounter());
        int streams = 3;
        int first = pool.newSlices(streams);
        int[] starts = new int[streams];
        int[] addresses = new int[streams];
        for (int stream = 0; stream < streams; stream++) {
            starts[stream] = first + stream * ByteBlockPool.FIRST_LEVEL_SIZE;
            addresses[stream] = starts[stream];
        }
        int rounds = 700;
        for (int round = 0; round < rounds; round++) {
            for (int stream = 0; stream < streams; stream++) {
                addresses[stream] = pool.writeByte(addresses[stream], (byte) (round * (stream + 1)));
            }
        }

        ByteSliceReader reader = new ByteSliceReader();
        for (int stream = 0; stream < streams; stream++) {
            reader.init(pool, starts[stream], addresses[stream]);
            byte[] read = new byte[rounds];
            reader.readBytes(read, 0, rounds);
            for (int round = 0; round < rounds; round++) {
                assertEquals((byte) (round * (stream + 1)), read[round], "stream=" + stream + ", round=" + round);
            }
            assertTrue(reader.eof());
        }
    }

    @Test
    @DisplayName("VarInt写入切片后可逐个解码")
    void testVarIntThroughSlices() {
        ByteBlockPool pool = new ByteBlockPool(8, 1000, new BytesUsedCounter());
        int start = pool.newSlice(ByteBlockPool.FIRST_LEVEL_SIZE);
        int[] address = {start};
        int[] values = {0, 1, 127, 128, 16383, 16384, 1 << 21, Integer.MAX_VALUE};
        for (int repeat = 0; repeat < 50; repeat++) {
            for (int value : values) {
                VarIntCodec.writeVarInt(value, b -> address[0] = pool.writeByte(address[0], b));
            }
        }

        ByteSliceReader reader = new ByteSliceReader();
        reader.init(pool, start, address[0]);
        for (int repeat = 0; repeat < 50; repeat++) {
            for (int value : values) {
                assertEquals(value, VarIntCodec.readVarInt(reader));
            }
        }
        assertTrue(reader.eof());
    }

    @Test
    @DisplayName("读过结束地址视为会话状态损坏")
    void testReadPastEnd() {
        ByteBlockPool pool = new ByteBlockPool(8, 10, new BytesUsedCounter());
        int start = pool.newSlice(ByteBlockPool.FIRST_LEVEL_SIZE);
        int end = pool.writeByte(start, (byte) 7);

        ByteSliceReader reader = new ByteSliceReader();
        reader.init(pool, start, end);
        assertEquals(7, reader.readByte());
        assertThrows(CorruptedSessionStateException.class, reader::readByte);
    }

    @Test
    @DisplayName("非法或越界的切片地址视为会话状态损坏")
    void testInvalidSliceAddress() {
        ByteBlockPool pool = new ByteBlockPool(8, 10, new BytesUsedCounter());
        int start = pool.newSlice(ByteBlockPool.FIRST_LEVEL_SIZE);
        ByteSliceReader reader = new ByteSliceReader();

        assertThrows(CorruptedSessionStateException.class, () -> reader.init(pool, -1, start));
        assertThrows(CorruptedSessionStateException.class, () -> reader.init(pool, start + 3, start));
        assertThrows(CorruptedSessionStateException.class, () -> reader.init(pool, start, 10_000));
    }

    @Test
    @DisplayName("跨块读取原始字节")
    void testReadBytesAcrossBlocks() {
        ByteBlockPool pool = new ByteBlockPool(8, 10, new BytesUsedCounter());
        int first = pool.allocate(250);
        int second = pool.allocate(100);
        assertEquals(256, second, "第二次分配放不下应从新块开始");
        pool.writeByte(first + 249, (byte) 9);
        assertEquals(9, pool.readByte(first + 249));

        byte[] target = new byte[20];
        pool.readBytes(240, target, 0, 20);
        assertEquals(9, target[9]);
        assertEquals(0, target[19]);
    }
}
