package com.memindex.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class IndexingConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        IndexingConfig config = IndexingConfig.defaults();

        assertEquals(Constants.DEFAULT_BYTE_BLOCK_SHIFT, config.getByteBlockShift());
        assertEquals(Constants.DEFAULT_INT_BLOCK_SHIFT, config.getIntBlockShift());
        assertEquals(Constants.DEFAULT_CHAR_BLOCK_SHIFT, config.getCharBlockShift());
        assertEquals(Constants.DEFAULT_MAX_SLABS_PER_POOL, config.getMaxSlabsPerPool());
        assertEquals(Constants.DEFAULT_RAM_BUDGET_BYTES, config.getRamBudgetBytes());
        assertEquals(Constants.DEFAULT_MAX_BUFFERED_DOCS, config.getMaxBufferedDocs());
        assertEquals(Constants.DEFAULT_MAX_TERM_LENGTH, config.getMaxTermLength());
        assertEquals(EnumSet.allOf(ConsumerKind.class), config.getConsumers());
        assertEquals(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS, config.optionsFor("body").getIndexOptions());
        assertTrue(config.optionsFor("body").isNorms());
        assertFalse(config.optionsFor("body").isTermVectors());

        config.validate();
    }

    @Test
    void testSetters() {
        IndexingConfig config = new IndexingConfig();
        config.setByteBlockShift(10);
        config.setIntBlockShift(6);
        config.setCharBlockShift(9);
        config.setMaxSlabsPerPool(32);
        config.setRamBudgetBytes(Constants.DISABLE_AUTO_FLUSH);
        config.setMaxBufferedDocs(100);
        config.setMaxTermLength(40);
        config.setHashInitialCapacity(4);
        config.setHashLoadFactor(0.5f);
        config.setHashGrowthFactor(4);
        config.setConsumers(Set.of(ConsumerKind.FREQ_PROX));
        config.getFieldOptions().put("title", FieldOptions.withTermVectors());

        assertEquals(10, config.getByteBlockShift());
        assertEquals(6, config.getIntBlockShift());
        assertEquals(9, config.getCharBlockShift());
        assertEquals(32, config.getMaxSlabsPerPool());
        assertEquals(-1, config.getRamBudgetBytes());
        assertEquals(100, config.getMaxBufferedDocs());
        assertEquals(40, config.getMaxTermLength());
        assertEquals(4, config.getHashInitialCapacity());
        assertEquals(0.5f, config.getHashLoadFactor());
        assertEquals(4, config.getHashGrowthFactor());
        assertTrue(config.isEnabled(ConsumerKind.FREQ_PROX));
        assertFalse(config.isEnabled(ConsumerKind.NORMS));
        assertTrue(config.optionsFor("title").isTermVectors());
        assertFalse(config.optionsFor("body").isTermVectors());

        config.validate();
    }

    static Stream<Arguments> invalidConfigs() {
        return Stream.of(
            Arguments.of("byteBlockShift 过小", (Consumer<IndexingConfig>) c -> c.setByteBlockShift(7)),
            Arguments.of("intBlockShift 过大", (Consumer<IndexingConfig>) c -> c.setIntBlockShift(25)),
            Arguments.of("maxSlabsPerPool 为 0", (Consumer<IndexingConfig>) c -> c.setMaxSlabsPerPool(0)),
            Arguments.of("ramBudgetBytes 为 0", (Consumer<IndexingConfig>) c -> c.setRamBudgetBytes(0)),
            Arguments.of("ramBudgetBytes 超过最小块池容量", (Consumer<IndexingConfig>) c -> {
                c.setByteBlockShift(8);
                c.setMaxSlabsPerPool(4);
                c.setRamBudgetBytes(4 * 256 + 1);
            }),
            Arguments.of("maxBufferedDocs 为 -2", (Consumer<IndexingConfig>) c -> c.setMaxBufferedDocs(-2)),
            Arguments.of("两种自动刷新同时关闭", (Consumer<IndexingConfig>) c -> {
                c.setRamBudgetBytes(Constants.DISABLE_AUTO_FLUSH);
                c.setMaxBufferedDocs(Constants.DISABLE_AUTO_FLUSH);
            }),
            Arguments.of("maxTermLength 为 0", (Consumer<IndexingConfig>) c -> c.setMaxTermLength(0)),
            Arguments.of("maxTermLength 超过字符块", (Consumer<IndexingConfig>) c -> {
                c.setCharBlockShift(6);
                c.setMaxTermLength(64);
            }),
            Arguments.of("初始容量不是 2 的幂", (Consumer<IndexingConfig>) c -> c.setHashInitialCapacity(12)),
            Arguments.of("负载因子为 1", (Consumer<IndexingConfig>) c -> c.setHashLoadFactor(1f)),
            Arguments.of("扩容倍数为 3", (Consumer<IndexingConfig>) c -> c.setHashGrowthFactor(3)),
            Arguments.of("没有消费者", (Consumer<IndexingConfig>) c -> c.setConsumers(Set.of())),
            Arguments.of("未建索引字段开启归一化因子", (Consumer<IndexingConfig>) c -> {
                FieldOptions options = new FieldOptions();
                options.setIndexOptions(IndexOptions.NONE);
                c.getFieldOptions().put("raw", options);
            })
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("invalidConfigs")
    @DisplayName("非法配置在校验时被拒绝")
    void testValidateRejects(String description, Consumer<IndexingConfig> mutation) {
        IndexingConfig config = IndexingConfig.defaults();
        mutation.accept(config);
        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    @DisplayName("最小块池容量同时受块数上限与地址空间限制")
    void testSmallestPoolCapacity() {
        IndexingConfig config = IndexingConfig.defaults();
        config.setByteBlockShift(8);
        config.setMaxSlabsPerPool(4);
        assertEquals(4 * 256, config.smallestPoolCapacityBytes());

        config.setRamBudgetBytes(4 * 256);
        config.validate();
        config.setRamBudgetBytes(Constants.DISABLE_AUTO_FLUSH);
        config.setMaxBufferedDocs(1000);
        config.validate();

        IndexingConfig defaults = IndexingConfig.defaults();
        // 默认配置下三种块池的容量都是 2^31 字节
        assertEquals((long) Constants.DEFAULT_MAX_SLABS_PER_POOL << 15, defaults.smallestPoolCapacityBytes());
    }

    @Test
    @DisplayName("词项长度上限可以取到字符块容量")
    void testMaxTermLengthAtCharBlockCapacity() {
        IndexingConfig config = IndexingConfig.defaults();
        config.setCharBlockShift(6);
        config.setMaxTermLength(63);
        config.setRamBudgetBytes(1024 * 1024);
        config.validate();
    }

    @Test
    @DisplayName("字段选项的依赖关系")
    void testFieldOptionsValidation() {
        FieldOptions offsetsWithoutVectors = new FieldOptions();
        offsetsWithoutVectors.setTermVectorOffsets(true);
        assertThrows(IllegalArgumentException.class, () -> offsetsWithoutVectors.validate("f"));

        FieldOptions payloadsWithoutPositions = new FieldOptions();
        payloadsWithoutPositions.setTermVectors(true);
        payloadsWithoutPositions.setTermVectorPayloads(true);
        assertThrows(IllegalArgumentException.class, () -> payloadsWithoutPositions.validate("f"));

        FieldOptions stored = new FieldOptions();
        stored.setIndexOptions(IndexOptions.NONE);
        stored.setNorms(false);
        stored.validate("f");

        FieldOptions.withTermVectors().validate("f");
    }

    @Test
    @DisplayName("copy 为深拷贝")
    void testCopyIsDeep() {
        IndexingConfig config = IndexingConfig.defaults();
        config.getFieldOptions().put("title", FieldOptions.withTermVectors());

        IndexingConfig copy = config.copy();
        config.setMaxTermLength(10);
        config.getFieldOptions().get("title").setTermVectors(false);
        config.setConsumers(Set.of(ConsumerKind.NORMS));

        assertEquals(Constants.DEFAULT_MAX_TERM_LENGTH, copy.getMaxTermLength());
        assertTrue(copy.optionsFor("title").isTermVectors());
        assertNotSame(config.getFieldOptions(), copy.getFieldOptions());
        assertEquals(EnumSet.allOf(ConsumerKind.class), copy.getConsumers());
        assertSame(copy.getDefaultFieldOptions(), copy.optionsFor("unknown"));
    }

    @Test
    @DisplayName("从 JSON 文件读取配置，未出现的项保持默认值")
    void testLoadFromJson() throws IOException {
        Path file = tempDir.resolve("indexing.json");
        Files.writeString(file, "{\n"
            + "  \"ramBudgetBytes\": 1048576,\n"
            + "  \"maxBufferedDocs\": 500,\n"
            + "  \"maxTermLength\": 100,\n"
            + "  \"consumers\": [\"FREQ_PROX\", \"TERM_VECTORS\"],\n"
            + "  \"fieldOptions\": {\n"
            + "    \"title\": {\"indexOptions\": \"DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS\","
            + " \"termVectors\": true, \"termVectorOffsets\": true}\n"
            + "  }\n"
            + "}\n");

        IndexingConfig config = IndexingConfig.load(file);
        assertEquals(1048576L, config.getRamBudgetBytes());
        assertEquals(500, config.getMaxBufferedDocs());
        assertEquals(100, config.getMaxTermLength());
        assertEquals(Constants.DEFAULT_BYTE_BLOCK_SHIFT, config.getByteBlockShift());
        assertEquals(EnumSet.of(ConsumerKind.FREQ_PROX, ConsumerKind.TERM_VECTORS), config.getConsumers());
        FieldOptions title = config.optionsFor("title");
        assertEquals(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS, title.getIndexOptions());
        assertTrue(title.isTermVectors());
        assertTrue(title.isTermVectorOffsets());
        assertFalse(title.isTermVectorPositions());
    }

    @Test
    @DisplayName("JSON 配置非法或无法解析时失败")
    void testLoadFailures() throws IOException {
        Path invalid = tempDir.resolve("invalid.json");
        Files.writeString(invalid, "{\"maxTermLength\": 0}");
        assertThrows(IllegalArgumentException.class, () -> IndexingConfig.load(invalid));

        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ not json");
        IOException exception = assertThrows(IOException.class, () -> IndexingConfig.load(broken));
        assertTrue(exception.getMessage().startsWith("读取索引配置失败"));

        assertThrows(IOException.class, () -> IndexingConfig.load(tempDir.resolve("missing.json")));
    }

    @Test
    void testIndexOptionsCapabilities() {
        assertFalse(IndexOptions.NONE.isIndexed());
        assertTrue(IndexOptions.DOCS.isIndexed());
        assertFalse(IndexOptions.DOCS.hasFreqs());
        assertTrue(IndexOptions.DOCS_AND_FREQS.hasFreqs());
        assertFalse(IndexOptions.DOCS_AND_FREQS.hasPositions());
        assertTrue(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS.hasPositions());
        assertFalse(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS.hasOffsets());
        assertTrue(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS.hasOffsets());
    }
}
