package com.memindex.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 索引会话配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值。会话构造时会调用 {@link #validate()}
 * 并保存一份副本，之后修改本对象不影响已创建的会话。
 */
public class IndexingConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private int byteBlockShift = Constants.DEFAULT_BYTE_BLOCK_SHIFT;
    private int intBlockShift = Constants.DEFAULT_INT_BLOCK_SHIFT;
    private int charBlockShift = Constants.DEFAULT_CHAR_BLOCK_SHIFT;
    private int maxSlabsPerPool = Constants.DEFAULT_MAX_SLABS_PER_POOL;
    private long ramBudgetBytes = Constants.DEFAULT_RAM_BUDGET_BYTES;
    private int maxBufferedDocs = Constants.DEFAULT_MAX_BUFFERED_DOCS;
    private int maxTermLength = Constants.DEFAULT_MAX_TERM_LENGTH;
    private int hashInitialCapacity = Constants.DEFAULT_HASH_INITIAL_CAPACITY;
    private float hashLoadFactor = Constants.DEFAULT_HASH_LOAD_FACTOR;
    private int hashGrowthFactor = Constants.DEFAULT_HASH_GROWTH_FACTOR;
    private Set<ConsumerKind> consumers = EnumSet.allOf(ConsumerKind.class);
    private FieldOptions defaultFieldOptions = FieldOptions.defaults();
    private Map<String, FieldOptions> fieldOptions = new LinkedHashMap<>();

    public int getByteBlockShift() {
        return byteBlockShift;
    }

    public void setByteBlockShift(int byteBlockShift) {
        this.byteBlockShift = byteBlockShift;
    }

    public int getIntBlockShift() {
        return intBlockShift;
    }

    public void setIntBlockShift(int intBlockShift) {
        this.intBlockShift = intBlockShift;
    }

    public int getCharBlockShift() {
        return charBlockShift;
    }

    public void setCharBlockShift(int charBlockShift) {
        this.charBlockShift = charBlockShift;
    }

    public int getMaxSlabsPerPool() {
        return maxSlabsPerPool;
    }

    public void setMaxSlabsPerPool(int maxSlabsPerPool) {
        this.maxSlabsPerPool = maxSlabsPerPool;
    }

    public long getRamBudgetBytes() {
        return ramBudgetBytes;
    }

    public void setRamBudgetBytes(long ramBudgetBytes) {
        this.ramBudgetBytes = ramBudgetBytes;
    }

    public int getMaxBufferedDocs() {
        return maxBufferedDocs;
    }

    public void setMaxBufferedDocs(int maxBufferedDocs) {
        this.maxBufferedDocs = maxBufferedDocs;
    }

    public int getMaxTermLength() {
        return maxTermLength;
    }

    public void setMaxTermLength(int maxTermLength) {
        this.maxTermLength = maxTermLength;
    }

    public int getHashInitialCapacity() {
        return hashInitialCapacity;
    }

    public void setHashInitialCapacity(int hashInitialCapacity) {
        this.hashInitialCapacity = hashInitialCapacity;
    }

    public float getHashLoadFactor() {
        return hashLoadFactor;
    }

    public void setHashLoadFactor(float hashLoadFactor) {
        this.hashLoadFactor = hashLoadFactor;
    }

    public int getHashGrowthFactor() {
        return hashGrowthFactor;
    }

    public void setHashGrowthFactor(int hashGrowthFactor) {
        this.hashGrowthFactor = hashGrowthFactor;
    }

    public Set<ConsumerKind> getConsumers() {
        return consumers;
    }

    public void setConsumers(Set<ConsumerKind> consumers) {
        this.consumers = consumers == null || consumers.isEmpty()
            ? EnumSet.noneOf(ConsumerKind.class)
            : EnumSet.copyOf(consumers);
    }

    public FieldOptions getDefaultFieldOptions() {
        return defaultFieldOptions;
    }

    public void setDefaultFieldOptions(FieldOptions defaultFieldOptions) {
        this.defaultFieldOptions = defaultFieldOptions;
    }

    public Map<String, FieldOptions> getFieldOptions() {
        return fieldOptions;
    }

    public void setFieldOptions(Map<String, FieldOptions> fieldOptions) {
        this.fieldOptions = fieldOptions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fieldOptions);
    }

    /**
     * 查询字段的索引选项，未单独配置的字段使用默认选项。
     */
    public FieldOptions optionsFor(String fieldName) {
        FieldOptions options = fieldOptions.get(fieldName);
        return options != null ? options : defaultFieldOptions;
    }

    public boolean isEnabled(ConsumerKind kind) {
        return consumers.contains(kind);
    }

    /**
     * 校验配置的一致性。
     *
     * @throws IllegalArgumentException 存在非法或互相矛盾的取值时抛出
     */
    public void validate() {
        checkRange("byteBlockShift", byteBlockShift, 8, 24);
        checkRange("intBlockShift", intBlockShift, 4, 24);
        checkRange("charBlockShift", charBlockShift, 4, 24);
        if (maxSlabsPerPool <= 0) {
            throw new IllegalArgumentException("maxSlabsPerPool 必须为正数: " + maxSlabsPerPool);
        }
        if (ramBudgetBytes != Constants.DISABLE_AUTO_FLUSH && ramBudgetBytes <= 0) {
            throw new IllegalArgumentException("ramBudgetBytes 必须为正数或 -1: " + ramBudgetBytes);
        }
        if (maxBufferedDocs != Constants.DISABLE_AUTO_FLUSH && maxBufferedDocs <= 0) {
            throw new IllegalArgumentException("maxBufferedDocs 必须为正数或 -1: " + maxBufferedDocs);
        }
        long smallestPool = smallestPoolCapacityBytes();
        if (ramBudgetBytes != Constants.DISABLE_AUTO_FLUSH && ramBudgetBytes > smallestPool) {
            throw new IllegalArgumentException("ramBudgetBytes 不能超过最小块池的容量 " + smallestPool + ": " + ramBudgetBytes);
        }
        if (ramBudgetBytes == Constants.DISABLE_AUTO_FLUSH && maxBufferedDocs == Constants.DISABLE_AUTO_FLUSH) {
            throw new IllegalArgumentException("ramBudgetBytes 与 maxBufferedDocs 不能同时关闭");
        }
        int maxTextLength = Math.min((1 << charBlockShift) - 1, Constants.MAX_TERM_LENGTH_LIMIT);
        if (maxTermLength <= 0 || maxTermLength > maxTextLength) {
            throw new IllegalArgumentException("maxTermLength 必须在 [1, " + maxTextLength + "] 之间: " + maxTermLength);
        }
        if (hashInitialCapacity < 2 || Integer.bitCount(hashInitialCapacity) != 1) {
            throw new IllegalArgumentException("hashInitialCapacity 必须是不小于 2 的 2 的幂: " + hashInitialCapacity);
        }
        if (!(hashLoadFactor > 0f && hashLoadFactor < 1f)) {
            throw new IllegalArgumentException("hashLoadFactor 必须在 (0, 1) 之间: " + hashLoadFactor);
        }
        if (hashGrowthFactor < 2 || Integer.bitCount(hashGrowthFactor) != 1) {
            throw new IllegalArgumentException("hashGrowthFactor 必须是不小于 2 的 2 的幂: " + hashGrowthFactor);
        }
        if (consumers == null || consumers.isEmpty()) {
            throw new IllegalArgumentException("consumers 至少需要启用一个消费者");
        }
        if (defaultFieldOptions == null) {
            throw new IllegalArgumentException("defaultFieldOptions 不能为空");
        }
        defaultFieldOptions.validate("<default>");
        for (Map.Entry<String, FieldOptions> entry : fieldOptions.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("fieldOptions 中的字段名不能为空");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("字段 " + entry.getKey() + " 的选项不能为空");
            }
            entry.getValue().validate(entry.getKey());
        }
    }

    /**
     * 三种块池中硬上限最小的那个，按字节计。块数同时受地址必须落在 int 非负区间内的限制。
     */
    public long smallestPoolCapacityBytes() {
        long chars = poolCapacityBytes(charBlockShift, Character.BYTES);
        long ints = poolCapacityBytes(intBlockShift, Integer.BYTES);
        long bytes = poolCapacityBytes(byteBlockShift, Byte.BYTES);
        return Math.min(chars, Math.min(ints, bytes));
    }

    private long poolCapacityBytes(int blockShift, int unitBytes) {
        long blocks = Math.min(maxSlabsPerPool, 1L << (31 - blockShift));
        return blocks * (1L << blockShift) * unitBytes;
    }

    /**
     * 深拷贝当前配置。
     */
    public IndexingConfig copy() {
        IndexingConfig copy = new IndexingConfig();
        copy.byteBlockShift = byteBlockShift;
        copy.intBlockShift = intBlockShift;
        copy.charBlockShift = charBlockShift;
        copy.maxSlabsPerPool = maxSlabsPerPool;
        copy.ramBudgetBytes = ramBudgetBytes;
        copy.maxBufferedDocs = maxBufferedDocs;
        copy.maxTermLength = maxTermLength;
        copy.hashInitialCapacity = hashInitialCapacity;
        copy.hashLoadFactor = hashLoadFactor;
        copy.hashGrowthFactor = hashGrowthFactor;
        copy.setConsumers(consumers);
        copy.defaultFieldOptions = defaultFieldOptions == null ? null : defaultFieldOptions.copy();
        Map<String, FieldOptions> copiedFields = new LinkedHashMap<>();
        fieldOptions.forEach((name, options) -> copiedFields.put(name, options == null ? null : options.copy()));
        copy.fieldOptions = copiedFields;
        return copy;
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexingConfig defaults() {
        return new IndexingConfig();
    }

    /**
     * 从 JSON 文件读取配置，文件中未出现的项保持默认值。
     *
     * @param file 配置文件
     * @return 已校验的配置
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexingConfig load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        IndexingConfig config;
        try {
            config = OBJECT_MAPPER.readValue(Files.readAllBytes(file), IndexingConfig.class);
        } catch (IOException exception) {
            throw new IOException("读取索引配置失败: " + file.toAbsolutePath(), exception);
        }
        config.validate();
        return config;
    }

    private static void checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " 必须在 [" + min + ", " + max + "] 之间: " + value);
        }
    }
}
