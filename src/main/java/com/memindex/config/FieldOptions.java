package com.memindex.config;

/**
 * 单个字段的索引选项
 *
 * 决定字段进入哪些消费者以及每个消费者记录的信息粒度
 */
public class FieldOptions {
    private IndexOptions indexOptions = IndexOptions.DOCS_AND_FREQS_AND_POSITIONS;
    private boolean termVectors;
    private boolean termVectorPositions;
    private boolean termVectorOffsets;
    private boolean termVectorPayloads;
    private boolean norms = true;

    public IndexOptions getIndexOptions() {
        return indexOptions;
    }

    public void setIndexOptions(IndexOptions indexOptions) {
        this.indexOptions = indexOptions;
    }

    public boolean isTermVectors() {
        return termVectors;
    }

    public void setTermVectors(boolean termVectors) {
        this.termVectors = termVectors;
    }

    public boolean isTermVectorPositions() {
        return termVectorPositions;
    }

    public void setTermVectorPositions(boolean termVectorPositions) {
        this.termVectorPositions = termVectorPositions;
    }

    public boolean isTermVectorOffsets() {
        return termVectorOffsets;
    }

    public void setTermVectorOffsets(boolean termVectorOffsets) {
        this.termVectorOffsets = termVectorOffsets;
    }

    public boolean isTermVectorPayloads() {
        return termVectorPayloads;
    }

    public void setTermVectorPayloads(boolean termVectorPayloads) {
        this.termVectorPayloads = termVectorPayloads;
    }

    public boolean isNorms() {
        return norms;
    }

    public void setNorms(boolean norms) {
        this.norms = norms;
    }

    /**
     * 校验选项之间的依赖关系。
     *
     * @param fieldName 字段名，用于错误信息
     * @throws IllegalArgumentException 选项互相矛盾时抛出
     */
    public void validate(String fieldName) {
        if (indexOptions == null) {
            throw new IllegalArgumentException("字段 " + fieldName + " 的 indexOptions 不能为空");
        }
        if (!indexOptions.isIndexed() && (termVectors || norms)) {
            throw new IllegalArgumentException("字段 " + fieldName + " 未建索引，不能开启词向量或归一化因子");
        }
        if (!termVectors && (termVectorPositions || termVectorOffsets || termVectorPayloads)) {
            throw new IllegalArgumentException("字段 " + fieldName + " 未开启词向量，不能设置词向量子选项");
        }
        if (termVectorPayloads && !termVectorPositions) {
            throw new IllegalArgumentException("字段 " + fieldName + " 的词向量载荷依赖位置信息");
        }
    }

    public FieldOptions copy() {
        FieldOptions copy = new FieldOptions();
        copy.indexOptions = indexOptions;
        copy.termVectors = termVectors;
        copy.termVectorPositions = termVectorPositions;
        copy.termVectorOffsets = termVectorOffsets;
        copy.termVectorPayloads = termVectorPayloads;
        copy.norms = norms;
        return copy;
    }

    /**
     * 默认选项：记录位置，带归一化因子，不存词向量
     */
    public static FieldOptions defaults() {
        return new FieldOptions();
    }

    /**
     * 开启完整词向量（位置、偏移、载荷）的选项
     */
    public static FieldOptions withTermVectors() {
        FieldOptions options = new FieldOptions();
        options.termVectors = true;
        options.termVectorPositions = true;
        options.termVectorOffsets = true;
        options.termVectorPayloads = true;
        return options;
    }
}
