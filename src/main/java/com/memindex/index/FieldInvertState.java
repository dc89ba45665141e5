package com.memindex.index;

/**
 * 一个字段在当前文档中的反转状态，由同一字段链上的所有消费者共享。
 */
public final class FieldInvertState {
    private final String fieldName;
    private int docId = -1;
    private int length;

    public FieldInvertState(String fieldName) {
        this.fieldName = fieldName;
    }

    /**
     * 开始新文档。
     */
    void reset(int newDocId) {
        docId = newDocId;
        length = 0;
    }

    void accept() {
        length++;
    }

    public String fieldName() {
        return fieldName;
    }

    public int docId() {
        return docId;
    }

    /**
     * 当前文档中被接受的词项数，即字段长度。
     */
    public int length() {
        return length;
    }
}
