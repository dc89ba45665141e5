package com.memindex.document;

import com.memindex.text.Token;
import com.memindex.text.Tokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * 待索引的文档，由若干字段组成。字段名在同一文档内必须唯一。
 */
public record IndexDocument(List<IndexField> fields) {

    public IndexDocument {
        if (fields == null) {
            throw new IllegalArgumentException("字段列表不能为空");
        }
        fields = List.copyOf(fields);
    }

    public static IndexDocument of(IndexField... fields) {
        return new IndexDocument(List.of(fields));
    }

    /**
     * 用给定分词器把多个 (字段名, 文本) 对构造成文档。
     *
     * @param tokenizer 分词器
     * @param nameAndText 依次为字段名与文本
     */
    public static IndexDocument analyze(Tokenizer tokenizer, String... nameAndText) {
        if (nameAndText.length % 2 != 0) {
            throw new IllegalArgumentException("字段名与文本必须成对出现");
        }
        List<IndexField> fields = new ArrayList<>();
        for (int i = 0; i < nameAndText.length; i += 2) {
            List<Token> tokens = tokenizer.tokenize(nameAndText[i + 1]);
            fields.add(new IndexField(nameAndText[i], tokens));
        }
        return new IndexDocument(fields);
    }

    public int tokenCount() {
        int count = 0;
        for (IndexField field : fields) {
            count += field.tokens().size();
        }
        return count;
    }
}
