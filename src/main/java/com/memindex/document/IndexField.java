package com.memindex.document;

import com.memindex.text.Token;

import java.util.List;

/**
 * 文档中的一个字段：字段名加已分析好的词项序列。
 */
public record IndexField(String name, List<Token> tokens) {

    public IndexField {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("字段名不能为空");
        }
        if (tokens == null) {
            throw new IllegalArgumentException("字段 " + name + " 的词项列表不能为空");
        }
        tokens = List.copyOf(tokens);
    }
}
