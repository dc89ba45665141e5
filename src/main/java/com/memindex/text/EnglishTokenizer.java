package com.memindex.text;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 英文与数字分词器。
 *
 * 可选载荷分隔符：开启后 {@code word|payload} 形式的片段切出词项 word，并把 payload 的
 * UTF-8 字节作为该词项的载荷。
 */
public class EnglishTokenizer implements Tokenizer {

    private static final Pattern SPLIT_PATTERN = Pattern.compile("[^a-zA-Z0-9]+");

    private final Character payloadDelimiter;
    private final Pattern chunkPattern;

    /**
     * 创建不带载荷的英文分词器。
     */
    public EnglishTokenizer() {
        this(null);
    }

    /**
     * 创建英文分词器。
     *
     * @param payloadDelimiter 载荷分隔符，为 null 时不解析载荷
     */
    public EnglishTokenizer(Character payloadDelimiter) {
        if (payloadDelimiter != null && Character.isLetterOrDigit(payloadDelimiter)) {
            throw new IllegalArgumentException("载荷分隔符不能是字母或数字: " + payloadDelimiter);
        }
        this.payloadDelimiter = payloadDelimiter;
        this.chunkPattern = payloadDelimiter == null
            ? SPLIT_PATTERN
            : Pattern.compile("[^a-zA-Z0-9" + Pattern.quote(String.valueOf(payloadDelimiter)) + "]+");
    }

    /**
     * 对英文与数字文本分词，并输出原文偏移。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        Matcher delimiterMatcher = chunkPattern.matcher(text);
        int nextPosition = 0;
        int segmentStart = 0;

        while (delimiterMatcher.find()) {
            nextPosition = appendTokenIfValid(text, segmentStart, delimiterMatcher.start(), nextPosition, tokens);
            segmentStart = delimiterMatcher.end();
        }
        appendTokenIfValid(text, segmentStart, text.length(), nextPosition, tokens);

        return List.copyOf(tokens);
    }

    /**
     * 校验并追加有效词项，返回更新后的下一个位置序号。
     */
    private int appendTokenIfValid(String sourceText, int startOffset, int endOffset, int position, List<Token> tokens) {
        if (startOffset >= endOffset) {
            return position;
        }

        int termEnd = endOffset;
        byte[] payload = null;
        if (payloadDelimiter != null) {
            int delimiterIndex = sourceText.indexOf(payloadDelimiter, startOffset);
            if (delimiterIndex >= 0 && delimiterIndex < endOffset) {
                termEnd = delimiterIndex;
                String payloadText = sourceText.substring(delimiterIndex + 1, endOffset)
                    .replace(String.valueOf(payloadDelimiter), "");
                payload = payloadText.getBytes(StandardCharsets.UTF_8);
            }
        }
        if (startOffset >= termEnd) {
            return position;
        }

        String normalizedTerm = sourceText.substring(startOffset, termEnd).toLowerCase(Locale.ROOT);
        tokens.add(new Token(normalizedTerm, position, startOffset, termEnd, payload));
        return position + 1;
    }
}
