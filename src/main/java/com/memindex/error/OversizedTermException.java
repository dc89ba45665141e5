package com.memindex.error;

/**
 * 词项长度超过配置的上限，词项被拒绝而不是被截断。
 */
public class OversizedTermException extends IndexingException {
    private final int length;
    private final int maxLength;

    public OversizedTermException(int length, int maxLength) {
        super(ErrorKind.OVERSIZED_TERM, "词项长度 " + length + " 超过上限 " + maxLength);
        this.length = length;
        this.maxLength = maxLength;
    }

    public int getLength() {
        return length;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
