package com.memindex.error;

/**
 * 索引核心抛出的异常基类，携带错误种类。
 */
public abstract class IndexingException extends RuntimeException {
    private final ErrorKind kind;

    protected IndexingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected IndexingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRecoverable() {
        return kind.isRecoverable();
    }
}
