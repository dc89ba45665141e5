package com.memindex.error;

/**
 * 会话内部不变量被破坏，例如句柄引用了已重置的块池。
 *
 * 会话抛出该异常后不再可用，调用方需要为受影响的文档区间重新建立索引。
 */
public class CorruptedSessionStateException extends IndexingException {

    public CorruptedSessionStateException(String message) {
        super(ErrorKind.CORRUPTED_SESSION_STATE, message);
    }

    public CorruptedSessionStateException(String message, Throwable cause) {
        super(ErrorKind.CORRUPTED_SESSION_STATE, message, cause);
    }
}
