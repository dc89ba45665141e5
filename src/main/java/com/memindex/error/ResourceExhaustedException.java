package com.memindex.error;

/**
 * 块池无法再分配新的块（地址空间或块数上限耗尽）。
 */
public class ResourceExhaustedException extends IndexingException {
    private final long bytesUsed;

    public ResourceExhaustedException(String message, long bytesUsed) {
        super(ErrorKind.RESOURCE_EXHAUSTED, message);
        this.bytesUsed = bytesUsed;
    }

    public long getBytesUsed() {
        return bytesUsed;
    }
}
