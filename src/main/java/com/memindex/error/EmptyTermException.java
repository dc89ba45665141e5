package com.memindex.error;

public class EmptyTermException extends IndexingException {

    public EmptyTermException() {
        super(ErrorKind.EMPTY_TERM, "词项文本不能为空");
    }
}
