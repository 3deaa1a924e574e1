package com.docindex.index;

public class IndexingException extends RuntimeException {

    public IndexingException(String message, Throwable cause) {
        super(message, cause);
    }
}
