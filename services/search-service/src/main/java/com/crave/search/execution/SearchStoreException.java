package com.crave.search.execution;

public class SearchStoreException extends RuntimeException {
    public SearchStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
