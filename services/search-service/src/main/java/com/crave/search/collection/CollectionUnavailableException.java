package com.crave.search.collection;

public class CollectionUnavailableException extends RuntimeException {
    public CollectionUnavailableException(String message) {
        super(message);
    }

    public CollectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
