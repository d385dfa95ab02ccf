package com.acme.werp.store;

public class StoreWriteException extends RuntimeException {
    public StoreWriteException(String message) { super(message); }
    public StoreWriteException(String message, Throwable cause) { super(message, cause); }
}
