package com.acme.werp.regen;

public class RegenerationException extends Exception {
    public RegenerationException(String message) { super(message); }
    public RegenerationException(String message, Throwable cause) { super(message, cause); }
}
