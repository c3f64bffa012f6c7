package com.mead.assistant.exception;

public class UnknownEntityException extends RuntimeException {

    public UnknownEntityException(String kind, String id) {
        super("Unknown " + kind + ": " + id);
    }
}
