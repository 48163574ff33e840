package com.bracketscan.application.markup.exception;

public class DocumentReadException extends RuntimeException {

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
