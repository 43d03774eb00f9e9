package com.chairman.salon.exception;

public class ClientDirectoryException extends RuntimeException {

    public ClientDirectoryException(String message) {
        super(message);
    }

    public ClientDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
