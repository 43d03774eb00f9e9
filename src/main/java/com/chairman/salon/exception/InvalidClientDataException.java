package com.chairman.salon.exception;

public class InvalidClientDataException extends ClientDirectoryException {

    public InvalidClientDataException(String message) {
        super(message);
    }
}
