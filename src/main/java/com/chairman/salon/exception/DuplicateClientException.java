package com.chairman.salon.exception;

public class DuplicateClientException extends ClientDirectoryException {

    public DuplicateClientException(String name) {
        super("A client with the name '" + name + "' already exists");
    }
}
