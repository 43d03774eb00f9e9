package com.chairman.salon.exception;

public class DuplicateServiceException extends ServiceCatalogException {

    public DuplicateServiceException(String name) {
        super("A service with the name '" + name + "' already exists");
    }
}
