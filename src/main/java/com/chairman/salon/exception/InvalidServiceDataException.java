package com.chairman.salon.exception;

public class InvalidServiceDataException extends ServiceCatalogException {

    public InvalidServiceDataException(String message) {
        super(message);
    }
}
