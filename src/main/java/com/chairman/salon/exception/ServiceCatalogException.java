package com.chairman.salon.exception;

public class ServiceCatalogException extends RuntimeException {

    public ServiceCatalogException(String message) {
        super(message);
    }

    public ServiceCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
