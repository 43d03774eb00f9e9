package com.chairman.salon.dto;

public record ValidationResult(boolean valid, String errorMessage) {

    private static final ValidationResult OK = new ValidationResult(true, "");

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(String errorMessage) {
        return new ValidationResult(false, errorMessage);
    }
}
