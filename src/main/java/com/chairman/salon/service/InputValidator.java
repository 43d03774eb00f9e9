package com.chairman.salon.service;

import com.chairman.salon.dto.ValidationResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Input checks shared by the client directory, the service catalog and the
 * scheduler. Messages are shown to the user as they are.
 */
@Component
public class InputValidator {

    private static final Pattern CLIENT_NAME = Pattern.compile("^[a-zA-Z\\s\\-'.]+$");
    private static final Pattern PHONE_FORMATTING = Pattern.compile("[\\s\\-().]");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    private final int clientNameMin;
    private final int clientNameMax;
    private final int phoneMin;
    private final int phoneMax;
    private final int serviceNameMin;
    private final int serviceNameMax;
    private final BigDecimal maxPrice;
    private final int minDuration;
    private final int maxDuration;
    private final int notesMax;
    private final int paymentMethodMax;

    public InputValidator(@Value("${chairman.validation.client-name-min-length:2}") int clientNameMin,
                     @Value("${chairman.validation.client-name-max-length:100}") int clientNameMax,
                     @Value("${chairman.validation.phone-min-length:10}") int phoneMin,
                     @Value("${chairman.validation.phone-max-length:15}") int phoneMax,
                     @Value("${chairman.validation.service-name-min-length:3}") int serviceNameMin,
                     @Value("${chairman.validation.service-name-max-length:100}") int serviceNameMax,
                     @Value("${chairman.validation.service-max-price:10000}") BigDecimal maxPrice,
                     @Value("${chairman.validation.service-min-duration:5}") int minDuration,
                     @Value("${chairman.validation.service-max-duration:480}") int maxDuration,
                     @Value("${chairman.validation.notes-max-length:500}") int notesMax,
                     @Value("${chairman.validation.payment-method-max-length:50}") int paymentMethodMax) {
        this.clientNameMin = clientNameMin;
        this.clientNameMax = clientNameMax;
        this.phoneMin = phoneMin;
        this.phoneMax = phoneMax;
        this.serviceNameMin = serviceNameMin;
        this.serviceNameMax = serviceNameMax;
        this.maxPrice = maxPrice;
        this.minDuration = minDuration;
        this.maxDuration = maxDuration;
        this.notesMax = notesMax;
        this.paymentMethodMax = paymentMethodMax;
    }

    /** Validator with the stock limits, for use outside the Spring context. */
    public static InputValidator withDefaults() {
        return new InputValidator(2, 100, 10, 15, 3, 100, new BigDecimal("10000"), 5, 480, 500, 50);
    }

    public ValidationResult validateClientName(String name) {
        if (StringUtils.isBlank(name)) {
            return ValidationResult.invalid("Client name cannot be empty");
        }
        String trimmed = name.trim();
        if (trimmed.length() < clientNameMin) {
            return ValidationResult.invalid("Client name must be at least " + clientNameMin + " characters");
        }
        if (trimmed.length() > clientNameMax) {
            return ValidationResult.invalid("Client name cannot exceed " + clientNameMax + " characters");
        }
        if (!CLIENT_NAME.matcher(trimmed).matches()) {
            return ValidationResult.invalid("Client name can only contain letters, spaces, hyphens, and apostrophes");
        }
        return ValidationResult.ok();
    }

    /** Phone is optional: blank passes. */
    public ValidationResult validatePhone(String phone) {
        if (StringUtils.isBlank(phone)) {
            return ValidationResult.ok();
        }
        String cleaned = PHONE_FORMATTING.matcher(phone).replaceAll("");
        if (!StringUtils.isNumeric(cleaned)) {
            return ValidationResult.invalid("Phone number can only contain digits and formatting characters");
        }
        if (cleaned.length() < phoneMin) {
            return ValidationResult.invalid("Phone number must be at least " + phoneMin + " digits");
        }
        if (cleaned.length() > phoneMax) {
            return ValidationResult.invalid("Phone number cannot exceed " + phoneMax + " digits");
        }
        return ValidationResult.ok();
    }

    public ValidationResult validateServiceName(String name) {
        if (StringUtils.isBlank(name)) {
            return ValidationResult.invalid("Service name cannot be empty");
        }
        String trimmed = name.trim();
        if (trimmed.length() < serviceNameMin) {
            return ValidationResult.invalid("Service name must be at least " + serviceNameMin + " characters");
        }
        if (trimmed.length() > serviceNameMax) {
            return ValidationResult.invalid("Service name cannot exceed " + serviceNameMax + " characters");
        }
        return ValidationResult.ok();
    }

    public ValidationResult validatePrice(BigDecimal price) {
        if (price == null) {
            return ValidationResult.invalid("Price must be a valid number");
        }
        if (price.signum() < 0) {
            return ValidationResult.invalid("Price cannot be negative");
        }
        if (price.compareTo(maxPrice) > 0) {
            return ValidationResult.invalid("Price cannot exceed $" + maxPrice.setScale(2, RoundingMode.HALF_UP));
        }
        return ValidationResult.ok();
    }

    public ValidationResult validateDuration(Integer minutes) {
        if (minutes == null) {
            return ValidationResult.invalid("Duration must be a valid number");
        }
        if (minutes < minDuration) {
            return ValidationResult.invalid("Duration must be at least " + minDuration + " minutes");
        }
        if (minutes > maxDuration) {
            return ValidationResult.invalid("Duration cannot exceed " + maxDuration + " minutes");
        }
        return ValidationResult.ok();
    }

    /** Buffer may be zero; upper bound is the same as for durations. */
    public ValidationResult validateBuffer(Integer minutes) {
        if (minutes == null) {
            return ValidationResult.invalid("Buffer time must be a valid number");
        }
        if (minutes < 0) {
            return ValidationResult.invalid("Buffer time cannot be negative");
        }
        if (minutes > maxDuration) {
            return ValidationResult.invalid("Buffer time cannot exceed " + maxDuration + " minutes");
        }
        return ValidationResult.ok();
    }

    public ValidationResult validateNotes(String notes) {
        if (notes == null || notes.isEmpty()) {
            return ValidationResult.ok();
        }
        if (notes.length() > notesMax) {
            return ValidationResult.invalid("Notes cannot exceed " + notesMax + " characters");
        }
        return ValidationResult.ok();
    }

    /** Length after trimming; blank passes. */
    public ValidationResult validatePaymentMethod(String method) {
        if (StringUtils.isBlank(method)) {
            return ValidationResult.ok();
        }
        if (method.trim().length() > paymentMethodMax) {
            return ValidationResult.invalid("Payment method cannot exceed " + paymentMethodMax + " characters");
        }
        return ValidationResult.ok();
    }

    /**
     * Formats 10-digit numbers as {@code (123) 456-7890} and 11-digit numbers
     * with a leading 1 as {@code +1 (123) 456-7890}. Anything else is returned as given.
     */
    public String formatPhone(String phone) {
        if (StringUtils.isEmpty(phone)) {
            return "";
        }
        String digits = NON_DIGIT.matcher(phone).replaceAll("");
        if (digits.length() == 10) {
            return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            return "+1 (" + digits.substring(1, 4) + ") " + digits.substring(4, 7) + "-" + digits.substring(7);
        }
        return phone;
    }

    /** Trims and drops control characters other than newline and tab. */
    public String sanitizeInput(String text) {
        if (StringUtils.isEmpty(text)) {
            return "";
        }
        String trimmed = text.trim();
        StringBuilder sb = new StringBuilder(trimmed.length());
        for (char ch : trimmed.toCharArray()) {
            if (!Character.isISOControl(ch) || ch == '\n' || ch == '\t') {
                sb.append(ch);
            }
        }
        return sb.toString();
    }
}
