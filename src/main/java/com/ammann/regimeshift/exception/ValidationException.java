/* (C)2026 */
package com.ammann.regimeshift.exception;

/**
 * Raised when caller input (alert subscription fields, metric query overrides) is malformed.
 *
 * <p>Mapped to HTTP 400 by {@link GlobalExceptionHandler}. Whatever operation raised it has not
 * changed any stored state.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for a window or limit outside its allowed range.
     */
    public static ValidationException outOfRange(String paramName, int value, int min, int max) {
        return new ValidationException(
                String.format("Parameter '%s' must be between %d and %d, got %d", paramName, min, max, value));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
