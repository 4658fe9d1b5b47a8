/* (C)2026 */
package com.ammann.regimeshift.exception;

/**
 * Base unchecked exception for application-level errors surfaced to API callers.
 *
 * <p>Subclasses are mapped to HTTP status codes by {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
