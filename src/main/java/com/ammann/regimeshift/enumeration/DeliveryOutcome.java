/* (C)2026 */
package com.ammann.regimeshift.enumeration;

/**
 * Outcome of an alert delivery attempt.
 */
public enum DeliveryOutcome {
    /** The target accepted the alert with a 2xx response. */
    DELIVERED,
    /** Network error, timeout or non-2xx response. */
    FAILED,
    /** Nothing to deliver to, e.g. no target configured. */
    SKIPPED
}
