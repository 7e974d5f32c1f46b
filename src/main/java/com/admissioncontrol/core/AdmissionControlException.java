package com.admissioncontrol.core;

/**
 * Base type for every error raised by the admission-control core.
 * Denials are never raised; they are plain {@code false} results.
 */
public class AdmissionControlException extends RuntimeException {

    public AdmissionControlException(String message) {
        super(message);
    }

    public AdmissionControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
