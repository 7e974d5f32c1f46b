package com.admissioncontrol.queue;

/**
 * Why a queued request did not complete.
 */
public enum FailureKind {
    /**
     * No permit within the attempt budget
     */
    RATE_LIMITED,
    CIRCUIT_OPEN,
    /**
     * The call was made and the dependency failed on every attempt
     */
    DEPENDENCY_FAILURE,
    /**
     * The request was invalid and never retried
     */
    REJECTED
}
