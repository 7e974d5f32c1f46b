package com.admissioncontrol.breaker;

import com.admissioncontrol.core.AdmissionControlException;

/**
 * A call was not attempted because the circuit for its dependency is open.
 */
public class CircuitOpenException extends AdmissionControlException {

    private final String breakerName;

    public CircuitOpenException(String breakerName) {
        super("Circuit breaker '" + breakerName + "' is open");
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
