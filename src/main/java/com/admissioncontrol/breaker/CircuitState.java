package com.admissioncontrol.breaker;

public enum CircuitState {
    /**
     * Normal operation, all requests allowed
     */
    CLOSED,

    /**
     * Dependency considered unhealthy, requests blocked until the recovery timeout passes
     */
    OPEN,

    /**
     * One probe request allowed to test whether the dependency recovered
     */
    HALF_OPEN
}
