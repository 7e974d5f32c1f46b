package com.admissioncontrol.endpoint;

import com.admissioncontrol.core.AdmissionControlException;

/**
 * A rate-limit header was present but could not be parsed.
 */
public class MalformedRateLimitHeaderException extends AdmissionControlException {

    public MalformedRateLimitHeaderException(String message) {
        super(message);
    }
}
