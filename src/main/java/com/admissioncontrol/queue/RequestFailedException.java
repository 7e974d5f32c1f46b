package com.admissioncontrol.queue;

import com.admissioncontrol.core.AdmissionControlException;

/**
 * A queued request was executed (or rejected) and did not succeed.
 */
public class RequestFailedException extends AdmissionControlException {

    private final String requestId;
    private final FailureKind failure;

    public RequestFailedException(String requestId, FailureKind failure, String message) {
        super("Request " + requestId + " failed (" + failure + "): " + message);
        this.requestId = requestId;
        this.failure = failure;
    }

    public String getRequestId() {
        return requestId;
    }

    public FailureKind getFailure() {
        return failure;
    }
}
