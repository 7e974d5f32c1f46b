package com.admissioncontrol.endpoint;

/**
 * A URL could not be mapped to an endpoint key: malformed, for another
 * host, or for an unsupported API version.
 */
public class InvalidEndpointUrlException extends IllegalArgumentException {

    public InvalidEndpointUrlException(String message) {
        super(message);
    }

    public InvalidEndpointUrlException(String message, Throwable cause) {
        super(message, cause);
    }
}
