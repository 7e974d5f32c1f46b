package com.admissioncontrol.storage;

import com.admissioncontrol.core.AdmissionControlException;

/**
 * The shared store could not be reached or rejected an operation.
 */
public class StorageException extends AdmissionControlException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
