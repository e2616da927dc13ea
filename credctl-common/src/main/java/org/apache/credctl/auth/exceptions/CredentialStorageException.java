package org.apache.credctl.auth.exceptions;

import org.apache.credctl.utils.ApiMetadata;

/**
 * Raised when credentials cannot be read from or committed to durable storage.
 */
public class CredentialStorageException extends CredentialServiceException {

    public CredentialStorageException(String message) {
        super(message);
    }

    public CredentialStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorType() {
        return ApiMetadata.INTERNAL_ERROR;
    }

    @Override
    public boolean isClientError() {
        return false;
    }
}
