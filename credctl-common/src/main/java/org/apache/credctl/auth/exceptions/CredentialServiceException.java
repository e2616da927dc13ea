package org.apache.credctl.auth.exceptions;

/**
 * Base of the credential error taxonomy. Every subclass carries the error type reported to RPC
 * callers in the structured error payload.
 */
public abstract class CredentialServiceException extends RuntimeException {

    protected CredentialServiceException(String message) {
        super(message);
    }

    protected CredentialServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the error type reported to RPC callers.
     */
    public abstract String getErrorType();

    /**
     * @return true if the caller can fix the request, false for faults on the server side.
     */
    public boolean isClientError() {
        return true;
    }
}
