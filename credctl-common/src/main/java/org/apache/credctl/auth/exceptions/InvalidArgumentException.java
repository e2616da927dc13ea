package org.apache.credctl.auth.exceptions;

import org.apache.credctl.utils.ApiMetadata;

public class InvalidArgumentException extends CredentialServiceException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    @Override
    public String getErrorType() {
        return ApiMetadata.INVALID_ARGUMENT;
    }
}
