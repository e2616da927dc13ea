package org.apache.credctl.auth.exceptions;

import org.apache.credctl.utils.ApiMetadata;

public class CredentialAlreadyExistsException extends CredentialServiceException {

    private final String userName;

    public CredentialAlreadyExistsException(String userName) {
        super("Credentials already exist for user " + userName + ", use reset instead");
        this.userName = userName;
    }

    public String getUserName() {
        return userName;
    }

    @Override
    public String getErrorType() {
        return ApiMetadata.ALREADY_EXISTS;
    }
}
