package org.apache.credctl.auth.exceptions;

import org.apache.credctl.utils.ApiMetadata;

public class CredentialNotFoundException extends CredentialServiceException {

    private final String userName;

    public CredentialNotFoundException(String userName) {
        super("No credentials found for user " + userName);
        this.userName = userName;
    }

    public String getUserName() {
        return userName;
    }

    @Override
    public String getErrorType() {
        return ApiMetadata.NOT_FOUND;
    }
}
