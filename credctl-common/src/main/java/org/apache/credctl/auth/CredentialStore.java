package org.apache.credctl.auth;

/**
 * Read access to issued credentials by access key id, used by storage nodes to authenticate
 * clients presenting an AWS-style access key.
 */
public interface CredentialStore {

    /**
     * Retrieves user credentials by access key ID.
     *
     * @param accessKeyId The AWS-style access key ID
     * @return UserCredentials if the key is live, null otherwise
     */
    UserCredentials getCredentials(String accessKeyId);
}
