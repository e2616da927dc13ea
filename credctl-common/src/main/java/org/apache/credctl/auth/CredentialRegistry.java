package org.apache.credctl.auth;

/**
 * Owns the mapping from user name to the live credentials of that user.
 * <p>
 * Per user the lifecycle is {@code absent -> generate -> active -> reset -> active}; there is
 * no way back to absent. Generate and reset are linearizable per user: once either returns,
 * every later fetch observes the credentials it installed, and a concurrent fetch observes
 * either the old or the new pair, never a mix.
 * </p>
 */
public interface CredentialRegistry extends CredentialStore {

    /**
     * Creates credentials for a user that has none.
     *
     * @throws org.apache.credctl.auth.exceptions.InvalidArgumentException if the name is empty
     *         or malformed
     * @throws org.apache.credctl.auth.exceptions.CredentialAlreadyExistsException if the user
     *         already has live credentials
     */
    UserCredentials generate(String userName);

    /**
     * Returns the live credentials of a user without changing them.
     *
     * @throws org.apache.credctl.auth.exceptions.InvalidArgumentException if the name is empty
     *         or malformed
     * @throws org.apache.credctl.auth.exceptions.CredentialNotFoundException if the user has no
     *         credentials
     */
    UserCredentials fetch(String userName);

    /**
     * Replaces both the access key id and the secret key of a user. The previous pair stops
     * resolving the moment the replacement is committed.
     *
     * @throws org.apache.credctl.auth.exceptions.InvalidArgumentException if the name is empty
     *         or malformed
     * @throws org.apache.credctl.auth.exceptions.CredentialNotFoundException if the user has no
     *         credentials
     */
    UserCredentials reset(String userName);

    /**
     * @return number of users with live credentials
     */
    int size();
}
