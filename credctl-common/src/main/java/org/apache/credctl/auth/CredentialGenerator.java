package org.apache.credctl.auth;

/**
 * Produces fresh random credentials. Implementations must not reuse randomness across calls.
 * <p>
 * A failing randomness source is reported as an unchecked exception that callers are not
 * expected to handle.
 * </p>
 */
public interface CredentialGenerator {

    /**
     * @param userName the user the new credentials are bound to
     * @return newly generated credentials for {@code userName}
     */
    UserCredentials generate(String userName);
}
