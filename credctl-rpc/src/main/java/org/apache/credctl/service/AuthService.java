package org.apache.credctl.service;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.credctl.auth.CredentialRegistry;
import org.apache.credctl.auth.UserCredentials;
import org.apache.credctl.auth.exceptions.InvalidArgumentException;
import org.apache.credctl.utils.ApiMetadata;
import org.apache.hbase.thirdparty.com.google.common.base.Preconditions;

/**
 * Serves the {@code Auth.*} RPC methods on top of a {@link CredentialRegistry}.
 * Registry errors are left to propagate; the caller turns them into error replies.
 */
public class AuthService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuthService.class);

    private final CredentialRegistry registry;

    public AuthService(CredentialRegistry registry) {
        this.registry = Preconditions.checkNotNull(registry, "registry");
    }

    public Map<String, Object> generate(Map<String, Object> request) {
        String userName = getUserName(request);
        LOGGER.debug("Generating credentials for user {}", userName);
        UserCredentials credentials = registry.generate(userName);
        LOGGER.info("Generated access key {} for user {}", credentials.getAccessKeyId(),
                userName);
        return toResponse(credentials);
    }

    public Map<String, Object> fetch(Map<String, Object> request) {
        String userName = getUserName(request);
        LOGGER.debug("Fetching credentials for user {}", userName);
        return toResponse(registry.fetch(userName));
    }

    public Map<String, Object> reset(Map<String, Object> request) {
        String userName = getUserName(request);
        LOGGER.debug("Resetting credentials for user {}", userName);
        UserCredentials credentials = registry.reset(userName);
        LOGGER.info("Reset credentials of user {}, new access key {}", userName,
                credentials.getAccessKeyId());
        return toResponse(credentials);
    }

    private static String getUserName(Map<String, Object> request) {
        Object user = request == null ? null : request.get(ApiMetadata.USER);
        if (!(user instanceof String)) {
            throw new InvalidArgumentException(
                    "Argument '" + ApiMetadata.USER + "' must be a string");
        }
        return (String) user;
    }

    private static Map<String, Object> toResponse(UserCredentials credentials) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put(ApiMetadata.NAME, credentials.getUserName());
        response.put(ApiMetadata.ACCESS_KEY_ID, credentials.getAccessKeyId());
        response.put(ApiMetadata.SECRET_ACCESS_KEY, credentials.getSecretKey());
        return response;
    }
}
