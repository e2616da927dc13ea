package org.apache.credctl.auth;

import java.util.Objects;

import org.apache.hbase.thirdparty.com.google.common.base.Preconditions;

/**
 * Immutable access key pair bound to a user.
 * <p>
 * The access key id is always {@value #ACCESS_KEY_ID_LENGTH} characters and the secret key
 * always {@value #SECRET_KEY_LENGTH} characters long.
 * </p>
 */
public final class UserCredentials {

    public static final int ACCESS_KEY_ID_LENGTH = 20;
    public static final int SECRET_KEY_LENGTH = 40;

    private final String userName;
    private final String accessKeyId;
    private final String secretKey;

    /**
     * Creates new user credentials.
     *
     * @param userName Name of the user owning the credentials.
     * @param accessKeyId Access key ID.
     * @param secretKey Secret key.
     */
    public UserCredentials(String userName, String accessKeyId, String secretKey) {
        Preconditions.checkArgument(userName != null && !userName.isEmpty(),
                "User name must not be empty");
        Preconditions.checkArgument(
                accessKeyId != null && accessKeyId.length() == ACCESS_KEY_ID_LENGTH,
                "Access key id must be %s characters", ACCESS_KEY_ID_LENGTH);
        Preconditions.checkArgument(secretKey != null && secretKey.length() == SECRET_KEY_LENGTH,
                "Secret key must be %s characters", SECRET_KEY_LENGTH);
        this.userName = userName;
        this.accessKeyId = accessKeyId;
        this.secretKey = secretKey;
    }

    /**
     * @return The name of the user owning the credentials.
     */
    public String getUserName() {
        return userName;
    }

    /**
     * @return The access key ID.
     */
    public String getAccessKeyId() {
        return accessKeyId;
    }

    /**
     * @return The secret key.
     */
    public String getSecretKey() {
        return secretKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UserCredentials)) {
            return false;
        }
        UserCredentials that = (UserCredentials) o;
        return userName.equals(that.userName) && accessKeyId.equals(that.accessKeyId)
                && secretKey.equals(that.secretKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userName, accessKeyId, secretKey);
    }

    @Override
    public String toString() {
        return "UserCredentials{userName=" + userName + ", accessKeyId=" + accessKeyId
                + ", secretKey=****}";
    }
}
