package org.apache.credctl.auth;

import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.Random;

import org.apache.hbase.thirdparty.com.google.common.base.Preconditions;

/**
 * Draws every character of the access key id and the secret key independently from a
 * {@link SecureRandom}.
 */
public class SecureRandomCredentialGenerator implements CredentialGenerator {

    static final String ACCESS_KEY_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final String SECRET_KEY_ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    private final Random random;

    public SecureRandomCredentialGenerator() {
        this(new SecureRandom());
    }

    /**
     * @param random source of randomness; tests pass a seeded {@link Random}
     */
    public SecureRandomCredentialGenerator(Random random) {
        this.random = Preconditions.checkNotNull(random, "random");
    }

    @Override
    public UserCredentials generate(String userName) {
        String accessKeyId;
        String secretKey;
        try {
            accessKeyId = randomString(ACCESS_KEY_ALPHABET, UserCredentials.ACCESS_KEY_ID_LENGTH);
            secretKey = randomString(SECRET_KEY_ALPHABET, UserCredentials.SECRET_KEY_LENGTH);
        } catch (ProviderException e) {
            throw new IllegalStateException("Secure random source failed", e);
        }
        return new UserCredentials(userName, accessKeyId, secretKey);
    }

    private String randomString(String alphabet, int length) {
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = alphabet.charAt(random.nextInt(alphabet.length()));
        }
        return new String(chars);
    }
}
