package org.apache.credctl.auth.storage;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

import org.apache.credctl.auth.UserCredentials;

/**
 * Durable backing for a credential registry.
 */
public interface CredentialStorage {

    /**
     * @return the committed credentials keyed by user name
     * @throws org.apache.credctl.auth.exceptions.CredentialStorageException if the stored
     *         credentials cannot be read
     */
    Map<String, UserCredentials> load();

    /**
     * Replaces the stored credentials with {@code credentials}. Returns only once the new set is
     * durable.
     *
     * @throws org.apache.credctl.auth.exceptions.CredentialStorageException if the commit failed;
     *         the previously committed set is then still in place
     */
    void store(Collection<UserCredentials> credentials);

    /**
     * @return storage that keeps nothing, for registries living only in memory
     */
    static CredentialStorage ephemeral() {
        return Ephemeral.INSTANCE;
    }

    final class Ephemeral implements CredentialStorage {

        private static final Ephemeral INSTANCE = new Ephemeral();

        private Ephemeral() {
        }

        @Override
        public Map<String, UserCredentials> load() {
            return Collections.emptyMap();
        }

        @Override
        public void store(Collection<UserCredentials> credentials) {
        }
    }
}
