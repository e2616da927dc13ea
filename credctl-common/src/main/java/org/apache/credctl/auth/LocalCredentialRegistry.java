/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.credctl.auth;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.credctl.auth.exceptions.CredentialAlreadyExistsException;
import org.apache.credctl.auth.exceptions.CredentialNotFoundException;
import org.apache.credctl.auth.exceptions.CredentialStorageException;
import org.apache.credctl.auth.storage.CredentialStorage;
import org.apache.credctl.utils.ValidationUtil;
import org.apache.hbase.thirdparty.com.google.common.base.Preconditions;

/**
 * Credential registry held in process memory, optionally committed to a
 * {@link CredentialStorage} on every change.
 * <p>
 * A single read/write lock guards both the per-user map and the access key index. Fetches and
 * access key lookups share the read lock. Generate and reset hold the write lock until the
 * storage commit has returned, so a successful reply always means the credentials are durable.
 * Access key ids are unique across users: a generated id that is already live is discarded and
 * generated again.
 * </p>
 */
public class LocalCredentialRegistry implements CredentialRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(LocalCredentialRegistry.class);

    static final int MAX_GENERATE_ATTEMPTS = 8;

    private final CredentialGenerator generator;
    private final CredentialStorage storage;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, UserCredentials> credentialsByUser = new HashMap<>();
    private final Map<String, String> usersByAccessKey = new HashMap<>();

    public LocalCredentialRegistry(CredentialGenerator generator) {
        this(generator, CredentialStorage.ephemeral());
    }

    /**
     * @param generator source of new credentials
     * @param storage durable backing; its current content is loaded immediately
     * @throws CredentialStorageException if the stored credentials cannot be loaded
     */
    public LocalCredentialRegistry(CredentialGenerator generator, CredentialStorage storage) {
        this.generator = Preconditions.checkNotNull(generator, "generator");
        this.storage = Preconditions.checkNotNull(storage, "storage");
        for (Map.Entry<String, UserCredentials> entry : storage.load().entrySet()) {
            UserCredentials credentials = entry.getValue();
            String owner = usersByAccessKey.putIfAbsent(credentials.getAccessKeyId(),
                    entry.getKey());
            if (owner != null) {
                throw new CredentialStorageException("Access key " + credentials.getAccessKeyId()
                        + " is assigned to both " + owner + " and " + entry.getKey());
            }
            credentialsByUser.put(entry.getKey(), credentials);
        }
        LOG.info("Loaded credentials for {} users", credentialsByUser.size());
    }

    @Override
    public UserCredentials generate(String userName) {
        ValidationUtil.validateUserName(userName);
        lock.writeLock().lock();
        try {
            if (credentialsByUser.containsKey(userName)) {
                throw new CredentialAlreadyExistsException(userName);
            }
            UserCredentials created = newCredentials(userName, null);
            commit(created, null);
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public UserCredentials fetch(String userName) {
        ValidationUtil.validateUserName(userName);
        lock.readLock().lock();
        try {
            UserCredentials credentials = credentialsByUser.get(userName);
            if (credentials == null) {
                throw new CredentialNotFoundException(userName);
            }
            return credentials;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public UserCredentials reset(String userName) {
        ValidationUtil.validateUserName(userName);
        lock.writeLock().lock();
        try {
            UserCredentials previous = credentialsByUser.get(userName);
            if (previous == null) {
                throw new CredentialNotFoundException(userName);
            }
            UserCredentials replacement = newCredentials(userName, previous);
            commit(replacement, previous);
            return replacement;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public UserCredentials getCredentials(String accessKeyId) {
        if (accessKeyId == null || accessKeyId.isEmpty()) {
            return null;
        }
        lock.readLock().lock();
        try {
            String userName = usersByAccessKey.get(accessKeyId);
            return userName == null ? null : credentialsByUser.get(userName);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return credentialsByUser.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Must be called with the write lock held. The returned access key id is not live for any
     * user, and when {@code previous} is given the secret differs from the previous secret too.
     */
    private UserCredentials newCredentials(String userName, UserCredentials previous) {
        for (int attempt = 1; attempt <= MAX_GENERATE_ATTEMPTS; attempt++) {
            UserCredentials candidate = generator.generate(userName);
            Preconditions.checkState(userName.equals(candidate.getUserName()),
                    "Generator returned credentials for %s instead of %s",
                    candidate.getUserName(), userName);
            if (usersByAccessKey.containsKey(candidate.getAccessKeyId())) {
                LOG.warn("Generated access key collides with a live key, attempt {} of {}",
                        attempt, MAX_GENERATE_ATTEMPTS);
                continue;
            }
            if (previous != null && previous.getSecretKey().equals(candidate.getSecretKey())) {
                LOG.warn("Generated secret key equals the replaced one, attempt {} of {}",
                        attempt, MAX_GENERATE_ATTEMPTS);
                continue;
            }
            return candidate;
        }
        throw new IllegalStateException("Could not generate unique credentials for user "
                + userName + " after " + MAX_GENERATE_ATTEMPTS + " attempts");
    }

    /**
     * Must be called with the write lock held. Installs {@code replacement} and commits the full
     * credential set; on a failed commit the in-memory state is restored before rethrowing.
     */
    private void commit(UserCredentials replacement, UserCredentials previous) {
        String userName = replacement.getUserName();
        credentialsByUser.put(userName, replacement);
        usersByAccessKey.put(replacement.getAccessKeyId(), userName);
        if (previous != null) {
            usersByAccessKey.remove(previous.getAccessKeyId());
        }
        try {
            storage.store(credentialsByUser.values());
        } catch (RuntimeException e) {
            usersByAccessKey.remove(replacement.getAccessKeyId());
            if (previous != null) {
                credentialsByUser.put(userName, previous);
                usersByAccessKey.put(previous.getAccessKeyId(), userName);
            } else {
                credentialsByUser.remove(userName);
            }
            throw e;
        }
    }
}
