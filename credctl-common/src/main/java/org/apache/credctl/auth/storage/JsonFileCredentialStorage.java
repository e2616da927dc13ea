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

package org.apache.credctl.auth.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.credctl.auth.UserCredentials;
import org.apache.credctl.auth.exceptions.CredentialStorageException;
import org.apache.credctl.utils.ApiMetadata;
import org.apache.hadoop.hbase.util.GsonUtil;
import org.apache.hbase.thirdparty.com.google.common.base.Preconditions;
import org.apache.hbase.thirdparty.com.google.gson.Gson;
import org.apache.hbase.thirdparty.com.google.gson.JsonElement;
import org.apache.hbase.thirdparty.com.google.gson.JsonObject;
import org.apache.hbase.thirdparty.com.google.gson.JsonParseException;

/**
 * Keeps all credentials in a single JSON document:
 * <pre>
 * {"version": "1",
 *  "users": {"alice": {"Name": "alice", "AccessKeyID": "...", "SecretAccessKey": "..."}}}
 * </pre>
 * Every commit writes a sibling temporary file, forces it to disk and atomically renames it
 * over the document, so readers and restarts only ever see a complete credential set.
 */
public class JsonFileCredentialStorage implements CredentialStorage {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileCredentialStorage.class);

    public static final String FILE_NAME = "credentials.json";
    static final String FORMAT_VERSION = "1";

    private static final Gson GSON =
            GsonUtil.createGson().setPrettyPrinting().disableHtmlEscaping().create();

    private static final Set<PosixFilePermission> OWNER_ONLY =
            PosixFilePermissions.fromString("rw-------");

    private final Path file;
    private final Path tmpFile;

    /**
     * @param directory directory holding the credential document, created if missing
     * @throws CredentialStorageException if the directory cannot be created
     */
    public JsonFileCredentialStorage(Path directory) {
        Preconditions.checkNotNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CredentialStorageException("Cannot create credential directory " + directory,
                    e);
        }
        this.file = directory.resolve(FILE_NAME);
        this.tmpFile = directory.resolve(FILE_NAME + ".tmp");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Map<String, UserCredentials> load() {
        Map<String, UserCredentials> credentials = new TreeMap<>();
        if (!Files.exists(file)) {
            LOG.info("No credential file at {}, starting empty", file);
            return credentials;
        }
        JsonObject document;
        try {
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            document = GSON.fromJson(content, JsonObject.class);
        } catch (IOException | JsonParseException e) {
            throw new CredentialStorageException("Cannot read credential file " + file, e);
        }
        if (document == null) {
            throw new CredentialStorageException("Credential file " + file + " is empty");
        }
        JsonElement version = document.get(ApiMetadata.VERSION);
        if (version == null || !version.isJsonPrimitive()
                || !FORMAT_VERSION.equals(version.getAsString())) {
            throw new CredentialStorageException(
                    "Unsupported credential file version " + version + " in " + file);
        }
        JsonElement users = document.get(ApiMetadata.USERS);
        if (users == null || !users.isJsonObject()) {
            return credentials;
        }
        for (Map.Entry<String, JsonElement> entry : users.getAsJsonObject().entrySet()) {
            UserCredentials userCredentials = parse(entry.getKey(), entry.getValue());
            credentials.put(entry.getKey(), userCredentials);
        }
        LOG.debug("Read {} credentials from {}", credentials.size(), file);
        return credentials;
    }

    @Override
    public void store(Collection<UserCredentials> credentials) {
        Map<String, UserCredentials> sorted = new TreeMap<>();
        for (UserCredentials userCredentials : credentials) {
            sorted.put(userCredentials.getUserName(), userCredentials);
        }
        JsonObject users = new JsonObject();
        for (UserCredentials userCredentials : sorted.values()) {
            JsonObject user = new JsonObject();
            user.addProperty(ApiMetadata.NAME, userCredentials.getUserName());
            user.addProperty(ApiMetadata.ACCESS_KEY_ID, userCredentials.getAccessKeyId());
            user.addProperty(ApiMetadata.SECRET_ACCESS_KEY, userCredentials.getSecretKey());
            users.add(userCredentials.getUserName(), user);
        }
        JsonObject document = new JsonObject();
        document.addProperty(ApiMetadata.VERSION, FORMAT_VERSION);
        document.add(ApiMetadata.USERS, users);

        byte[] content = GSON.toJson(document).getBytes(StandardCharsets.UTF_8);
        try {
            try (FileChannel channel = openTempFile()) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(tmpFile, file, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new CredentialStorageException("Cannot commit credentials to " + file, e);
        }
        LOG.debug("Committed {} credentials to {}", sorted.size(), file);
    }

    private UserCredentials parse(String userName, JsonElement element) {
        if (!element.isJsonObject()) {
            throw new CredentialStorageException("Malformed entry for user " + userName);
        }
        JsonObject user = element.getAsJsonObject();
        String name = getString(user, ApiMetadata.NAME, userName);
        if (!userName.equals(name)) {
            throw new CredentialStorageException(
                    "Entry for user " + userName + " carries name " + name);
        }
        try {
            return new UserCredentials(name, getString(user, ApiMetadata.ACCESS_KEY_ID, userName),
                    getString(user, ApiMetadata.SECRET_ACCESS_KEY, userName));
        } catch (IllegalArgumentException e) {
            throw new CredentialStorageException(
                    "Invalid credentials for user " + userName + ": " + e.getMessage(), e);
        }
    }

    private static String getString(JsonObject user, String field, String userName) {
        JsonElement value = user.get(field);
        if (value == null || !value.isJsonPrimitive()) {
            throw new CredentialStorageException(
                    "Missing " + field + " in entry for user " + userName);
        }
        return value.getAsString();
    }

    /**
     * Creates the temporary file readable and writable by the owner only. A leftover from an
     * interrupted commit is removed first, since permissions are only applied on creation.
     */
    FileChannel openTempFile() throws IOException {
        Files.deleteIfExists(tmpFile);
        Set<StandardOpenOption> options = EnumSet.of(StandardOpenOption.CREATE_NEW,
                StandardOpenOption.WRITE);
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return FileChannel.open(tmpFile, options,
                    PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        }
        return FileChannel.open(tmpFile, options);
    }

    Path getTempFile() {
        return tmpFile;
    }
}
