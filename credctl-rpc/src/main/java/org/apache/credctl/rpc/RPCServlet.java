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

package org.apache.credctl.rpc;

import java.nio.file.Paths;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.credctl.auth.CredentialGenerator;
import org.apache.credctl.auth.CredentialRegistry;
import org.apache.credctl.auth.LocalCredentialRegistry;
import org.apache.credctl.auth.SecureRandomCredentialGenerator;
import org.apache.credctl.auth.storage.CredentialStorage;
import org.apache.credctl.auth.storage.JsonFileCredentialStorage;
import org.apache.credctl.rpc.metrics.MetricsRPC;
import org.apache.credctl.rpc.util.Constants;
import org.apache.credctl.service.AuthService;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.util.ReflectionUtils;

/**
 * State shared by all requests of one RPC server: configuration, the credential registry and
 * metrics. Each server owns its own instance.
 */
public class RPCServlet {

    private static final Logger LOG = LoggerFactory.getLogger(RPCServlet.class);

    private final Configuration conf;
    private final CredentialRegistry registry;
    private final AuthService authService;
    private final MetricsRPC metrics;

    /**
     * Constructor with existing configuration
     *
     * @param conf existing configuration
     */
    public RPCServlet(final Configuration conf) {
        this(conf, createRegistry(conf));
    }

    /**
     * @param conf     existing configuration
     * @param registry registry serving the {@code Auth.*} methods
     */
    public RPCServlet(final Configuration conf, final CredentialRegistry registry) {
        this.conf = conf;
        this.registry = registry;
        this.authService = new AuthService(registry);
        this.metrics = new MetricsRPC();
    }

    private static CredentialRegistry createRegistry(Configuration conf) {
        Class<? extends CredentialGenerator> generatorClass =
                conf.getClass(Constants.AUTH_CREDENTIAL_GENERATOR_CLASS,
                        SecureRandomCredentialGenerator.class, CredentialGenerator.class);
        CredentialGenerator generator = ReflectionUtils.newInstance(generatorClass, conf);

        String storeDir = conf.getTrimmed(Constants.AUTH_STORE_DIR);
        CredentialStorage storage;
        if (StringUtils.isBlank(storeDir)) {
            LOG.warn("{} is not set, credentials are kept in memory only",
                    Constants.AUTH_STORE_DIR);
            storage = CredentialStorage.ephemeral();
        } else {
            storage = new JsonFileCredentialStorage(Paths.get(storeDir));
            LOG.info("Credentials are stored in {}", storeDir);
        }
        return new LocalCredentialRegistry(generator, storage);
    }

    Configuration getConfiguration() {
        return conf;
    }

    public CredentialRegistry getRegistry() {
        return registry;
    }

    AuthService getAuthService() {
        return authService;
    }

    MetricsRPC getMetrics() {
        return metrics;
    }

    /**
     * Shutdown any services that need to stop
     */
    void shutdown() {
        LOG.info("Shutting down with {} live credentials", registry.size());
    }
}
