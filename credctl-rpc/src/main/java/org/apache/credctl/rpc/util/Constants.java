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

package org.apache.credctl.rpc.util;

public final class Constants {

    private Constants() {
    }

    public static final String RPC_PATH = "rpc";

    public static final String PATH_SPEC_ANY = "/*";

    public static final int DEFAULT_LISTEN_PORT = 9001;

    public static final String CREDCTL_RPC_HOST = "credctl.rpc.host";
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final String CREDCTL_RPC_PORT = "credctl.rpc.port";

    public static final String HTTP_HEADER_CACHE_SIZE = "credctl.rpc.http.header.cache.size";
    public static final int DEFAULT_HTTP_HEADER_CACHE_SIZE = Character.MAX_VALUE - 1;
    public static final int DEFAULT_HTTP_MAX_HEADER_SIZE = 64 * 2 * 1024;

    public static final String RPC_HTTP_ALLOW_OPTIONS_METHOD =
            "credctl.rpc.http.allow.options.method";
    public static final boolean RPC_HTTP_ALLOW_OPTIONS_METHOD_DEFAULT = true;

    public static final String RPC_CONNECTOR_ACCEPT_QUEUE_SIZE =
            "credctl.rpc.connector.accept.queue.size";
    public static final String RPC_THREAD_POOL_THREADS_MAX = "credctl.rpc.threads.max";
    public static final String RPC_THREAD_POOL_THREADS_MIN = "credctl.rpc.threads.min";
    public static final String RPC_THREAD_POOL_TASK_QUEUE_SIZE = "credctl.rpc.task.queue.size";
    public static final String RPC_THREAD_POOL_THREAD_IDLE_TIMEOUT =
            "credctl.rpc.thread.idle.timeout";

    public static final String RPC_DNS_INTERFACE = "credctl.rpc.dns.interface";
    public static final String RPC_DNS_NAMESERVER = "credctl.rpc.dns.nameserver";

    public static final String AUTH_STORE_DIR = "credctl.auth.store.dir";
    public static final String AUTH_CREDENTIAL_GENERATOR_CLASS =
            "credctl.auth.credential.generator.class";

}
