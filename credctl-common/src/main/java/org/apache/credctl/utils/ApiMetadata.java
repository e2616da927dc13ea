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

package org.apache.credctl.utils;

/**
 * Names used on the wire by the credential RPC API and by the credential file format.
 */
public class ApiMetadata {

    // RPC method names
    public static final String AUTH_GENERATE = "Auth.Generate";
    public static final String AUTH_FETCH = "Auth.Fetch";
    public static final String AUTH_RESET = "Auth.Reset";
    public static final String SERVER_MEM_STATS = "Server.MemStats";
    public static final String SERVER_SYS_INFO = "Server.SysInfo";

    // request / response envelope
    public static final String METHOD = "method";
    public static final String PARAMS = "params";
    public static final String ID = "id";
    public static final String RESULT = "result";
    public static final String ERROR = "error";

    // arguments and replies
    public static final String USER = "User";
    public static final String NAME = "Name";
    public static final String ACCESS_KEY_ID = "AccessKeyID";
    public static final String SECRET_ACCESS_KEY = "SecretAccessKey";

    // structured errors
    public static final String EXCEPTION_TYPE = "__type";
    public static final String EXCEPTION_MESSAGE = "message";

    public static final String INVALID_ARGUMENT = "InvalidArgument";
    public static final String ALREADY_EXISTS = "AlreadyExists";
    public static final String NOT_FOUND = "NotFound";
    public static final String METHOD_NOT_FOUND = "MethodNotFound";
    public static final String INVALID_REQUEST = "InvalidRequest";
    public static final String INTERNAL_ERROR = "InternalError";

    // credential file
    public static final String VERSION = "version";
    public static final String USERS = "users";

    public static final int MAX_USER_NAME_LENGTH = 255;
}
