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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Generator handing out a fixed sequence of key pairs, for driving collision handling.
 */
public class ScriptedCredentialGenerator implements CredentialGenerator {

    private final Deque<String[]> pairs = new ArrayDeque<>();
    private int calls;

    public ScriptedCredentialGenerator add(String accessKeyId, String secretKey) {
        pairs.addLast(new String[] { accessKeyId, secretKey });
        return this;
    }

    @Override
    public synchronized UserCredentials generate(String userName) {
        calls++;
        String[] pair = pairs.pollFirst();
        if (pair == null) {
            throw new IllegalStateException("No scripted credentials left");
        }
        return new UserCredentials(userName, pair[0], pair[1]);
    }

    public synchronized int getCalls() {
        return calls;
    }

    static String repeat(char c, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    public static String accessKey(char c) {
        return repeat(c, UserCredentials.ACCESS_KEY_ID_LENGTH);
    }

    public static String secretKey(char c) {
        return repeat(c, UserCredentials.SECRET_KEY_LENGTH);
    }
}
