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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Pattern;

import org.junit.AfterClass;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.credctl.rpc.util.Constants;
import org.apache.credctl.rpc.util.CredctlConfiguration;
import org.apache.credctl.utils.ApiMetadata;
import org.apache.hadoop.conf.Configuration;

public class RPCServerTest {

    private static final Logger LOGGER = LoggerFactory.getLogger(RPCServerTest.class);

    private static final Pattern ACCESS_KEY_PATTERN = Pattern.compile("[A-Z0-9]{20}");
    private static final Pattern SECRET_KEY_PATTERN = Pattern.compile("[A-Za-z0-9+/]{40}");

    private static RPCServer rpcServer;
    private static RpcTestClient client;

    @BeforeClass
    public static void initialize() throws Exception {
        Configuration conf = CredctlConfiguration.create();
        conf.set(Constants.CREDCTL_RPC_HOST, "127.0.0.1");
        conf.setInt(Constants.CREDCTL_RPC_PORT, 0);
        rpcServer = new RPCServer(conf);
        rpcServer.run();
        LOGGER.info("started {} on port {}", rpcServer.getClass().getName(), rpcServer.getPort());
        client = new RpcTestClient("127.0.0.1:" + rpcServer.getPort());
    }

    @AfterClass
    public static void stop() throws Exception {
        if (rpcServer != null) {
            rpcServer.stop();
        }
    }

    @Test(timeout = 120000)
    public void testGenerateFetchReset() throws Exception {
        RpcTestClient.Reply generated = client.callAuth(ApiMetadata.AUTH_GENERATE, "alice");
        Assert.assertEquals(200, generated.getStatus());
        Assert.assertNull(generated.getError());
        assertCredentials("alice", generated.getResult());
        Assert.assertNotNull(generated.getId());

        RpcTestClient.Reply fetched = client.callAuth(ApiMetadata.AUTH_FETCH, "alice");
        Assert.assertEquals(200, fetched.getStatus());
        Assert.assertEquals(generated.getResult(), fetched.getResult());

        RpcTestClient.Reply reset = client.callAuth(ApiMetadata.AUTH_RESET, "alice");
        Assert.assertEquals(200, reset.getStatus());
        assertCredentials("alice", reset.getResult());
        Assert.assertNotEquals(generated.getResult().get(ApiMetadata.ACCESS_KEY_ID),
                reset.getResult().get(ApiMetadata.ACCESS_KEY_ID));
        Assert.assertNotEquals(generated.getResult().get(ApiMetadata.SECRET_ACCESS_KEY),
                reset.getResult().get(ApiMetadata.SECRET_ACCESS_KEY));

        RpcTestClient.Reply fetchedAgain = client.callAuth(ApiMetadata.AUTH_FETCH, "alice");
        Assert.assertEquals(reset.getResult(), fetchedAgain.getResult());

        String newKey = (String) reset.getResult().get(ApiMetadata.ACCESS_KEY_ID);
        String oldKey = (String) generated.getResult().get(ApiMetadata.ACCESS_KEY_ID);
        Assert.assertNotNull(rpcServer.getServlet().getRegistry().getCredentials(newKey));
        Assert.assertNull(rpcServer.getServlet().getRegistry().getCredentials(oldKey));
    }

    @Test(timeout = 120000)
    public void testGenerateTwiceIsAlreadyExists() throws Exception {
        RpcTestClient.Reply generated = client.callAuth(ApiMetadata.AUTH_GENERATE, "bob");
        Assert.assertEquals(200, generated.getStatus());

        RpcTestClient.Reply again = client.callAuth(ApiMetadata.AUTH_GENERATE, "bob");
        Assert.assertEquals(400, again.getStatus());
        Assert.assertNull(again.getResult());
        Assert.assertEquals(ApiMetadata.ALREADY_EXISTS, again.getErrorType());
        Assert.assertTrue(again.getErrorMessage(), again.getErrorMessage().contains("bob"));

        Assert.assertEquals(generated.getResult(),
                client.callAuth(ApiMetadata.AUTH_FETCH, "bob").getResult());
    }

    @Test(timeout = 120000)
    public void testUnknownUserIsNotFound() throws Exception {
        RpcTestClient.Reply fetched = client.callAuth(ApiMetadata.AUTH_FETCH, "ghost");
        Assert.assertEquals(400, fetched.getStatus());
        Assert.assertEquals(ApiMetadata.NOT_FOUND, fetched.getErrorType());

        RpcTestClient.Reply reset = client.callAuth(ApiMetadata.AUTH_RESET, "ghost");
        Assert.assertEquals(400, reset.getStatus());
        Assert.assertEquals(ApiMetadata.NOT_FOUND, reset.getErrorType());

        Assert.assertEquals(ApiMetadata.NOT_FOUND,
                client.callAuth(ApiMetadata.AUTH_FETCH, "ghost").getErrorType());
    }

    @Test(timeout = 120000)
    public void testEmptyUserIsInvalidArgument() throws Exception {
        for (String method : new String[] { ApiMetadata.AUTH_GENERATE, ApiMetadata.AUTH_FETCH,
                ApiMetadata.AUTH_RESET }) {
            for (String user : new String[] { "", "  ", null }) {
                RpcTestClient.Reply reply = client.callAuth(method, user);
                Assert.assertEquals(method, 400, reply.getStatus());
                Assert.assertEquals(method, ApiMetadata.INVALID_ARGUMENT, reply.getErrorType());
            }
            RpcTestClient.Reply noUser = client.call(method, Collections.emptyMap());
            Assert.assertEquals(400, noUser.getStatus());
            Assert.assertEquals(ApiMetadata.INVALID_ARGUMENT, noUser.getErrorType());
        }
    }

    @Test(timeout = 120000)
    public void testParamsAsObjectAndStringId() throws Exception {
        RpcTestClient.Reply reply = client.post("{\"method\": \"" + ApiMetadata.AUTH_GENERATE
                + "\", \"params\": {\"User\": \"carol\"}, \"id\": \"req-7\"}", "application/json");
        Assert.assertEquals(200, reply.getStatus());
        Assert.assertEquals("req-7", reply.getId());
        assertCredentials("carol", reply.getResult());
    }

    @Test(timeout = 120000)
    public void testTooManyParams() throws Exception {
        RpcTestClient.Reply reply = client.post("{\"method\": \"" + ApiMetadata.AUTH_FETCH
                + "\", \"params\": [{\"User\": \"a\"}, {\"User\": \"b\"}], \"id\": 3}",
                "application/json");
        Assert.assertEquals(400, reply.getStatus());
        Assert.assertEquals(ApiMetadata.INVALID_ARGUMENT, reply.getErrorType());
        Assert.assertEquals(3, reply.getId());
    }

    @Test(timeout = 120000)
    public void testUnknownMethod() throws Exception {
        RpcTestClient.Reply reply = client.callAuth("Auth.Delete", "alice");
        Assert.assertEquals(400, reply.getStatus());
        Assert.assertEquals(ApiMetadata.METHOD_NOT_FOUND, reply.getErrorType());
        Assert.assertTrue(reply.getErrorMessage().contains("Auth.Delete"));

        RpcTestClient.Reply noMethod = client.post("{\"params\": [], \"id\": 9}",
                "application/json");
        Assert.assertEquals(400, noMethod.getStatus());
        Assert.assertEquals(ApiMetadata.METHOD_NOT_FOUND, noMethod.getErrorType());
        Assert.assertEquals(9, noMethod.getId());
    }

    @Test(timeout = 120000)
    public void testMalformedRequests() throws Exception {
        RpcTestClient.Reply truncated = client.post("{\"method\": \"Auth.Fetch\", ",
                "application/json");
        Assert.assertEquals(400, truncated.getStatus());
        Assert.assertEquals(ApiMetadata.INVALID_REQUEST, truncated.getErrorType());

        RpcTestClient.Reply notAnObject = client.post("[1, 2, 3]", "application/json");
        Assert.assertEquals(400, notAnObject.getStatus());
        Assert.assertEquals(ApiMetadata.INVALID_REQUEST, notAnObject.getErrorType());

        RpcTestClient.Reply empty = client.post("", "application/json");
        Assert.assertEquals(400, empty.getStatus());
        Assert.assertEquals(ApiMetadata.INVALID_REQUEST, empty.getErrorType());
    }

    @Test(timeout = 120000)
    public void testUnsupportedTransport() throws Exception {
        RpcTestClient.Reply wrongType = client.post("User=alice", "text/plain");
        Assert.assertEquals(415, wrongType.getStatus());
        Assert.assertTrue(wrongType.getContentType(),
                wrongType.getContentType().startsWith("application/json"));
        Assert.assertEquals(ApiMetadata.INVALID_REQUEST, wrongType.getErrorType());
        Assert.assertNull(wrongType.getResult());

        RpcTestClient.Reply wrongMethod = client.send("GET", null, null);
        Assert.assertEquals(405, wrongMethod.getStatus());
        Assert.assertTrue(wrongMethod.getContentType(),
                wrongMethod.getContentType().startsWith("application/json"));
        Assert.assertEquals(ApiMetadata.INVALID_REQUEST, wrongMethod.getErrorType());
    }

    @Test(timeout = 120000)
    public void testResponseHeaders() throws Exception {
        RpcTestClient.Reply ok = client.post("{\"method\": \"" + ApiMetadata.SERVER_SYS_INFO
                + "\", \"id\": 1}", "application/json");
        Assert.assertEquals(200, ok.getStatus());
        Assert.assertTrue(ok.getContentType(), ok.getContentType().startsWith("application/json"));
        Assert.assertTrue(ok.getCacheControl(), ok.getCacheControl().contains("no-cache"));

        RpcTestClient.Reply failed = client.callAuth(ApiMetadata.AUTH_FETCH, "nobody");
        Assert.assertTrue(failed.getContentType(),
                failed.getContentType().startsWith("application/json"));
        Assert.assertTrue(failed.getBody().containsKey(ApiMetadata.RESULT));
        Assert.assertTrue(failed.getBody().containsKey(ApiMetadata.ERROR));
        Assert.assertTrue(failed.getBody().containsKey(ApiMetadata.ID));
    }

    @Test(timeout = 120000)
    @SuppressWarnings("unchecked")
    public void testMemStats() throws Exception {
        RpcTestClient.Reply reply = client.post("{\"method\": \"" + ApiMetadata.SERVER_MEM_STATS
                + "\", \"params\": [], \"id\": 1}", "application/json");
        Assert.assertEquals(200, reply.getStatus());
        Map<String, Object> result = reply.getResult();
        Map<String, Object> heap = (Map<String, Object>) result.get("Heap");
        Assert.assertTrue(((Number) heap.get("Used")).longValue() > 0);
        Assert.assertTrue(((Number) result.get("TotalMemory")).longValue() > 0);
        Assert.assertFalse(((List<Object>) result.get("Pools")).isEmpty());
    }

    @Test(timeout = 120000)
    public void testSysInfo() throws Exception {
        RpcTestClient.Reply reply = client.call(ApiMetadata.SERVER_SYS_INFO,
                Collections.emptyMap());
        Assert.assertEquals(200, reply.getStatus());
        Map<String, Object> result = reply.getResult();
        Assert.assertEquals(System.getProperty("os.arch"), result.get("SysARCH"));
        Assert.assertEquals(System.getProperty("os.name"), result.get("SysOS"));
        Assert.assertTrue(((Number) result.get("SysCPUS")).intValue() >= 1);
        Assert.assertTrue(((Number) result.get("Threads")).intValue() >= 1);
        Assert.assertEquals(System.getProperty("java.version"), result.get("JavaVersion"));
    }

    @Test(timeout = 120000)
    public void testConcurrentGenerateOverHttp() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<RpcTestClient.Reply>> tasks = new ArrayList<>();
            for (int i = 0; i < 24; i++) {
                tasks.add(() -> client.callAuth(ApiMetadata.AUTH_GENERATE, "racer"));
            }
            int succeeded = 0;
            int alreadyExists = 0;
            for (Future<RpcTestClient.Reply> future : executor.invokeAll(tasks)) {
                RpcTestClient.Reply reply = future.get();
                if (reply.getStatus() == 200) {
                    succeeded++;
                } else {
                    Assert.assertEquals(ApiMetadata.ALREADY_EXISTS, reply.getErrorType());
                    alreadyExists++;
                }
            }
            Assert.assertEquals(1, succeeded);
            Assert.assertEquals(23, alreadyExists);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void assertCredentials(String user, Map<String, Object> result) {
        Assert.assertNotNull(result);
        Assert.assertEquals(user, result.get(ApiMetadata.NAME));
        String accessKeyId = (String) result.get(ApiMetadata.ACCESS_KEY_ID);
        String secretKey = (String) result.get(ApiMetadata.SECRET_ACCESS_KEY);
        Assert.assertTrue(accessKeyId, ACCESS_KEY_PATTERN.matcher(accessKeyId).matches());
        Assert.assertTrue(SECRET_KEY_PATTERN.matcher(secretKey).matches());
    }
}
