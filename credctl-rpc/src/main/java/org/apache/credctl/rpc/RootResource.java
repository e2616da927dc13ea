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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.hbase.thirdparty.javax.ws.rs.Consumes;
import org.apache.hbase.thirdparty.javax.ws.rs.POST;
import org.apache.hbase.thirdparty.javax.ws.rs.Path;
import org.apache.hbase.thirdparty.javax.ws.rs.Produces;
import org.apache.hbase.thirdparty.javax.ws.rs.core.CacheControl;
import org.apache.hbase.thirdparty.javax.ws.rs.core.MediaType;
import org.apache.hbase.thirdparty.javax.ws.rs.core.Response;
import org.apache.hbase.thirdparty.javax.ws.rs.core.Response.ResponseBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.credctl.auth.exceptions.CredentialServiceException;
import org.apache.credctl.auth.exceptions.InvalidArgumentException;
import org.apache.credctl.rpc.metrics.ApiOperation;
import org.apache.credctl.rpc.util.Constants;
import org.apache.credctl.service.AuthService;
import org.apache.credctl.service.ServerService;
import org.apache.credctl.utils.ApiMetadata;
import org.apache.hadoop.hbase.util.EnvironmentEdgeManager;

/**
 * JSON-RPC endpoint. A request names its method and carries one argument object:
 * <pre>
 * {"method": "Auth.Generate", "params": [{"User": "alice"}], "id": 1}
 * </pre>
 * Replies always carry {@code result}, {@code error} and the echoed {@code id}. Client errors
 * are answered with 400 and an error object holding {@code __type} and {@code message}, so
 * callers tell the error kinds apart by payload rather than status.
 */
@Path(Constants.RPC_PATH)
public class RootResource {

    private static final Logger LOG = LoggerFactory.getLogger(RootResource.class);

    static CacheControl cacheControl;

    static {
        cacheControl = new CacheControl();
        cacheControl.setNoCache(true);
        cacheControl.setNoTransform(false);
    }

    private final RPCServlet servlet;
    private final AuthService authService;

    public RootResource(RPCServlet servlet) {
        super();
        this.servlet = servlet;
        this.authService = servlet.getAuthService();
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response post(final Map<String, Object> request) {
        long startTime = EnvironmentEdgeManager.currentTime();
        servlet.getMetrics().incrementRequests(1);
        if (request == null) {
            servlet.getMetrics().incrementClientErrors();
            return errorResponse(Response.Status.BAD_REQUEST, ApiMetadata.INVALID_REQUEST,
                    "Request body is empty", null);
        }
        Object id = request.get(ApiMetadata.ID);
        Object method = request.get(ApiMetadata.METHOD);
        if (!(method instanceof String)) {
            servlet.getMetrics().incrementClientErrors();
            return errorResponse(Response.Status.BAD_REQUEST, ApiMetadata.METHOD_NOT_FOUND,
                    "Request does not name a method", id);
        }
        String api = (String) method;
        ApiOperation apiOperation;
        try {
            apiOperation = ApiOperation.fromApiName(api);
        } catch (IllegalArgumentException e) {
            LOG.debug("Unknown method {}", api);
            servlet.getMetrics().incrementClientErrors();
            return errorResponse(Response.Status.BAD_REQUEST, ApiMetadata.METHOD_NOT_FOUND,
                    "Unknown method: " + api, id);
        }
        LOG.trace("api: {}, Request: {}", api, request);

        try {
            Map<String, Object> params = getParams(request);
            final Map<String, Object> responseObject;
            switch (apiOperation) {
                case AUTH_GENERATE: {
                    responseObject = authService.generate(params);
                    break;
                }
                case AUTH_FETCH: {
                    responseObject = authService.fetch(params);
                    break;
                }
                case AUTH_RESET: {
                    responseObject = authService.reset(params);
                    break;
                }
                case SERVER_MEM_STATS: {
                    responseObject = ServerService.memStats();
                    break;
                }
                case SERVER_SYS_INFO: {
                    responseObject = ServerService.sysInfo();
                    break;
                }
                default: {
                    throw new IllegalStateException("Unhandled API: " + apiOperation);
                }
            }

            servlet.getMetrics().recordSuccessTime(apiOperation,
                    EnvironmentEdgeManager.currentTime() - startTime);

            Map<String, Object> respObj = new LinkedHashMap<>();
            respObj.put(ApiMetadata.RESULT, responseObject);
            respObj.put(ApiMetadata.ERROR, null);
            respObj.put(ApiMetadata.ID, id);
            ResponseBuilder response = Response.ok(respObj, MediaType.APPLICATION_JSON_TYPE);
            response.cacheControl(cacheControl);
            return response.build();
        } catch (CredentialServiceException e) {
            servlet.getMetrics().recordFailureTime(apiOperation,
                    EnvironmentEdgeManager.currentTime() - startTime);
            if (e.isClientError()) {
                LOG.debug("Rejected api: {}, type: {}, reason: {}", api, e.getErrorType(),
                        e.getMessage());
                servlet.getMetrics().incrementClientErrors();
                return errorResponse(Response.Status.BAD_REQUEST, e.getErrorType(),
                        e.getMessage(), id);
            }
            LOG.error("Error... api: {}", api, e);
            servlet.getMetrics().incrementServerErrors();
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR, e.getErrorType(),
                    e.getMessage(), id);
        } catch (RuntimeException e) {
            LOG.error("Error... api: {}", api, e);
            servlet.getMetrics().recordFailureTime(apiOperation,
                    EnvironmentEdgeManager.currentTime() - startTime);
            servlet.getMetrics().incrementServerErrors();
            return errorResponse(Response.Status.INTERNAL_SERVER_ERROR,
                    ApiMetadata.INTERNAL_ERROR, "Internal error while serving " + api, id);
        }
    }

    /**
     * Returns the single argument object of the request. {@code params} may be the object
     * itself or a one element array holding it; a missing {@code params} yields no arguments.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getParams(Map<String, Object> request) {
        Object params = request.get(ApiMetadata.PARAMS);
        if (params instanceof List) {
            List<Object> paramList = (List<Object>) params;
            if (paramList.isEmpty()) {
                return Collections.emptyMap();
            }
            if (paramList.size() > 1) {
                throw new InvalidArgumentException("Expected a single argument object, got "
                        + paramList.size());
            }
            params = paramList.get(0);
        }
        if (params == null) {
            return Collections.emptyMap();
        }
        if (!(params instanceof Map)) {
            throw new InvalidArgumentException("Argument must be a JSON object");
        }
        return (Map<String, Object>) params;
    }

    static Response errorResponse(Response.StatusType status, String type, String message,
            Object id) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put(ApiMetadata.EXCEPTION_TYPE, type);
        error.put(ApiMetadata.EXCEPTION_MESSAGE, message);
        Map<String, Object> respObj = new LinkedHashMap<>();
        respObj.put(ApiMetadata.RESULT, null);
        respObj.put(ApiMetadata.ERROR, error);
        respObj.put(ApiMetadata.ID, id);
        return Response.status(status).type(MediaType.APPLICATION_JSON_TYPE).entity(respObj)
                .cacheControl(cacheControl).build();
    }

}
