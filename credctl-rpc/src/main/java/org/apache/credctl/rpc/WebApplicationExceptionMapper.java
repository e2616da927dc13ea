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

import org.apache.hbase.thirdparty.javax.ws.rs.WebApplicationException;
import org.apache.hbase.thirdparty.javax.ws.rs.core.Response;
import org.apache.hbase.thirdparty.javax.ws.rs.ext.ExceptionMapper;
import org.apache.hbase.thirdparty.javax.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.credctl.utils.ApiMetadata;

/**
 * Renders errors raised by the container itself, such as an unsupported media type or HTTP
 * method, as an {@code InvalidRequest} reply. The original status and {@code Allow} header are
 * kept.
 */
@Provider
public class WebApplicationExceptionMapper implements ExceptionMapper<WebApplicationException> {

    private static final Logger LOG = LoggerFactory.getLogger(WebApplicationExceptionMapper.class);

    @Override
    public Response toResponse(WebApplicationException e) {
        Response original = e.getResponse();
        LOG.debug("Rejected request with status {}: {}", original.getStatus(), e.getMessage());
        Response error = RootResource.errorResponse(original.getStatusInfo(),
                ApiMetadata.INVALID_REQUEST, e.getMessage(), null);
        if (original.getAllowedMethods().isEmpty()) {
            return error;
        }
        return Response.fromResponse(error).allow(original.getAllowedMethods()).build();
    }
}
