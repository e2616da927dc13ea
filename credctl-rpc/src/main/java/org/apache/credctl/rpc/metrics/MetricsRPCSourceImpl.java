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

package org.apache.credctl.rpc.metrics;

import java.util.EnumMap;
import java.util.Map;

import org.apache.hadoop.hbase.metrics.BaseSourceImpl;
import org.apache.hadoop.metrics2.MetricHistogram;
import org.apache.hadoop.metrics2.lib.MutableFastCounter;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Hadoop Two implementation of a metrics2 source that will export metrics from the RPC server
 * to the hadoop metrics2 subsystem.
 */
@InterfaceAudience.Private
public class MetricsRPCSourceImpl extends BaseSourceImpl implements MetricsRPCSource {

    private final MutableFastCounter request;
    private final MutableFastCounter clientErrors;
    private final MutableFastCounter serverErrors;
    private final Map<ApiOperation, MetricHistogram> successTimeHistograms =
            new EnumMap<>(ApiOperation.class);
    private final Map<ApiOperation, MetricHistogram> failureTimeHistograms =
            new EnumMap<>(ApiOperation.class);

    public MetricsRPCSourceImpl() {
        this(METRICS_NAME, METRICS_DESCRIPTION, CONTEXT, JMX_CONTEXT);
    }

    public MetricsRPCSourceImpl(String metricsName, String metricsDescription,
            String metricsContext, String metricsJmxContext) {
        super(metricsName, metricsDescription, metricsContext, metricsJmxContext);

        request = getMetricsRegistry().getCounter(REQUEST_KEY, 0L);
        clientErrors = getMetricsRegistry().newCounter(CLIENT_ERROR_KEY, CLIENT_ERROR_DESC, 0L);
        serverErrors = getMetricsRegistry().newCounter(SERVER_ERROR_KEY, SERVER_ERROR_DESC, 0L);

        for (ApiOperation operation : ApiOperation.values()) {
            successTimeHistograms.put(operation,
                    getMetricsRegistry().newTimeHistogram(operation.getSuccessTimeKey(),
                            operation.getSuccessTimeDesc()));
            failureTimeHistograms.put(operation,
                    getMetricsRegistry().newTimeHistogram(operation.getFailureTimeKey(),
                            operation.getFailureTimeDesc()));
        }
    }

    @Override
    public void incrementRequests(int inc) {
        request.incr(inc);
    }

    @Override
    public void incrementClientErrors(int inc) {
        clientErrors.incr(inc);
    }

    @Override
    public void incrementServerErrors(int inc) {
        serverErrors.incr(inc);
    }

    @Override
    public void recordSuccessTime(ApiOperation operation, long time) {
        successTimeHistograms.get(operation).add(time);
    }

    @Override
    public void recordFailureTime(ApiOperation operation, long time) {
        failureTimeHistograms.get(operation).add(time);
    }
}
