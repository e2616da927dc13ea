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

import org.apache.hadoop.metrics2.lib.DefaultMetricsSystem;
import org.apache.hadoop.metrics2.lib.MutableHistogram;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

public class MetricsRPCSourceImplTest {

    @BeforeClass
    public static void setUpBeforeClass() {
        DefaultMetricsSystem.setMiniClusterMode(true);
    }

    @Test
    public void testSourceNaming() {
        MetricsRPCSourceImpl source = new MetricsRPCSourceImpl();
        Assert.assertEquals(MetricsRPCSource.METRICS_NAME, source.getMetricsName());
        Assert.assertEquals(MetricsRPCSource.CONTEXT, source.getMetricsContext());
        Assert.assertEquals(MetricsRPCSource.JMX_CONTEXT, source.getMetricsJmxContext());
        Assert.assertEquals(MetricsRPCSource.METRICS_DESCRIPTION, source.getMetricsDescription());
    }

    @Test
    public void testCountersAndHistograms() {
        MetricsRPC metrics = new MetricsRPC();
        MetricsRPCSourceImpl source = (MetricsRPCSourceImpl) metrics.getSource();

        metrics.incrementRequests(3);
        metrics.incrementClientErrors();
        metrics.incrementServerErrors();
        metrics.incrementServerErrors();
        metrics.recordSuccessTime(ApiOperation.AUTH_GENERATE, 5);
        metrics.recordSuccessTime(ApiOperation.AUTH_GENERATE, 7);
        metrics.recordFailureTime(ApiOperation.AUTH_FETCH, 1);

        Assert.assertEquals(3, source.getMetricsRegistry()
                .getCounter(MetricsRPCSource.REQUEST_KEY, 0L).value());
        Assert.assertEquals(1, source.getMetricsRegistry()
                .getCounter(MetricsRPCSource.CLIENT_ERROR_KEY, 0L).value());
        Assert.assertEquals(2, source.getMetricsRegistry()
                .getCounter(MetricsRPCSource.SERVER_ERROR_KEY, 0L).value());

        Assert.assertEquals(2, histogramCount(source,
                ApiOperation.AUTH_GENERATE.getSuccessTimeKey()));
        Assert.assertEquals(0, histogramCount(source,
                ApiOperation.AUTH_GENERATE.getFailureTimeKey()));
        Assert.assertEquals(1, histogramCount(source,
                ApiOperation.AUTH_FETCH.getFailureTimeKey()));
        Assert.assertEquals(0, histogramCount(source,
                ApiOperation.SERVER_SYS_INFO.getSuccessTimeKey()));
    }

    private static long histogramCount(MetricsRPCSourceImpl source, String key) {
        MutableHistogram histogram = (MutableHistogram) source.getMetricsRegistry().get(key);
        Assert.assertNotNull(key, histogram);
        return histogram.getCount();
    }
}
