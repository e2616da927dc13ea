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

import java.util.Map;

import org.apache.hadoop.conf.Configuration;

/**
 * Adds the credential controller configuration files to a Hadoop {@link Configuration}:
 * {@value #DEFAULT_RESOURCE} shipped in the jar, overridden by {@value #SITE_RESOURCE} when it
 * is found on the classpath.
 */
public final class CredctlConfiguration {

    public static final String DEFAULT_RESOURCE = "credctl-default.xml";
    public static final String SITE_RESOURCE = "credctl-site.xml";

    private CredctlConfiguration() {
    }

    /**
     * Creates a Configuration with the credential controller resources.
     */
    public static Configuration create() {
        Configuration conf = new Configuration();
        conf.setClassLoader(CredctlConfiguration.class.getClassLoader());
        return addCredctlResources(conf);
    }

    /**
     * @param that Configuration to copy before adding the credential controller resources
     */
    public static Configuration create(Configuration that) {
        Configuration conf = create();
        for (Map.Entry<String, String> e : that) {
            conf.set(e.getKey(), e.getValue());
        }
        return conf;
    }

    public static Configuration addCredctlResources(Configuration conf) {
        conf.addResource(DEFAULT_RESOURCE);
        conf.addResource(SITE_RESOURCE);
        return conf;
    }
}
