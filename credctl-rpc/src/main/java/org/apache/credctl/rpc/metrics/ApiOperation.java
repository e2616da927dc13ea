package org.apache.credctl.rpc.metrics;

import org.apache.credctl.utils.ApiMetadata;

/**
 * The closed set of RPC methods served by the gateway.
 */
public enum ApiOperation {
    AUTH_GENERATE(ApiMetadata.AUTH_GENERATE, "AuthGenerate"),
    AUTH_FETCH(ApiMetadata.AUTH_FETCH, "AuthFetch"),
    AUTH_RESET(ApiMetadata.AUTH_RESET, "AuthReset"),
    SERVER_MEM_STATS(ApiMetadata.SERVER_MEM_STATS, "ServerMemStats"),
    SERVER_SYS_INFO(ApiMetadata.SERVER_SYS_INFO, "ServerSysInfo");

    private final String apiName;
    private final String metricPrefix;

    ApiOperation(String apiName, String metricPrefix) {
        this.apiName = apiName;
        this.metricPrefix = metricPrefix;
    }

    public String getApiName() {
        return apiName;
    }

    public String getSuccessTimeKey() {
        return metricPrefix + "SuccessTime";
    }

    public String getFailureTimeKey() {
        return metricPrefix + "FailureTime";
    }

    public String getSuccessTimeDesc() {
        return "Time duration in milliseconds for successful " + this.apiName;
    }

    public String getFailureTimeDesc() {
        return "Time duration in milliseconds for failed " + this.apiName;
    }

    public static ApiOperation fromApiName(String apiName) {
        for (ApiOperation op : values()) {
            if (op.getApiName().equals(apiName)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown API: " + apiName);
    }
}
