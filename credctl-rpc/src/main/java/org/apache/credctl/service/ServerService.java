package org.apache.credctl.service;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.hadoop.hbase.util.DNS;
import org.apache.hadoop.hbase.util.Strings;

/**
 * Serves the {@code Server.*} RPC methods: point in time snapshots of the memory and the host
 * of this JVM.
 */
public class ServerService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerService.class);

    private static volatile String hostName;

    public static Map<String, Object> memStats() {
        MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
        Runtime runtime = Runtime.getRuntime();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("Heap", toMap(memoryBean.getHeapMemoryUsage()));
        response.put("NonHeap", toMap(memoryBean.getNonHeapMemoryUsage()));
        response.put("FreeMemory", runtime.freeMemory());
        response.put("TotalMemory", runtime.totalMemory());
        response.put("MaxMemory", runtime.maxMemory());
        response.put("PendingFinalization", memoryBean.getObjectPendingFinalizationCount());

        List<Map<String, Object>> pools = new ArrayList<>();
        for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
            Map<String, Object> poolStats = new LinkedHashMap<>();
            poolStats.put("Name", pool.getName());
            poolStats.put("Type", pool.getType().name());
            MemoryUsage usage = pool.getUsage();
            if (usage != null) {
                poolStats.put("Usage", toMap(usage));
            }
            pools.add(poolStats);
        }
        response.put("Pools", pools);

        List<Map<String, Object>> collectors = new ArrayList<>();
        for (GarbageCollectorMXBean gc : ManagementFactory.getGarbageCollectorMXBeans()) {
            Map<String, Object> gcStats = new LinkedHashMap<>();
            gcStats.put("Name", gc.getName());
            gcStats.put("Collections", gc.getCollectionCount());
            gcStats.put("CollectionTime", gc.getCollectionTime());
            collectors.add(gcStats);
        }
        response.put("GarbageCollectors", collectors);
        return response;
    }

    public static Map<String, Object> sysInfo() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        RuntimeMXBean runtime = ManagementFactory.getRuntimeMXBean();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("SysARCH", os.getArch());
        response.put("SysOS", os.getName());
        response.put("SysOSVersion", os.getVersion());
        response.put("SysCPUS", os.getAvailableProcessors());
        response.put("SystemLoadAverage", os.getSystemLoadAverage());
        response.put("Threads", ManagementFactory.getThreadMXBean().getThreadCount());
        response.put("JavaVersion", System.getProperty("java.version"));
        response.put("JavaVendor", runtime.getVmVendor());
        response.put("JavaHome", System.getProperty("java.home"));
        response.put("Hostname", getHostName());
        response.put("StartTime", runtime.getStartTime());
        response.put("Uptime", runtime.getUptime());
        return response;
    }

    private static Map<String, Object> toMap(MemoryUsage usage) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("Init", usage.getInit());
        map.put("Used", usage.getUsed());
        map.put("Committed", usage.getCommitted());
        map.put("Max", usage.getMax());
        return map;
    }

    /**
     * Resolved on first use and cached; a name lookup may block on DNS.
     */
    static String getHostName() {
        String name = hostName;
        if (name == null) {
            try {
                name = Strings.domainNamePointerToHostName(DNS.getDefaultHost("default",
                        "default"));
            } catch (UnknownHostException e) {
                LOGGER.warn("Could not resolve local host name", e);
                name = "unknown";
            }
            hostName = name;
        }
        return name;
    }
}
