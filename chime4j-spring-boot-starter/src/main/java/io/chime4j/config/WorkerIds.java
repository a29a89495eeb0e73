package io.chime4j.config;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Lock owner ids for the tick lock.
 */
final class WorkerIds {
    private WorkerIds() {
    }

    /**
     * The configured id, or "host-pid-uuid" when none is set.
     */
    static String resolve(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "chime4j";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            // keep the fallback host name
        }

        String pid = Long.toString(ManagementFactory.getRuntimeMXBean().getPid());

        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        return generated.length() > 128 ? generated.substring(0, 128) : generated;
    }
}
