package io.recovery.util;

import java.util.UUID;

/**
 * Default identities for consumers, processors and lock holders.
 */
public final class Identities {

    private Identities() {
    }

    /**
     * Returns the {@code HOSTNAME} environment variable, or {@code worker-<pid>}
     * when it is not set.
     */
    public static String defaultWorkerId() {
        String host = System.getenv("HOSTNAME");
        if (host != null && !host.isBlank()) {
            return host;
        }
        return "worker-" + ProcessHandle.current().pid();
    }

    /**
     * Returns a process-unique holder id: {@code <prefix>:<worker id>:<8 hex chars>}.
     */
    public static String uniqueHolderId(String prefix) {
        return prefix + ":" + defaultWorkerId() + ":" + UUID.randomUUID().toString().substring(0, 8);
    }
}
