package com.jobscheduler.config;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Process-wide worker identity: the sole ownership token written to
 * {@code locked_by}. Generated once per process and never renewed; only lock
 * expiry is renewed.
 */
public final class WorkerIdentity {

    private static final String PROCESS_WORKER_ID = generate();

    private WorkerIdentity() {
    }

    /**
     * @return the identity generated for this process at class load
     */
    public static String current() {
        return PROCESS_WORKER_ID;
    }

    /**
     * Build a fresh identity of the form {@code worker_<host>_<pid>_<8 hex>}.
     * The random suffix keeps two workers in one JVM (tests, embedded setups) apart.
     */
    public static String generate() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "worker_" + hostName() + "_" + ProcessHandle.current().pid() + "_" + suffix;
    }

    static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }
}
