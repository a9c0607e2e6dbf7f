package com.jobscheduler.engine;

import org.json.JSONException;
import org.json.JSONObject;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Diagnostic snapshot stored with every execution row, so a failed attempt
 * can be traced back to the process and host that ran it.
 */
final class EnvironmentInfo {
    private static final Logger logger = Logger.getLogger(EnvironmentInfo.class.getName());
    private static final long MB = 1024L * 1024L;

    private EnvironmentInfo() {
    }

    static String capture(String workerId, Instant now) {
        long pid = ProcessHandle.current().pid();
        try {
            Runtime runtime = Runtime.getRuntime();
            JSONObject info = new JSONObject();
            info.put("worker_id", workerId);
            info.put("pid", pid);
            info.put("host", InetAddress.getLocalHost().getHostName());
            info.put("available_processors", runtime.availableProcessors());
            info.put("memory_total_mb", runtime.totalMemory() / MB);
            info.put("memory_free_mb", runtime.freeMemory() / MB);
            info.put("memory_max_mb", runtime.maxMemory() / MB);
            info.put("timestamp", now.toString());
            return info.toString();
        } catch (UnknownHostException | JSONException e) {
            logger.log(Level.FINE, "Partial environment snapshot for " + workerId, e);
            JSONObject fallback = new JSONObject();
            fallback.put("worker_id", workerId);
            fallback.put("pid", pid);
            fallback.put("error", e.getMessage());
            return fallback.toString();
        }
    }
}
