package com.jobscheduler.jobs;

import com.jobscheduler.core.JobHandler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

// Sends a notification email; delivery is simulated with a short delay
public class EmailNotificationHandler implements JobHandler {
    private static final Logger logger = Logger.getLogger(EmailNotificationHandler.class.getName());

    public static final String TYPE = "email_notification";
    private static final long DEFAULT_SEND_DELAY_MS = 200L;

    @Override
    public Object handle(Map<String, Object> parameters) throws Exception {
        String to = stringParam(parameters, "to");
        String subject = stringParam(parameters, "subject");
        if (to == null || to.isEmpty()) {
            throw new IllegalArgumentException("Email recipient 'to' field is required");
        }
        if (!to.contains("@")) {
            throw new IllegalArgumentException("Invalid email recipient: " + to);
        }

        logger.fine("Connecting to email server for " + to);
        Object delay = parameters.get("send_delay_ms");
        Thread.sleep(delay instanceof Number ? ((Number) delay).longValue() : DEFAULT_SEND_DELAY_MS);

        logger.info("Email sent to " + to + " (" + subject + ")");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("recipient", to);
        result.put("subject", subject);
        result.put("email_sent", true);
        return result;
    }

    private static String stringParam(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        return value == null ? null : value.toString();
    }
}
