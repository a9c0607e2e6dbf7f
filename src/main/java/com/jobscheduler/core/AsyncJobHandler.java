package com.jobscheduler.core;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Handler variant that completes asynchronously. The engine still awaits the
 * returned stage before it finalizes the attempt.
 *
 * @see com.jobscheduler.engine.HandlerRegistry#registerAsync(String, AsyncJobHandler)
 */
@FunctionalInterface
public interface AsyncJobHandler {

    CompletionStage<?> handle(Map<String, Object> parameters) throws Exception;
}
