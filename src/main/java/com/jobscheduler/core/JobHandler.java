package com.jobscheduler.core;

import java.util.Map;

/**
 * Business callback bound to a job type in the handler registry.
 *
 * <p>The engine passes the job's stored parameters verbatim and records the
 * returned value as the job's result. Any exception marks the attempt as
 * failed and goes through the retry-or-fail accounting.</p>
 *
 * <p>Handlers must be idempotent: a handler that outlives its lock can be
 * started a second time by another worker.</p>
 *
 * @see AsyncJobHandler
 * @see com.jobscheduler.engine.HandlerRegistry
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Run the job.
     *
     * @param parameters the job's parameters, never null (empty when none were given)
     * @return a result value to store with the job, may be null
     * @throws Exception if the attempt failed
     */
    Object handle(Map<String, Object> parameters) throws Exception;
}
