package com.jobscheduler.engine;

import com.jobscheduler.core.AsyncJobHandler;
import com.jobscheduler.core.JobHandler;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

/**
 * In-process mapping from job type to handler. Nothing here is persisted;
 * every worker registers its handlers on startup.
 *
 * <p>Registering a type twice replaces the earlier handler (last writer wins).
 * A missing type is reported by {@link #lookup(String)} as an empty Optional
 * so the engine can fail the attempt instead of throwing.</p>
 *
 * <p>Thread Safety: backed by a {@link ConcurrentHashMap}; registration may
 * happen while the engine is dispatching.</p>
 */
public class HandlerRegistry {
    private static final Logger logger = Logger.getLogger(HandlerRegistry.class.getName());

    private final ConcurrentMap<String, JobHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Bind a synchronous handler to a job type.
     *
     * @param jobType the job type key
     * @param handler the handler to run
     * @throws IllegalArgumentException if the job type is blank or the handler is null
     */
    public void register(String jobType, JobHandler handler) {
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler must not be null for job type " + jobType);
        }

        JobHandler previous = handlers.put(jobType, handler);
        if (previous != null && previous != handler) {
            logger.warning("Handler for job type '" + jobType + "' replaced");
        } else {
            logger.fine("Registered handler for job type '" + jobType + "'");
        }
    }

    /**
     * Bind an asynchronous handler. The registered adapter blocks until the
     * returned stage completes and rethrows its failure cause, so the engine
     * treats both kinds of handler the same way.
     */
    public void registerAsync(String jobType, AsyncJobHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler must not be null for job type " + jobType);
        }
        register(jobType, parameters -> awaitStage(handler, parameters));
    }

    private static Object awaitStage(AsyncJobHandler handler, Map<String, Object> parameters)
            throws Exception {
        CompletionStage<?> stage = handler.handle(parameters);
        if (stage == null) {
            return null;
        }
        try {
            return stage.toCompletableFuture().get();
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    public Optional<JobHandler> lookup(String jobType) {
        if (jobType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(jobType));
    }

    public boolean unregister(String jobType) {
        return handlers.remove(jobType) != null;
    }

    public boolean isRegistered(String jobType) {
        return jobType != null && handlers.containsKey(jobType);
    }

    /**
     * @return the registered job types, sorted
     */
    public Set<String> registeredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }
}
