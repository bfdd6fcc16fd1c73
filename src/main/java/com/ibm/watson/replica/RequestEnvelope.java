/*
 * Copyright 2021 IBM Corporation
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy
 * of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.ibm.watson.replica;

import com.ibm.watson.replica.metrics.MetricsRecorder;
import io.grpc.Context;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-request bookkeeping: the request's context, timing, and the single
 * access log record and metrics observation made when it completes.
 */
final class RequestEnvelope {
    private static final Logger logger = LogManager.getLogger(RequestEnvelope.class);
    private static final Logger accessLogger = LogManager.getLogger(ReplicaLogging.ACCESS_LOGGER_NAME);

    private final RequestMetadata metadata;
    private final Map<String, String> logContext;
    private final Context.CancellableContext context;
    private final MetricsRecorder metrics;
    private final boolean accessLog;
    private final Runnable onComplete;
    private final AtomicBoolean completed = new AtomicBoolean();

    private volatile long startNanos = System.nanoTime();

    /**
     * @param onComplete run once when the request completes
     */
    RequestEnvelope(RequestMetadata metadata, String appName, MetricsRecorder metrics, boolean accessLog,
                    Runnable onComplete) {
        ReplicaRequestContext requestContext = new ReplicaRequestContext(metadata.getRoute(),
                metadata.getRequestId(), appName, metadata.getMultiplexedModelId(), metadata.getGrpcContext());
        this.metadata = metadata;
        this.logContext = requestContext.toLogContext();
        this.context = Context.current().withValue(ReplicaRequestContext.KEY, requestContext).withCancellation();
        this.metrics = metrics;
        this.accessLog = accessLog;
        this.onComplete = onComplete;
    }

    /**
     * Resets the start time, for requests which were queued before running.
     */
    void markStarted() {
        startNanos = System.nanoTime();
    }

    /**
     * Makes the request's context current on this thread.
     *
     * @return to be passed to {@link #detach(Context)}
     */
    Context attach() {
        ThreadContext.putAll(logContext);
        return context.attach();
    }

    void detach(Context previous) {
        context.detach(previous);
        ThreadContext.removeAll(logContext.keySet());
    }

    Context.CancellableContext getContext() {
        return context;
    }

    boolean isCompleted() {
        return completed.get();
    }

    /**
     * Records the outcome of the request. Only the first call has any effect.
     *
     * @param failure null if the request succeeded
     */
    void complete(Throwable failure) {
        if (!completed.compareAndSet(false, true)) {
            return;
        }
        try {
            double latencyMillis = (System.nanoTime() - startNanos) / 1_000_000.0;
            RequestStatus status = RequestStatus.of(failure);
            if (accessLog) {
                accessLogger.info(ReplicaLogging.accessLogMessage(metadata.getCallMethod(), status, latencyMillis));
            }
            metrics.recordRequest(metadata.getRoute(), status, latencyMillis, status == RequestStatus.ERROR);
            if (status == RequestStatus.ERROR) {
                logger.error("Request " + metadata.getRequestId() + " failed", failure);
            }
        } finally {
            context.cancel(null);
            onComplete.run();
        }
    }
}
