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

package com.ibm.watson.replica.http;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.ibm.watson.replica.RequestArgs;
import com.ibm.watson.replica.RequestMetadata;
import com.ibm.watson.replica.ResponseStream;
import com.ibm.watson.replica.UserCallableHost;
import io.grpc.Context;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;

/**
 * Streams the response of an HTTP call as it is produced.
 * <p>
 * The handler is dispatched as a unary HTTP call on one task while a second
 * task pumps the inbound request messages to it. Each element of this stream is
 * a serialized batch (see {@link HttpMessageBatchSerializer}) of the messages
 * which the handler sent since the previous element. The stream ends after the
 * batch which follows completion of the handler, and then rethrows the
 * handler's failure if it had one.
 */
public final class StreamingResponseBridge implements ResponseStream<byte[]> {
    private static final Logger logger = LogManager.getLogger(StreamingResponseBridge.class);

    private final String requestId;
    private final HttpMessageQueue sendQueue = new HttpMessageQueue();
    private final Context.CancellableContext context;
    private final ListenableFuture<?> pumpTask;
    private final ListenableFuture<Object> dispatchTask;

    private volatile boolean cancelled;
    private boolean finished;
    private boolean hasLookahead;
    private byte[] lookahead;

    private StreamingResponseBridge(UserCallableHost host, RequestMetadata metadata, HttpScope scope,
                                    HttpReceiveProxy receive, ListeningExecutorService executor) {
        this.requestId = metadata.getRequestId();
        this.context = Context.current().withCancellation();
        this.pumpTask = executor.submit(context.wrap(receive::fetchUntilDisconnect));
        ListenableFuture<Object> dispatch;
        try {
            // the handler logs with the caller's request log context
            Map<String, String> logContext = ThreadContext.getImmutableContext();
            dispatch = executor.submit(context.wrap(() -> {
                ThreadContext.putAll(logContext);
                try {
                    return host.callUserMethod(metadata, RequestArgs.of(scope, receive, sendQueue));
                } finally {
                    ThreadContext.removeAll(logContext.keySet());
                }
            }));
        } catch (RuntimeException e) {
            pumpTask.cancel(true);
            context.cancel(e);
            throw e;
        }
        this.dispatchTask = dispatch;
        dispatchTask.addListener(sendQueue::close, MoreExecutors.directExecutor());
    }

    /**
     * Starts the receive pump and the handler call.
     *
     * @param metadata metadata of an HTTP request
     * @param executor runs both the pump and the handler call
     * @throws IOException if the request's scope can't be parsed
     */
    public static StreamingResponseBridge start(UserCallableHost host, RequestMetadata metadata,
                                                StreamingHttpRequest request, ListeningExecutorService executor)
            throws IOException {
        HttpScope scope = HttpScope.fromJson(request.getScopeJson());
        HttpReceiveProxy receive = new HttpReceiveProxy(request.getBodySource(), metadata.getRequestId());
        return new StreamingResponseBridge(host, metadata, scope, receive, executor);
    }

    @Override
    public synchronized boolean hasNext() throws Exception {
        if (hasLookahead) {
            return true;
        }
        if (finished || cancelled) {
            return false;
        }
        try {
            while (true) {
                sendQueue.awaitMessages();
                // must be checked before draining so that no message sent before completion is missed
                boolean dispatchDone = dispatchTask.isDone();
                List<HttpMessage> batch = sendQueue.drainMessages();
                if (!batch.isEmpty()) {
                    lookahead = HttpMessageBatchSerializer.serialize(batch);
                    hasLookahead = true;
                    return true;
                }
                if (dispatchDone) {
                    finish();
                    return false;
                }
                if (cancelled) {
                    return false;
                }
            }
        } catch (InterruptedException ie) {
            cancel();
            throw ie;
        }
    }

    private void finish() throws Exception {
        finished = true;
        cleanup();
        try {
            dispatchTask.get();
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw (Exception) cause;
        }
    }

    @Override
    public synchronized byte[] next() throws Exception {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        byte[] batch = lookahead;
        lookahead = null;
        hasLookahead = false;
        return batch;
    }

    @Override
    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        if (!dispatchTask.isDone()) {
            logger.info("Cancelling streaming HTTP request " + requestId);
        }
        cleanup();
    }

    private void cleanup() {
        pumpTask.cancel(true);
        dispatchTask.cancel(true);
        context.cancel(null);
        sendQueue.close();
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }
}
