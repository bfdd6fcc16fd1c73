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

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.apache.logging.log4j.ThreadContext;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;

/**
 * {@link ResponseStream} fed by a handler method which emits its items to a
 * {@link StreamObserver}. The method runs on its own worker thread, holding the
 * handler's read lock for its whole lifetime, and is decoupled from the
 * consumer by a small bounded buffer.
 * <p>
 * The stream completes when the method returns (or calls {@code onCompleted()}),
 * and fails when it throws (or calls {@code onError()}).
 */
final class ObserverResponseStream implements ResponseStream<Object>, StreamObserver<Object> {
    static final int BUFFER_SIZE = 16;

    private static final Object END = new Object();
    private static final Object NULL_ITEM = new Object();
    private static final Object CANCELLED = new Object();

    private static final class Failure {
        final Throwable cause;

        Failure(Throwable cause) {
            this.cause = cause;
        }
    }

    @FunctionalInterface
    interface Producer {
        void produce(StreamObserver<Object> observer) throws Exception;
    }

    private final String methodName;
    private final ItemMapper mapper;
    private final Context.CancellableContext context;
    private final Map<String, String> logContext;
    private final BlockingQueue<Object> buffer = new LinkedBlockingQueue<>(BUFFER_SIZE);
    private final AtomicBoolean terminated = new AtomicBoolean();

    private volatile boolean cancelled;
    private volatile ListenableFuture<?> producerFuture;

    // consumer-side state
    private boolean exhausted;
    private boolean hasLookahead;
    private Object lookahead;

    ObserverResponseStream(String methodName, ItemMapper mapper) {
        this.methodName = methodName;
        this.mapper = mapper;
        // inherits the calling request's context values
        this.context = Context.current().withCancellation();
        this.logContext = ThreadContext.getImmutableContext();
    }

    /**
     * Starts the producer on the given executor. It acquires {@code readLock}
     * before invoking the handler method and releases it when the method returns.
     * The calling thread's log context is applied to the producer thread.
     */
    ObserverResponseStream start(ListeningExecutorService executor, Lock readLock, Producer producer) {
        producerFuture = executor.submit(context.wrap(() -> {
            ThreadContext.putAll(logContext);
            try {
                readLock.lockInterruptibly();
                try {
                    producer.produce(this);
                } finally {
                    readLock.unlock();
                }
                onCompleted();
            } catch (Throwable t) {
                onError(t);
            } finally {
                ThreadContext.removeAll(logContext.keySet());
            }
        }));
        if (cancelled) {
            producerFuture.cancel(true);
        }
        return this;
    }

    Context.CancellableContext getContext() {
        return context;
    }

    // ---- producer side

    @Override
    public void onNext(Object value) {
        if (cancelled || context.isCancelled()) {
            throw Status.CANCELLED.withDescription("response stream cancelled").asRuntimeException();
        }
        if (terminated.get()) {
            throw new IllegalStateException("onNext called after stream was completed");
        }
        try {
            buffer.put(value != null ? value : NULL_ITEM);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw Status.CANCELLED.withCause(ie).asRuntimeException();
        }
    }

    @Override
    public void onError(Throwable t) {
        terminate(new Failure(t));
    }

    @Override
    public void onCompleted() {
        terminate(END);
    }

    private void terminate(Object marker) {
        if (!terminated.compareAndSet(false, true) || cancelled) {
            return;
        }
        try {
            buffer.put(marker);
        } catch (InterruptedException ie) {
            // only interrupted when the consumer cancelled
            Thread.currentThread().interrupt();
        }
    }

    // ---- consumer side

    @Override
    public synchronized boolean hasNext() throws Exception {
        if (hasLookahead) {
            return true;
        }
        if (exhausted || cancelled) {
            return false;
        }
        Object item;
        try {
            item = buffer.take();
        } catch (InterruptedException ie) {
            cancel();
            throw ie;
        }
        if (item == END || item == CANCELLED || cancelled) {
            exhausted = true;
            return false;
        }
        if (item instanceof Failure) {
            exhausted = true;
            Throwable cause = ((Failure) item).cause;
            if (cause instanceof ReplicaException) {
                throw (ReplicaException) cause;
            }
            throw UserCodeException.wrap(methodName, cause);
        }
        lookahead = mapper.map(item == NULL_ITEM ? null : item);
        hasLookahead = true;
        return true;
    }

    @Override
    public synchronized Object next() throws Exception {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Object item = lookahead;
        lookahead = null;
        hasLookahead = false;
        return item;
    }

    @Override
    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        context.cancel(null);
        ListenableFuture<?> future = producerFuture;
        if (future != null) {
            future.cancel(true);
        }
        // unblock a producer waiting for space, then a consumer waiting for an item
        buffer.clear();
        buffer.offer(CANCELLED);
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }
}
