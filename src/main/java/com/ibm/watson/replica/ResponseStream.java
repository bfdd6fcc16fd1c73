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

/**
 * A lazy, finite, cancellable sequence of results produced by a streaming call.
 * <p>
 * Consumed from a single thread with the usual {@code hasNext()/next()} pattern;
 * both may block until the producer makes progress, and both rethrow the
 * producer's failure once the items emitted before it have been consumed.
 * {@link #cancel()} may be called from any thread; producers stop cooperatively
 * at their next emission (or blocking point).
 *
 * @param <T> item type
 */
public interface ResponseStream<T> extends AutoCloseable {

    boolean hasNext() throws Exception;

    /**
     * @throws java.util.NoSuchElementException if the stream is exhausted
     */
    T next() throws Exception;

    /**
     * Stops the producer and discards anything not yet consumed. Has no effect
     * if the stream already completed.
     */
    void cancel();

    boolean isCancelled();

    @Override
    default void close() {
        cancel();
    }
}
