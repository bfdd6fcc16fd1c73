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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.locks.Lock;
import java.util.stream.BaseStream;

/**
 * {@link ResponseStream} over a synchronous sequence returned by a handler
 * method. Items are pulled on the consumer's thread, each pull holding the
 * handler's read lock.
 * <p>
 * The lock is not held between pulls, so a reconfigure may take effect part
 * way through the sequence. This differs from {@link ObserverResponseStream},
 * whose producer runs the handler method under the read lock until it
 * returns: there the handler code is running for the stream's whole life,
 * whereas here it only runs during a pull.
 */
final class IteratorResponseStream implements ResponseStream<Object> {
    private static final Logger logger = LogManager.getLogger(IteratorResponseStream.class);

    private final String methodName;
    private final Iterator<?> iterator;
    private final AutoCloseable source;
    private final Lock readLock;
    private final ItemMapper mapper;

    private volatile boolean cancelled;
    private boolean exhausted;
    private boolean hasLookahead;
    private Object lookahead;

    private IteratorResponseStream(String methodName, Iterator<?> iterator, AutoCloseable source,
                                   Lock readLock, ItemMapper mapper) {
        this.methodName = methodName;
        this.iterator = iterator;
        this.source = source;
        this.readLock = readLock;
        this.mapper = mapper;
    }

    /**
     * @param sequence an {@link Iterator} or a {@link BaseStream}
     */
    static IteratorResponseStream of(String methodName, Object sequence, Lock readLock, ItemMapper mapper) {
        if (sequence instanceof BaseStream) {
            BaseStream<?, ?> stream = (BaseStream<?, ?>) sequence;
            return new IteratorResponseStream(methodName, stream.iterator(), stream, readLock, mapper);
        }
        Iterator<?> it = (Iterator<?>) sequence;
        return new IteratorResponseStream(methodName, it, it instanceof AutoCloseable ? (AutoCloseable) it : null,
                readLock, mapper);
    }

    static boolean isSequence(Object value) {
        return value instanceof Iterator || value instanceof BaseStream;
    }

    @Override
    public synchronized boolean hasNext() throws Exception {
        if (hasLookahead) {
            return true;
        }
        if (exhausted || cancelled) {
            return false;
        }
        Object item;
        readLock.lock();
        try {
            if (!iterator.hasNext()) {
                exhausted = true;
                closeSource();
                return false;
            }
            item = iterator.next();
        } catch (RuntimeException e) {
            exhausted = true;
            closeSource();
            throw UserCodeException.wrap(methodName, e);
        } finally {
            readLock.unlock();
        }
        lookahead = mapper.map(item);
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
        if (!cancelled) {
            cancelled = true;
            closeSource();
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    private void closeSource() {
        if (source != null) {
            try {
                source.close();
            } catch (Exception e) {
                logger.warn("Error closing sequence returned by method " + methodName, e);
            }
        }
    }
}
