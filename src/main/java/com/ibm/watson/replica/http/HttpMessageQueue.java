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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates the messages sent by a handler so that they can be collected
 * in batches by another thread.
 */
public class HttpMessageQueue implements HttpSend {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final List<HttpMessage> buffer = new ArrayList<>();
    private boolean closed;

    /**
     * @throws IOException if the queue has been closed
     */
    @Override
    public void send(HttpMessage message) throws IOException {
        lock.lock();
        try {
            if (closed) {
                throw new IOException("Response stream is closed, can't send " + message);
            }
            buffer.add(message);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until there's at least one message buffered or the queue is closed.
     *
     * @return true if there are buffered messages
     */
    public boolean awaitMessages() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                changed.await();
            }
            return !buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return all buffered messages in the order they were sent, possibly none
     */
    public List<HttpMessage> drainMessages() {
        lock.lock();
        try {
            if (buffer.isEmpty()) {
                return Collections.emptyList();
            }
            List<HttpMessage> messages = new ArrayList<>(buffer);
            buffer.clear();
            return messages;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rejects further sends and wakes any waiter. Already-buffered messages may
     * still be drained.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
