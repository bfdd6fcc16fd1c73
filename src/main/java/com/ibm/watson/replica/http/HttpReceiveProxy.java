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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * {@link HttpReceive} fed by a background pump which pulls inbound messages
 * from an {@link HttpBodySource} until the client disconnects.
 */
public class HttpReceiveProxy implements HttpReceive {
    private static final Logger logger = LogManager.getLogger(HttpReceiveProxy.class);

    // identity marker, never sent over the wire
    private static final HttpMessage FAILED = new HttpMessage(HttpMessage.Type.DISCONNECT, 0,
            Collections.emptyMap(), HttpMessage.NO_BODY, false);

    private final HttpBodySource source;
    private final String requestId;
    private final BlockingQueue<HttpMessage> queue = new LinkedBlockingQueue<>();

    private volatile Throwable failure;
    private volatile boolean disconnected;

    public HttpReceiveProxy(HttpBodySource source, String requestId) {
        this.source = source;
        this.requestId = requestId;
    }

    /**
     * Pumps messages into this receiver until a disconnect message arrives, the
     * source fails, or the calling thread is interrupted.
     */
    public void fetchUntilDisconnect() {
        try {
            while (true) {
                List<HttpMessage> messages = source.receiveMessages(requestId);
                for (HttpMessage msg : messages) {
                    queue.add(msg);
                    if (msg.getType() == HttpMessage.Type.DISCONNECT) {
                        return;
                    }
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            logger.warn("Failed to receive HTTP messages for request " + requestId, e);
            failure = e;
            queue.add(FAILED);
        }
    }

    /**
     * @throws IOException if the pump failed to receive messages
     */
    @Override
    public HttpMessage receive() throws IOException, InterruptedException {
        if (disconnected) {
            return HttpMessage.disconnect();
        }
        HttpMessage msg = queue.take();
        if (msg == FAILED) {
            queue.add(FAILED);
            throw new IOException("Failed to receive request body: " + failure, failure);
        }
        if (msg.getType() == HttpMessage.Type.DISCONNECT) {
            disconnected = true;
        }
        return msg;
    }
}
