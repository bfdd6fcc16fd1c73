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

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.ibm.watson.replica.DeploymentId;
import com.ibm.watson.replica.JavaObjectSerializer;
import com.ibm.watson.replica.RequestArgs;
import com.ibm.watson.replica.RequestMetadata;
import com.ibm.watson.replica.UserCallableHost;
import com.ibm.watson.replica.UserCodeException;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class StreamingResponseBridgeTest {
    private static final RequestMetadata MD = RequestMetadata.newBuilder("req-7").route("/stream")
            .http(true).streaming(true).build();

    private final ListeningExecutorService executor = MoreExecutors.listeningDecorator(
            Executors.newCachedThreadPool());

    /**
     * Echoes the request body back in chunks, one per word.
     */
    public static class ChunkedEcho implements HttpApp {
        @Override
        public void call(HttpScope scope, HttpReceive receive, HttpSend send) throws Exception {
            String body = new HttpRequest(scope, receive).text();
            send.send(HttpMessage.responseStart(200, Collections.emptyMap()));
            for (String word : body.split(" ")) {
                send.send(HttpMessage.responseBody(word.getBytes(StandardCharsets.UTF_8), true));
                Thread.sleep(5);
            }
            send.send(HttpMessage.responseBody(HttpMessage.NO_BODY, false));
        }
    }

    public static class SendsRequestId implements HttpApp {
        @Override
        public void call(HttpScope scope, HttpReceive receive, HttpSend send) throws Exception {
            send.send(HttpMessage.responseStart(200, Collections.emptyMap()));
            String requestId = String.valueOf(ThreadContext.get("request_id"));
            send.send(HttpMessage.responseBody(requestId.getBytes(StandardCharsets.UTF_8), false));
        }
    }

    public static class FailsAfterStart implements HttpApp {
        @Override
        public void call(HttpScope scope, HttpReceive receive, HttpSend send) throws Exception {
            send.send(HttpMessage.responseStart(200, Collections.emptyMap()));
            throw new IllegalStateException("broken mid-stream");
        }
    }

    public static class WaitsForever implements HttpApp {
        static volatile CountDownLatch interrupted;

        @Override
        public void call(HttpScope scope, HttpReceive receive, HttpSend send) throws Exception {
            send.send(HttpMessage.responseStart(200, Collections.emptyMap()));
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException ie) {
                interrupted.countDown();
                throw ie;
            }
        }
    }

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private UserCallableHost host(Class<? extends HttpApp> app) throws Exception {
        UserCallableHost host = new UserCallableHost(app, RequestArgs.EMPTY, new DeploymentId("stream", "app"),
                JavaObjectSerializer.INSTANCE, executor);
        host.initializeCallable();
        return host;
    }

    /**
     * Source which hands out the given batches and then blocks until interrupted.
     */
    private static HttpBodySource sourceOf(List<List<HttpMessage>> batches, CountDownLatch pumpInterrupted) {
        BlockingQueue<List<HttpMessage>> queue = new LinkedBlockingQueue<>(batches);
        return requestId -> {
            try {
                return queue.take();
            } catch (InterruptedException ie) {
                pumpInterrupted.countDown();
                throw ie;
            }
        };
    }

    private static HttpMessage body(String text, boolean more) {
        return HttpMessage.requestBody(text.getBytes(StandardCharsets.UTF_8), more);
    }

    @Test
    void testHandlerLogsWithCallerLogContext() throws Exception {
        StreamingResponseBridge stream;
        ThreadContext.put("request_id", "req-7");
        try {
            stream = StreamingResponseBridge.start(host(SendsRequestId.class), MD,
                    StreamingHttpRequest.of(HttpScope.of("POST", "/stream", Collections.emptyMap()),
                            sourceOf(Collections.emptyList(), new CountDownLatch(1))), executor);
        } finally {
            ThreadContext.remove("request_id");
        }
        List<HttpMessage> messages = new ArrayList<>();
        while (stream.hasNext()) {
            messages.addAll(HttpMessageBatchSerializer.deserialize(stream.next()));
        }
        HttpMessage last = messages.get(messages.size() - 1);
        assertEquals("req-7", new String(last.getBody(), StandardCharsets.UTF_8));
    }

    @Test
    void testBatchesPreserveOrder() throws Exception {
        HttpBodySource source = sourceOf(List.of(List.of(body("a b ", true)), List.of(body("c d", false))),
                new CountDownLatch(1));
        StreamingResponseBridge stream = StreamingResponseBridge.start(host(ChunkedEcho.class), MD,
                StreamingHttpRequest.of(HttpScope.of("POST", "/stream", Collections.emptyMap()), source),
                executor);

        List<HttpMessage> messages = new ArrayList<>();
        while (stream.hasNext()) {
            messages.addAll(HttpMessageBatchSerializer.deserialize(stream.next()));
        }
        assertEquals(HttpMessage.Type.RESPONSE_START, messages.get(0).getType());
        StringBuilder sb = new StringBuilder();
        for (HttpMessage msg : messages.subList(1, messages.size())) {
            assertEquals(HttpMessage.Type.RESPONSE_BODY, msg.getType());
            sb.append(new String(msg.getBody(), StandardCharsets.UTF_8)).append('|');
        }
        assertEquals("a|b|c|d||", sb.toString());
        assertFalse(messages.get(messages.size() - 1).isMoreBody());
        assertFalse(stream.isCancelled());
    }

    @Test
    void testFailureRethrownAfterFinalBatch() throws Exception {
        StreamingResponseBridge stream = StreamingResponseBridge.start(host(FailsAfterStart.class), MD,
                StreamingHttpRequest.of(HttpScope.of("GET", "/stream", Collections.emptyMap()),
                        sourceOf(List.of(), new CountDownLatch(1))), executor);

        List<HttpMessage> messages = new ArrayList<>();
        UserCodeException uce = assertThrows(UserCodeException.class, () -> {
            while (stream.hasNext()) {
                messages.addAll(HttpMessageBatchSerializer.deserialize(stream.next()));
            }
        });
        assertTrue(uce.getMessage().contains("broken mid-stream"), uce.getMessage());
        // the handler's own start message, then the 500 error response
        assertEquals(200, messages.get(0).getStatus());
        assertEquals(500, messages.get(1).getStatus());
        assertFalse(stream.hasNext());
    }

    @Test
    void testCancelStopsHandlerAndPump() throws Exception {
        WaitsForever.interrupted = new CountDownLatch(1);
        CountDownLatch pumpStarted = new CountDownLatch(1), pumpInterrupted = new CountDownLatch(1);
        HttpBodySource source = sourceOf(List.of(), pumpInterrupted);
        StreamingResponseBridge stream = StreamingResponseBridge.start(host(WaitsForever.class), MD,
                StreamingHttpRequest.of(HttpScope.of("GET", "/stream", Collections.emptyMap()), requestId -> {
                    pumpStarted.countDown();
                    return source.receiveMessages(requestId);
                }), executor);
        assertTrue(pumpStarted.await(5, TimeUnit.SECONDS));

        List<HttpMessage> first = HttpMessageBatchSerializer.deserialize(stream.next());
        assertEquals(HttpMessage.Type.RESPONSE_START, first.get(0).getType());

        stream.cancel();
        assertTrue(stream.isCancelled());
        assertTrue(WaitsForever.interrupted.await(5, TimeUnit.SECONDS));
        assertTrue(pumpInterrupted.await(5, TimeUnit.SECONDS));
        assertFalse(stream.hasNext());
    }

    @Test
    void testInvalidScopeRejected() throws Exception {
        UserCallableHost host = host(ChunkedEcho.class);
        StreamingHttpRequest request = new StreamingHttpRequest("not json".getBytes(StandardCharsets.UTF_8),
                sourceOf(List.of(), new CountDownLatch(1)));
        assertThrows(IOException.class, () -> StreamingResponseBridge.start(host, MD, request, executor));
    }
}
