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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.protobuf.StringValue;
import com.ibm.watson.replica.http.HttpApp;
import com.ibm.watson.replica.http.HttpMessage;
import com.ibm.watson.replica.http.HttpReceive;
import com.ibm.watson.replica.http.HttpRequest;
import com.ibm.watson.replica.http.HttpScope;
import com.ibm.watson.replica.http.HttpSend;
import com.ibm.watson.replica.multiplex.ModelMultiplexer;
import com.ibm.watson.replica.multiplex.MultiplexedHandler;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.apache.logging.log4j.ThreadContext;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Handler classes used by the replica tests.
 */
final class SampleHandlers {

    private SampleHandlers() {}

    public static class Greeter implements AutoCloseable {
        final AtomicInteger closeCount = new AtomicInteger();
        final CountDownLatch producerStarted = new CountDownLatch(1);
        private volatile String greeting = "hi";

        public Greeter() {}

        public Greeter(String greeting) {
            this.greeting = greeting;
        }

        public String call(String name) {
            return greeting + " " + name;
        }

        public String greet(String name, String punctuation) {
            return greeting + " " + name + punctuation;
        }

        public void reconfigure(Map<String, Object> config) {
            String newGreeting = (String) config.get("greeting");
            if ("fail".equals(newGreeting)) {
                throw new IllegalArgumentException("bad greeting");
            }
            greeting = newGreeting;
        }

        public Iterator<Integer> countUp(int n) {
            return IntStream.range(0, n).iterator();
        }

        public Stream<String> words(String text) {
            return Arrays.stream(text.split(" "));
        }

        public void emit(int n, StreamObserver<Integer> observer) {
            for (int i = 0; i < n; i++) {
                observer.onNext(i);
            }
        }

        public void emitForever(StreamObserver<Integer> observer) {
            producerStarted.countDown();
            for (int i = 0; ; i++) {
                observer.onNext(i);
            }
        }

        public void emitAfter(CountDownLatch release, StreamObserver<String> observer)
                throws InterruptedException {
            producerStarted.countDown();
            release.await();
            observer.onNext("late");
        }

        public void emitRequestId(StreamObserver<String> observer) {
            observer.onNext(ThreadContext.get(ReplicaRequestContext.REQUEST_ID_LOG_KEY));
        }

        public void failingEmit(StreamObserver<String> observer) {
            observer.onNext("a");
            throw new IllegalStateException("boom");
        }

        public ListenableFuture<String> later(String s) {
            return Futures.immediateFuture(s.toUpperCase());
        }

        public CompletionStage<String> laterStage(String s) {
            return CompletableFuture.completedFuture(s + "!");
        }

        public String fail() {
            throw new IllegalStateException("user failure");
        }

        public Object lazy() {
            return List.of("a", "b").iterator();
        }

        public String hello(HttpRequest request) throws Exception {
            return "hello " + request.text();
        }

        public Map<String, Object> status() {
            return Collections.singletonMap("ok", true);
        }

        public void cancelled() {
            throw Status.CANCELLED.asRuntimeException();
        }

        public StringValue echo(StringValue request, GrpcRequestContext context) {
            context.setDetails("echoed");
            return StringValue.of("echo " + request.getValue());
        }

        public String shout(String s) {
            return s.toUpperCase() + "!";
        }

        public Iterator<StringValue> spell(StringValue word) {
            return word.getValue().chars().mapToObj(c -> StringValue.of(String.valueOf((char) c))).iterator();
        }

        public String block(CountDownLatch started, CountDownLatch release) throws InterruptedException {
            started.countDown();
            release.await();
            return "done";
        }

        public String currentRequestId() {
            return ReplicaRequestContext.current().getRequestId();
        }

        @Override
        public void close() {
            closeCount.incrementAndGet();
        }
    }

    public static class Counted {
        static final AtomicInteger constructed = new AtomicInteger();

        public Counted() {
            constructed.incrementAndGet();
        }

        public void reconfigure(Map<String, Object> config) {}
    }

    public static class Flaky {
        private volatile boolean healthy = true;

        public void setHealthy(boolean healthy) {
            this.healthy = healthy;
        }

        public void checkHealth() {
            if (!healthy) {
                throw new IllegalStateException("unhealthy");
            }
        }
    }

    public static class NoReconfigure {
        public String call() {
            return "ok";
        }
    }

    public static class FailingConstructor {
        public FailingConstructor() {
            throw new IllegalStateException("can't construct");
        }
    }

    public static class Unhealthy {
        public void checkHealth() {
            throw new IllegalStateException("not healthy");
        }
    }

    public static class FailingClose implements AutoCloseable {
        @Override
        public void close() throws Exception {
            throw new Exception("close failed");
        }
    }

    public static class EchoApp implements HttpApp {
        final AtomicInteger startups = new AtomicInteger();

        @Override
        public void startup() {
            startups.incrementAndGet();
        }

        @Override
        public void call(HttpScope scope, HttpReceive receive, HttpSend send) throws Exception {
            HttpMessage request = receive.receive();
            send.send(HttpMessage.responseStart(201, Collections.singletonMap("content-type", "text/plain")));
            send.send(HttpMessage.responseBody((scope.getPath() + ":").getBytes(StandardCharsets.UTF_8), true));
            send.send(HttpMessage.responseBody(request.getBody(), false));
        }
    }

    /**
     * Sets two fields in separate steps on reconfigure; a call which sees them
     * differ has observed a partial reconfigure.
     */
    public static class TwoFields {
        private volatile int a, b;

        public void reconfigure(Map<String, Object> config) throws InterruptedException {
            int value = (Integer) config.get("value");
            a = value;
            Thread.sleep(1);
            b = value;
        }

        public boolean consistent() throws InterruptedException {
            int first = a;
            Thread.sleep(1);
            return first == a && a == b;
        }
    }

    public static class MultiModel implements MultiplexedHandler {
        private final ModelMultiplexer<String> multiplexer = new ModelMultiplexer<>(id -> "model-" + id, 2);

        @Override
        public ModelMultiplexer<String> getModelMultiplexer() {
            return multiplexer;
        }

        public String predict(String input) throws Exception {
            return multiplexer.getModel() + ":" + input;
        }
    }
}
