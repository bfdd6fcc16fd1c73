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

import com.ibm.watson.replica.SampleHandlers.Greeter;
import com.ibm.watson.replica.http.HttpMessage;
import com.ibm.watson.replica.http.HttpMessageQueue;
import com.ibm.watson.replica.http.HttpScope;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.ibm.watson.replica.UserCallableHostTest.drain;
import static com.ibm.watson.replica.UserCallableHostTest.httpMd;
import static com.ibm.watson.replica.UserCallableHostTest.md;
import static com.ibm.watson.replica.UserCallableHostTest.receiveOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplicaServiceTest {
    private static final ReplicaId REPLICA_ID = ReplicaId.fromReplicaTag("app#greeter#abc123");
    private static final DeploymentConfig CONFIG = DeploymentConfig.DEFAULT.withGracefulShutdownWaitLoopMillis(20);

    private final RecordingMetricsRecorder metrics = new RecordingMetricsRecorder();
    private final List<ReplicaService> services = new ArrayList<>();

    @AfterEach
    void shutdown() {
        services.forEach(ReplicaService::performGracefulShutdown);
    }

    private ReplicaService service(Object def, DeploymentConfig config) {
        ReplicaService service = new ReplicaService(REPLICA_ID, def, RequestArgs.EMPTY, config, "v1",
                metrics::attach, JavaObjectSerializer.INSTANCE, 2);
        services.add(service);
        return service;
    }

    private ReplicaService initialized(Object def) throws Exception {
        ReplicaService service = service(def, CONFIG);
        service.isAllocated();
        service.initializeAndGetMetadata(null);
        return service;
    }

    @Test
    void testLifecycle() throws Exception {
        ReplicaService service = service(Greeter.class, CONFIG);
        assertEquals(ReplicaState.PENDING_ALLOCATION, service.getState());
        assertEquals(1, metrics.starts.get());

        AllocationInfo info = service.isAllocated();
        assertEquals(ProcessHandle.current().pid(), info.getPid());
        assertEquals("app#greeter#abc123", info.getReplicaTag());
        assertEquals(ReplicaState.PENDING_INITIALIZATION, service.getState());

        ReplicaMetadata metadata = service.initializeAndGetMetadata(null);
        assertEquals(ReplicaState.HEALTHY, service.getState());
        assertEquals("v1", metadata.getVersion().getCodeVersion());
        assertEquals(CONFIG, metadata.getDeploymentConfig());

        service.performGracefulShutdown();
        assertEquals(ReplicaState.TERMINATED, service.getState());
        assertEquals(1, metrics.closes.get());
    }

    @Test
    void testUnaryRequest() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        assertEquals("hi Alice", service.handleRequest(md("call"), RequestArgs.of("Alice")).get());

        assertEquals(1, metrics.observations.size());
        RecordingMetricsRecorder.Observation obs = metrics.last();
        assertEquals("/greet", obs.route);
        assertEquals(RequestStatus.OK, obs.status);
        assertFalse(obs.isError);
        assertTrue(obs.latencyMillis > 0.0);
        assertEquals(0, service.getNumOngoingRequests());
    }

    @Test
    void testRequestContextIsVisibleToHandler() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        assertEquals("req-1", service.handleRequest(md("currentRequestId"), RequestArgs.EMPTY).get());
        assertNull(ReplicaRequestContext.current());
    }

    @Test
    void testFailureClassification() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        ExecutionException ee = assertThrows(ExecutionException.class,
                () -> service.handleRequest(md("fail"), RequestArgs.EMPTY).get());
        assertInstanceOf(UserCodeException.class, ee.getCause());
        assertEquals(RequestStatus.ERROR, metrics.last().status);
        assertTrue(metrics.last().isError);

        assertThrows(ExecutionException.class, () -> service.handleRequest(md("cancelled"), RequestArgs.EMPTY).get());
        assertEquals(RequestStatus.CANCELLED, metrics.last().status);
        assertFalse(metrics.last().isError);
        assertEquals(0, service.getNumOngoingRequests());
    }

    @Test
    void testRequestBeforeInitializationFails() {
        ReplicaService service = service(Greeter.class, CONFIG);
        ExecutionException ee = assertThrows(ExecutionException.class,
                () -> service.handleRequest(md("call"), RequestArgs.of("x")).get());
        assertInstanceOf(IllegalStateException.class, ee.getCause());
        assertThrows(IllegalStateException.class, () -> service.handleRequestStreaming(md("countUp"),
                RequestArgs.of(1)));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testDuplicateInitializationConstructsOnce() throws Exception {
        ReplicaService service = service(SampleHandlers.Counted.class, CONFIG);
        int before = SampleHandlers.Counted.constructed.get();
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            List<Future<ReplicaMetadata>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                futures.add(pool.submit(() -> service.initializeAndGetMetadata(null)));
            }
            for (Future<ReplicaMetadata> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }
        service.initializeAndGetMetadata(CONFIG.withUserConfig(Map.of("k", "v")));
        assertEquals(before + 1, SampleHandlers.Counted.constructed.get());
        assertEquals(ReplicaState.HEALTHY, service.getState());
    }

    @Test
    void testInitializeAppliesUserConfig() throws Exception {
        ReplicaService service = service(Greeter.class, CONFIG);
        service.initializeAndGetMetadata(CONFIG.withUserConfig(Map.of("greeting", "yo")));
        assertEquals("yo Al", service.handleRequest(md("call"), RequestArgs.of("Al")).get());
    }

    @Test
    void testInitializationFailures() {
        InitializationException ie = assertThrows(InitializationException.class,
                () -> service(SampleHandlers.FailingConstructor.class, CONFIG).initializeAndGetMetadata(null));
        assertInstanceOf(IllegalStateException.class, ie.getCause());

        ReplicaService unhealthy = service(SampleHandlers.Unhealthy.class, CONFIG);
        ie = assertThrows(InitializationException.class, () -> unhealthy.initializeAndGetMetadata(null));
        assertInstanceOf(HealthCheckException.class, ie.getCause());
        assertFalse(unhealthy.getState() == ReplicaState.HEALTHY);

        ReplicaService noReconfigure = service(SampleHandlers.NoReconfigure.class, CONFIG);
        ie = assertThrows(InitializationException.class,
                () -> noReconfigure.initializeAndGetMetadata(CONFIG.withUserConfig(Map.of("a", 1))));
        assertInstanceOf(ConfigException.class, ie.getCause());
    }

    @Test
    void testReconfigure() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        DeploymentVersion oldVersion = service.getVersion();
        AutoscalingConfig autoscaling = new AutoscalingConfig(1, 4, 2.0, null, null);
        DeploymentConfig newConfig = CONFIG.withUserConfig(Map.of("greeting", "yo"))
                .withAutoscalingConfig(autoscaling);

        ReplicaMetadata metadata = service.reconfigure(newConfig);
        assertEquals(newConfig, metadata.getDeploymentConfig());
        assertEquals("v1", metadata.getVersion().getCodeVersion());
        assertTrue(metadata.getVersion().requiresReplicaReconfigure(oldVersion));
        assertEquals(autoscaling, metrics.autoscalingConfig);
        assertEquals(ReplicaState.HEALTHY, service.getState());
        assertEquals("yo Al", service.handleRequest(md("call"), RequestArgs.of("Al")).get());
    }

    @Test
    void testReconfigureWithoutUserConfigChange() throws Exception {
        ReplicaService service = initialized(SampleHandlers.NoReconfigure.class);
        DeploymentConfig newConfig = CONFIG.withMaxConcurrentQueries(5);
        assertEquals(newConfig, service.reconfigure(newConfig).getDeploymentConfig());
        assertEquals(5, service.getDeploymentConfig().getMaxConcurrentQueries());
    }

    @Test
    void testFailedReconfigureIsReverted() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        DeploymentVersion oldVersion = service.getVersion();

        ReconfigureException re = assertThrows(ReconfigureException.class,
                () -> service.reconfigure(CONFIG.withUserConfig(Map.of("greeting", "fail"))
                        .withAutoscalingConfig(new AutoscalingConfig(1, 2, 1.0, null, null))));
        assertInstanceOf(IllegalArgumentException.class, re.getCause());
        assertEquals(CONFIG, service.getDeploymentConfig());
        assertEquals(oldVersion, service.getVersion());
        assertNull(metrics.autoscalingConfig);
        assertEquals(ReplicaState.HEALTHY, service.getState());
        assertEquals("hi Al", service.handleRequest(md("call"), RequestArgs.of("Al")).get());
    }

    @Test
    void testCheckHealth() throws Exception {
        ReplicaService service = initialized(SampleHandlers.Flaky.class);
        service.checkHealth();
        service.handleRequest(md("setHealthy"), RequestArgs.of(false)).get();
        HealthCheckException hce = assertThrows(HealthCheckException.class, service::checkHealth);
        assertInstanceOf(IllegalStateException.class, hce.getCause());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testQueueDepthWhileBusy() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        CountDownLatch started = new CountDownLatch(1), release = new CountDownLatch(1);
        Future<Object> call = service.handleRequest(md("block"), RequestArgs.of(started, release));
        started.await();
        QueueDepth depth = service.getQueueDepth();
        assertEquals(0, depth.getPending());
        assertEquals(1, depth.getRunning());
        assertEquals(1, service.getNumOngoingRequests());
        assertEquals(1, metrics.currentQueueDepth().getRunning());

        // health checks are not held up by busy user code
        service.checkHealth();

        release.countDown();
        assertEquals("done", call.get());
        assertEquals(0, service.getNumOngoingRequests());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testCancelRunningRequest() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        CountDownLatch started = new CountDownLatch(1), release = new CountDownLatch(1);
        Future<Object> call = service.handleRequest(md("block"), RequestArgs.of(started, release));
        started.await();
        call.cancel(true);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (service.getNumOngoingRequests() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, service.getNumOngoingRequests());
        assertEquals(RequestStatus.CANCELLED, metrics.last().status);
    }

    @Test
    void testStreamingRequest() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        ResponseStream<Object> stream = service.handleRequestStreaming(md("countUp"), RequestArgs.of(3));
        assertEquals(1, service.getNumOngoingRequests());
        assertEquals(List.of(0, 1, 2), drain(stream));
        assertEquals(0, service.getNumOngoingRequests());
        assertEquals(1, metrics.observations.size());
        assertEquals(RequestStatus.OK, metrics.last().status);
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testStreamingRequestCancelled() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        ResponseStream<Object> stream = service.handleRequestStreaming(md("emitForever"), RequestArgs.EMPTY);
        assertEquals(0, stream.next());
        assertEquals(1, stream.next());
        stream.cancel();
        assertEquals(RequestStatus.CANCELLED, metrics.last().status);
        assertEquals(0, service.getNumOngoingRequests());
        stream.close();
        assertEquals(1, metrics.observations.size());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testStreamingRequestCancelledFromAnotherThread() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        Greeter greeter = (Greeter) service.getHost().getUserCallable();
        CountDownLatch release = new CountDownLatch(1);
        ResponseStream<Object> stream = service.handleRequestStreaming(md("emitAfter"), RequestArgs.of(release));
        greeter.producerStarted.await();

        ExecutorService puller = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> consumer = puller.submit(stream::hasNext);
            Thread.sleep(100);
            assertFalse(consumer.isDone());
            stream.cancel();
            assertFalse(consumer.get(5, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            puller.shutdownNow();
        }
        assertEquals(RequestStatus.CANCELLED, metrics.last().status);
        assertEquals(1, metrics.observations.size());
        assertEquals(0, service.getNumOngoingRequests());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testObserverStreamingHandlerSeesLogContext() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        assertEquals(List.of("req-1"),
                drain(service.handleRequestStreaming(md("emitRequestId"), RequestArgs.EMPTY)));
        assertNull(ThreadContext.get(ReplicaRequestContext.REQUEST_ID_LOG_KEY));
    }

    @Test
    void testStreamingUsageErrorIsRecorded() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        assertThrows(UsageException.class, () -> service.handleRequestStreaming(md("call"), RequestArgs.of("x")));
        assertEquals(RequestStatus.ERROR, metrics.last().status);
        assertEquals(0, service.getNumOngoingRequests());
    }

    @Test
    void testHttpUnaryRequest() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        HttpMessageQueue send = new HttpMessageQueue();
        HttpScope scope = HttpScope.of("POST", "/greet", Map.of());
        assertNull(service.handleRequest(httpMd("hello"), RequestArgs.of(scope,
                receiveOf(HttpMessage.requestBody("Al".getBytes(StandardCharsets.UTF_8), false)), send)).get());
        List<HttpMessage> messages = send.drainMessages();
        assertEquals("hello Al", new String(messages.get(1).getBody(), StandardCharsets.UTF_8));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void testDrainWaitsForOngoingRequests() throws Exception {
        ReplicaService service = service(Greeter.class, CONFIG.withGracefulShutdownWaitLoopMillis(100));
        service.initializeAndGetMetadata(null);
        assertEquals(0, service.drainOngoingRequests());

        CountDownLatch started = new CountDownLatch(1), release = new CountDownLatch(1);
        Future<Object> call = service.handleRequest(md("block"), RequestArgs.of(started, release));
        started.await();
        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(150);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            release.countDown();
        });
        releaser.start();
        int extraWaits = service.drainOngoingRequests();
        assertTrue(extraWaits >= 1, "drain returned after " + extraWaits + " extra waits");
        assertEquals(0, service.getNumOngoingRequests());
        assertEquals("done", call.get());
    }

    @Test
    void testGracefulShutdownRunsDestructorOnce() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        Greeter greeter = (Greeter) service.getHost().getUserCallable();
        service.performGracefulShutdown();
        service.performGracefulShutdown();
        assertEquals(1, greeter.closeCount.get());
        assertEquals(ReplicaState.TERMINATED, service.getState());
        assertEquals(1, metrics.closes.get());

        assertThrows(ExecutionException.class, () -> service.handleRequest(md("call"), RequestArgs.of("x")).get());
    }

    @Test
    void testRequestRejectedAfterShutdownIsRecorded() throws Exception {
        ReplicaService service = initialized(Greeter.class);
        service.performGracefulShutdown();
        int before = metrics.observations.size();

        ExecutionException ee = assertThrows(ExecutionException.class,
                () -> service.handleRequest(md("call"), RequestArgs.of("x")).get());
        assertInstanceOf(RejectedExecutionException.class, ee.getCause());
        assertEquals(before + 1, metrics.observations.size());
        assertEquals(RequestStatus.ERROR, metrics.last().status);
        assertEquals(0, service.getQueueDepth().getPending());
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testShutdownOfUninitializedReplicaSkipsDrain() {
        // would take far longer than the timeout if it drained
        ReplicaService service = service(Greeter.class, CONFIG.withGracefulShutdownWaitLoopMillis(60_000));
        service.performGracefulShutdown();
        assertEquals(ReplicaState.TERMINATED, service.getState());
        assertNull(service.getHost().getUserCallable());
    }

    @Test
    void testMultiplexedModelRequests() throws Exception {
        ReplicaService service = initialized(SampleHandlers.MultiModel.class);
        RequestMetadata m1 = RequestMetadata.newBuilder("req-m1").callMethod("predict").route("/predict")
                .multiplexedModelId("m1").build();
        assertEquals("model-m1:x", service.handleRequest(m1, RequestArgs.of("x")).get());

        ExecutionException ee = assertThrows(ExecutionException.class,
                () -> service.handleRequest(md("predict"), RequestArgs.of("x")).get());
        assertInstanceOf(IllegalStateException.class, ee.getCause().getCause());

        SampleHandlers.MultiModel handler = (SampleHandlers.MultiModel) service.getHost().getUserCallable();
        assertEquals(Set.of("m1"), handler.getModelMultiplexer().loadedModelIds());
        service.performGracefulShutdown();
        assertTrue(handler.getModelMultiplexer().loadedModelIds().isEmpty());
    }
}
