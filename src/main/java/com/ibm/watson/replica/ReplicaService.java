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

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.ibm.watson.replica.http.StreamingHttpRequest;
import com.ibm.watson.replica.http.StreamingResponseBridge;
import com.ibm.watson.replica.metrics.AutoscalingMetricsSink;
import com.ibm.watson.replica.metrics.MetricsRecorder;
import com.ibm.watson.replica.metrics.PrometheusMetricsRecorder;
import io.grpc.Context;
import io.prometheus.client.CollectorRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.ibm.watson.replica.ReplicaEnvVars.AUTOSCALING_METRIC_RECORD_PERIOD_ENV_VAR;
import static com.ibm.watson.replica.ReplicaEnvVars.GAUGE_METRIC_SET_PERIOD_ENV_VAR;
import static com.ibm.watson.replica.ReplicaEnvVars.REQUEST_THREADS_ENV_VAR;
import static com.ibm.watson.replica.ReplicaEnvVars.getIntParameter;
import static com.ibm.watson.replica.ReplicaEnvVars.getLongParameter;

/**
 * A replica of a deployment: serves requests with the deployment's handler,
 * and is driven through its lifecycle by the controller.
 * <p>
 * User calls run on the request pool. Health checks run on a separate
 * single-thread control pool, and queue depth queries read counters
 * directly, so that neither is held up by busy user code.
 */
public class ReplicaService implements ReplicaApi {
    private static final Logger logger = LogManager.getLogger(ReplicaService.class);

    static final int DEFAULT_REQUEST_THREADS = 16;
    static final long DEFAULT_GAUGE_METRIC_SET_PERIOD_MS = 1000L;
    static final long DEFAULT_AUTOSCALING_METRIC_RECORD_PERIOD_MS = 500L;

    // states of a unary request
    private static final int QUEUED = 0, STARTED = 1, CANCELLED_BEFORE_START = 2;

    private final ReplicaId replicaId;
    private final UserCallableHost host;
    private final MetricsRecorder metrics;
    private final ListeningExecutorService requestPool;
    private final ListeningExecutorService controlPool;

    private final AtomicReference<ReplicaState> state = new AtomicReference<>(ReplicaState.PENDING_ALLOCATION);
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicInteger running = new AtomicInteger();

    private final ReentrantLock initLock = new ReentrantLock();
    private final ReentrantLock reconfigureLock = new ReentrantLock();
    private final ReentrantLock shutdownLock = new ReentrantLock();

    private volatile boolean initialized; // written under initLock
    private boolean shutdownDone; // guarded by shutdownLock

    private volatile DeploymentConfig deploymentConfig;
    private volatile DeploymentVersion version;
    private volatile boolean accessLogEnabled;

    /**
     * Creates a replica which records its metrics with Prometheus and is
     * configured from the environment.
     *
     * @param autoscalingSink receives autoscaling samples, may be null
     */
    public ReplicaService(ReplicaId replicaId, Object deploymentDef, RequestArgs initArgs,
                          DeploymentConfig config, String codeVersion, AutoscalingMetricsSink autoscalingSink) {
        this(replicaId, deploymentDef, initArgs, config, codeVersion,
                queueDepth -> new PrometheusMetricsRecorder(replicaId.getReplicaTag(),
                        config != null ? config.getAutoscalingConfig() : null, autoscalingSink, queueDepth,
                        new CollectorRegistry(),
                        getLongParameter(GAUGE_METRIC_SET_PERIOD_ENV_VAR, DEFAULT_GAUGE_METRIC_SET_PERIOD_MS),
                        getLongParameter(AUTOSCALING_METRIC_RECORD_PERIOD_ENV_VAR,
                                DEFAULT_AUTOSCALING_METRIC_RECORD_PERIOD_MS)),
                JavaObjectSerializer.INSTANCE, getIntParameter(REQUEST_THREADS_ENV_VAR, DEFAULT_REQUEST_THREADS));
    }

    /**
     * @param deploymentDef  a {@link DeploymentFunction} or the handler's {@link Class}
     * @param config         initial config, null for defaults
     * @param metricsFactory creates the replica's metrics recorder given a supplier of its queue depth
     * @param requestThreads number of request threads kept alive when idle
     */
    public ReplicaService(ReplicaId replicaId, Object deploymentDef, RequestArgs initArgs,
                          DeploymentConfig config, String codeVersion,
                          Function<Supplier<QueueDepth>, MetricsRecorder> metricsFactory,
                          Serializer serializer, int requestThreads) {
        this.replicaId = Objects.requireNonNull(replicaId, "replicaId");
        this.deploymentConfig = config != null ? config : DeploymentConfig.DEFAULT;
        this.version = new DeploymentVersion(codeVersion, deploymentConfig);
        this.requestPool = MoreExecutors.listeningDecorator(new ThreadPoolExecutor(requestThreads,
                Integer.MAX_VALUE, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(),
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("serve-request-%d").build()));
        this.controlPool = MoreExecutors.listeningDecorator(Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("serve-control-%d").build()));
        this.host = new UserCallableHost(deploymentDef, initArgs, replicaId.getDeploymentId(), serializer,
                requestPool);
        this.accessLogEnabled = ReplicaLogging.configure(replicaId.getComponentName(),
                deploymentConfig.getLoggingConfig());
        this.metrics = metricsFactory.apply(this::getQueueDepth);
        metrics.start();
        logger.info("Created replica " + replicaId + " with " + deploymentConfig);
    }

    public ReplicaId getReplicaId() {
        return replicaId;
    }

    public ReplicaState getState() {
        return state.get();
    }

    public DeploymentConfig getDeploymentConfig() {
        return deploymentConfig;
    }

    public DeploymentVersion getVersion() {
        return version;
    }

    public MetricsRecorder getMetricsRecorder() {
        return metrics;
    }

    UserCallableHost getHost() {
        return host;
    }

    private RequestEnvelope newEnvelope(RequestMetadata metadata, Runnable onComplete) {
        return new RequestEnvelope(metadata, replicaId.getDeploymentId().getApp(), metrics, accessLogEnabled,
                onComplete);
    }

    @Override
    public ListenableFuture<Object> handleRequest(RequestMetadata metadata, RequestArgs args) {
        if (!initialized) {
            return Futures.immediateFailedFuture(
                    new IllegalStateException("Replica " + replicaId + " is not initialized"));
        }
        pending.incrementAndGet();
        AtomicInteger requestState = new AtomicInteger(QUEUED);
        RequestEnvelope envelope = newEnvelope(metadata, () -> {
            if (requestState.get() == STARTED) {
                running.decrementAndGet();
            } else {
                pending.decrementAndGet();
            }
        });
        ListenableFuture<Object> future;
        try {
            future = requestPool.submit(() -> {
                if (!requestState.compareAndSet(QUEUED, STARTED)) {
                    throw new CancellationException("Request cancelled before it started");
                }
                running.incrementAndGet();
                pending.decrementAndGet();
                envelope.markStarted();
                Context previous = envelope.attach();
                try {
                    Object result = host.callUserMethod(metadata, args);
                    envelope.complete(null);
                    return result;
                } catch (Exception | Error t) {
                    envelope.complete(t);
                    throw t;
                } finally {
                    envelope.detach(previous);
                }
            });
        } catch (RejectedExecutionException ree) {
            // logged and recorded like any other failed request
            envelope.complete(ree);
            return Futures.immediateFailedFuture(ree);
        }
        final ListenableFuture<Object> submitted = future;
        submitted.addListener(() -> {
            if (requestState.compareAndSet(QUEUED, CANCELLED_BEFORE_START)) {
                envelope.complete(new CancellationException("Request cancelled before it started"));
            } else if (submitted.isCancelled()) {
                envelope.getContext().cancel(null);
            }
        }, MoreExecutors.directExecutor());
        return submitted;
    }

    @Override
    public ResponseStream<Object> handleRequestStreaming(RequestMetadata metadata, RequestArgs args)
            throws Exception {
        Preconditions.checkState(initialized, "Replica %s is not initialized", replicaId);
        running.incrementAndGet();
        RequestEnvelope envelope = newEnvelope(metadata, running::decrementAndGet);
        Context previous = envelope.attach();
        try {
            ResponseStream<?> stream;
            if (metadata.isHttpRequest()) {
                List<Object> list = args.getArgs();
                if (list.size() != 1 || !(list.get(0) instanceof StreamingHttpRequest)) {
                    throw new UsageException("Streaming HTTP requests must have a single StreamingHttpRequest "
                                             + "argument, got " + args);
                }
                stream = StreamingResponseBridge.start(host, metadata, (StreamingHttpRequest) list.get(0),
                        requestPool);
            } else {
                stream = host.callUserMethodGenerator(metadata, args);
            }
            return new EnvelopedResponseStream(stream, envelope);
        } catch (Exception | Error t) {
            envelope.complete(t);
            throw t;
        } finally {
            envelope.detach(previous);
        }
    }

    @Override
    public AllocationInfo isAllocated() {
        if (state.compareAndSet(ReplicaState.PENDING_ALLOCATION, ReplicaState.PENDING_INITIALIZATION)) {
            logger.info("Replica " + replicaId + " allocated");
        }
        String hostName = "unknown", hostAddress = "unknown";
        try {
            InetAddress localHost = InetAddress.getLocalHost();
            hostName = localHost.getHostName();
            hostAddress = localHost.getHostAddress();
        } catch (UnknownHostException uhe) {
            logger.warn("Unable to determine local host address: " + uhe);
        }
        return new AllocationInfo(ProcessHandle.current().pid(), replicaId.getReplicaTag(), hostName, hostAddress,
                ReplicaLogging.logFilePath());
    }

    @Override
    public ReplicaMetadata initializeAndGetMetadata(DeploymentConfig config) throws InitializationException {
        try {
            initLock.lock();
            try {
                if (state.get().isShuttingDown()) {
                    throw new InitializationException("Replica " + replicaId + " is shutting down");
                }
                // the controller calls this again after it restarts
                if (!initialized) {
                    host.initializeCallable();
                    initialized = true;
                }
                if (config != null) {
                    host.callReconfigure(config.getUserConfig());
                }
            } finally {
                initLock.unlock();
            }
            // not healthy until the first health check passes
            host.callUserHealthCheck();
        } catch (InitializationException ie) {
            throw ie;
        } catch (Exception e) {
            throw new InitializationException("Failed to initialize replica " + replicaId + ": " + e, e);
        }
        if (state.compareAndSet(ReplicaState.PENDING_INITIALIZATION, ReplicaState.HEALTHY)
            || state.compareAndSet(ReplicaState.PENDING_ALLOCATION, ReplicaState.HEALTHY)) {
            logger.info("Replica " + replicaId + " initialized and healthy");
        }
        return getMetadata();
    }

    /**
     * Applies a new deployment config. The handler's reconfigure method is only
     * called if the user config changed; if it fails, the previous config and
     * version are restored.
     */
    @Override
    public ReplicaMetadata reconfigure(DeploymentConfig config) throws ReconfigureException {
        Preconditions.checkNotNull(config, "config");
        reconfigureLock.lock();
        boolean transitioned = state.compareAndSet(ReplicaState.HEALTHY, ReplicaState.RECONFIGURING);
        try {
            DeploymentConfig oldConfig = deploymentConfig;
            DeploymentVersion oldVersion = version;
            boolean userConfigChanged = !Objects.equals(config.getUserConfig(), oldConfig.getUserConfig());
            boolean loggingConfigChanged = !config.getLoggingConfig().equals(oldConfig.getLoggingConfig());

            deploymentConfig = config;
            version = DeploymentVersion.fromDeploymentVersion(oldVersion, config);
            metrics.setAutoscalingConfig(config.getAutoscalingConfig());
            if (loggingConfigChanged) {
                accessLogEnabled = ReplicaLogging.configure(replicaId.getComponentName(), config.getLoggingConfig());
            }
            if (userConfigChanged) {
                try {
                    host.callReconfigure(config.getUserConfig());
                } catch (Exception e) {
                    logger.warn("Reconfigure of replica " + replicaId + " failed, reverting to previous config", e);
                    deploymentConfig = oldConfig;
                    version = oldVersion;
                    metrics.setAutoscalingConfig(oldConfig.getAutoscalingConfig());
                    if (loggingConfigChanged) {
                        accessLogEnabled = ReplicaLogging.configure(replicaId.getComponentName(),
                                oldConfig.getLoggingConfig());
                    }
                    throw new ReconfigureException("Failed to reconfigure replica " + replicaId + ": " + e, e);
                }
            }
            logger.info("Reconfigured replica " + replicaId + " to version " + version);
            return getMetadata();
        } finally {
            if (transitioned) {
                state.compareAndSet(ReplicaState.RECONFIGURING, ReplicaState.HEALTHY);
            }
            reconfigureLock.unlock();
        }
    }

    private ReplicaMetadata getMetadata() {
        DeploymentVersion v = version;
        return new ReplicaMetadata(v.getDeploymentConfig(), v);
    }

    @Override
    public void checkHealth() throws HealthCheckException {
        ListenableFuture<?> future;
        try {
            future = controlPool.submit(() -> {
                host.callUserHealthCheck();
                return null;
            });
        } catch (RejectedExecutionException ree) {
            throw new HealthCheckException("Replica " + replicaId + " is shut down", ree);
        }
        try {
            future.get();
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof HealthCheckException) {
                throw (HealthCheckException) cause;
            }
            throw new HealthCheckException("Health check of replica " + replicaId + " failed: " + cause, cause);
        } catch (InterruptedException ie) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new HealthCheckException("Interrupted during health check of replica " + replicaId, ie);
        }
    }

    @Override
    public QueueDepth getQueueDepth() {
        return new QueueDepth(pending.get(), running.get());
    }

    @Override
    public int getNumOngoingRequests() {
        return pending.get() + running.get();
    }

    /**
     * If the handler was initialized, waits for ongoing requests to complete
     * and then runs its destructor. The drain has no upper bound: the
     * orchestrator kills the replica if it doesn't exit within the deployment's
     * graceful shutdown timeout.
     */
    @Override
    public void performGracefulShutdown() {
        shutdownLock.lock();
        try {
            if (shutdownDone) {
                return;
            }
            shutdownDone = true;
            state.set(ReplicaState.DRAINING);
            logger.info("Replica " + replicaId + " shutting down");
            if (initialized) {
                try {
                    drainOngoingRequests();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while draining ongoing requests of replica " + replicaId);
                }
                host.callDestructor();
            }
            try {
                metrics.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing metrics recorder", e);
            }
            requestPool.shutdownNow();
            controlPool.shutdownNow();
            state.set(ReplicaState.TERMINATED);
        } finally {
            shutdownLock.unlock();
        }
    }

    /**
     * Sleeps for the wait loop period before each check of the number of
     * ongoing requests, so that routers have time to stop sending requests here.
     *
     * @return the number of additional periods waited
     */
    int drainOngoingRequests() throws InterruptedException {
        long waitLoopMillis = deploymentConfig.getGracefulShutdownWaitLoopMillis();
        int extraWaits = 0;
        while (true) {
            Thread.sleep(waitLoopMillis);
            int ongoing = getNumOngoingRequests();
            if (ongoing == 0) {
                logger.info("Graceful shutdown complete; replica exiting.");
                return extraWaits;
            }
            logger.info("Waiting for an additional " + waitLoopMillis + "ms to shut down because there are "
                        + ongoing + " ongoing requests.");
            extraWaits++;
        }
    }
}
