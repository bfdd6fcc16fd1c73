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

package com.ibm.watson.replica.metrics;

import com.ibm.watson.replica.AutoscalingConfig;
import com.ibm.watson.replica.QueueDepth;
import com.ibm.watson.replica.RequestStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.function.Supplier;

/**
 * Records replica metrics in a Prometheus {@link CollectorRegistry}, and
 * periodically pushes the replica's average number of ongoing requests to the
 * controller for autoscaling.
 */
public class PrometheusMetricsRecorder implements MetricsRecorder {
    private static final Logger logger = LoggerFactory.getLogger(PrometheusMetricsRecorder.class);

    static final double[] MS_TIME_BUCKETS = {
            .5, 1, 2, 5, 10, 20, 50, 75, 100, 200, 500, 1000, 2000,
            5000, 10000, 20000, 60000, 120000, 300000
    };

    static final String ONGOING_REQUESTS_KEY = "ongoing_requests";

    static final String SET_GAUGES_TASK = "set_replica_gauges";
    static final String RECORD_TASK = "record_autoscaling_metrics";
    static final String PUSH_TASK = "push_autoscaling_metrics";

    private final String replicaTag;
    private final AutoscalingMetricsSink sink;
    private final Supplier<QueueDepth> queueDepth;
    private final CollectorRegistry registry;
    private final MetricsPusher pusher;
    private final long gaugePeriodMillis;
    private final long recordPeriodMillis;
    private final InMemoryMetricsStore store = new InMemoryMetricsStore();

    private final Counter replicaStarts;
    private final Counter requestCounter;
    private final Counter errorCounter;
    private final Histogram processingLatency;
    private final Gauge pendingQueries;
    private final Gauge processingQueries;

    private volatile AutoscalingConfig autoscalingConfig;
    private volatile boolean started;

    /**
     * @param autoscalingConfig null if autoscaling is disabled
     * @param sink              receives autoscaling samples, may be null
     * @param queueDepth        samples the replica's current queue depth
     */
    public PrometheusMetricsRecorder(String replicaTag, AutoscalingConfig autoscalingConfig,
                                     AutoscalingMetricsSink sink, Supplier<QueueDepth> queueDepth,
                                     CollectorRegistry registry, long gaugePeriodMillis, long recordPeriodMillis) {
        this(replicaTag, autoscalingConfig, sink, queueDepth, registry, gaugePeriodMillis, recordPeriodMillis,
                new MetricsPusher());
    }

    PrometheusMetricsRecorder(String replicaTag, AutoscalingConfig autoscalingConfig,
                              AutoscalingMetricsSink sink, Supplier<QueueDepth> queueDepth,
                              CollectorRegistry registry, long gaugePeriodMillis, long recordPeriodMillis,
                              MetricsPusher pusher) {
        this.replicaTag = replicaTag;
        this.autoscalingConfig = autoscalingConfig;
        this.sink = sink;
        this.queueDepth = queueDepth;
        this.registry = registry;
        this.gaugePeriodMillis = gaugePeriodMillis;
        this.recordPeriodMillis = recordPeriodMillis;
        this.pusher = pusher;

        replicaStarts = Counter.build().name("serve_deployment_replica_starts")
                .help("The number of times this replica has been restarted due to failure.")
                .register(registry);
        requestCounter = Counter.build().name("serve_deployment_request_counter")
                .help("The number of queries that have been processed in this replica.")
                .labelNames("route").register(registry);
        errorCounter = Counter.build().name("serve_deployment_error_counter")
                .help("The number of exceptions that have occurred in this replica.")
                .labelNames("route").register(registry);
        processingLatency = Histogram.build().name("serve_deployment_processing_latency_ms")
                .help("The latency for queries to be processed.")
                .buckets(MS_TIME_BUCKETS).labelNames("route").register(registry);
        pendingQueries = Gauge.build().name("serve_replica_pending_queries")
                .help("The current number of pending queries.").register(registry);
        processingQueries = Gauge.build().name("serve_replica_processing_queries")
                .help("The current number of queries being processed.").register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void start() {
        if (started) {
            return;
        }
        started = true;
        replicaStarts.inc();
        pusher.registerTask(SET_GAUGES_TASK, this::setGauges, gaugePeriodMillis);
        AutoscalingConfig config = autoscalingConfig;
        if (config != null) {
            registerAutoscalingTasks(config);
        }
    }

    void setGauges() {
        QueueDepth depth = queueDepth.get();
        pendingQueries.set(depth.getPending());
        processingQueries.set(depth.getRunning());
    }

    private void registerAutoscalingTasks(AutoscalingConfig config) {
        long interval = config.getMetricsIntervalMillis();
        pusher.registerTask(RECORD_TASK, this::recordQueueDepth, Math.min(recordPeriodMillis, interval));
        pusher.registerTask(PUSH_TASK, () -> store.windowAverage(ONGOING_REQUESTS_KEY,
                System.currentTimeMillis() - config.getLookBackPeriodMillis()), interval, this::pushAutoscalingMetric);
        logger.info("Autoscaling metrics will be pushed every {}ms for replica {}", interval, replicaTag);
    }

    void recordQueueDepth() {
        store.addMetricsPoint(Collections.singletonMap(ONGOING_REQUESTS_KEY,
                (double) queueDepth.get().total()), System.currentTimeMillis());
    }

    void pushAutoscalingMetric(Double value) {
        if (value == null || sink == null) {
            return;
        }
        try {
            sink.recordAutoscalingMetrics(replicaTag, value, System.currentTimeMillis());
        } catch (Exception e) {
            logger.warn("Failed to push autoscaling metrics for replica {}", replicaTag, e);
        }
    }

    InMemoryMetricsStore getStore() {
        return store;
    }

    @Override
    public void recordRequest(String route, RequestStatus status, double latencyMillis, boolean isError) {
        requestCounter.labels(route).inc();
        processingLatency.labels(route).observe(latencyMillis);
        if (isError) {
            errorCounter.labels(route).inc();
        }
    }

    @Override
    public QueueDepth currentQueueDepth() {
        return queueDepth.get();
    }

    @Override
    public void setAutoscalingConfig(AutoscalingConfig config) {
        this.autoscalingConfig = config;
        if (!started) {
            return;
        }
        if (config != null) {
            registerAutoscalingTasks(config);
        } else {
            pusher.unregisterTask(RECORD_TASK);
            pusher.unregisterTask(PUSH_TASK);
        }
    }

    @Override
    public void close() {
        pusher.shutdown();
    }
}
