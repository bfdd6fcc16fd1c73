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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs named tasks periodically on a single daemon thread. A task which
 * throws is logged and keeps running at its next period.
 */
public class MetricsPusher {
    private static final Logger logger = LoggerFactory.getLogger(MetricsPusher.class);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("serve-metrics-pusher-%d").build());

    private final ConcurrentMap<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean();

    /**
     * Registers a task, replacing any existing task with the same name.
     *
     * @param callback passed each result of {@code task}; may be null
     */
    public <T> void registerTask(String name, Supplier<T> task, long periodMillis, Consumer<? super T> callback) {
        if (periodMillis <= 0) {
            throw new IllegalArgumentException("period of task " + name + " must be positive: " + periodMillis);
        }
        if (shutdown.get()) {
            logger.warn("Ignoring registration of metrics task {} after shutdown", name);
            return;
        }
        Runnable run = () -> {
            try {
                T result = task.get();
                if (callback != null) {
                    callback.accept(result);
                }
            } catch (Exception e) {
                logger.warn("Metrics task {} failed", name, e);
            }
        };
        ScheduledFuture<?> previous = tasks.put(name,
                scheduler.scheduleAtFixedRate(run, periodMillis, periodMillis, TimeUnit.MILLISECONDS));
        if (previous != null) {
            previous.cancel(false);
        }
    }

    public void registerTask(String name, Runnable task, long periodMillis) {
        registerTask(name, () -> {
            task.run();
            return null;
        }, periodMillis, null);
    }

    public boolean unregisterTask(String name) {
        ScheduledFuture<?> future = tasks.remove(name);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        return true;
    }

    public Set<String> getTaskNames() {
        return Set.copyOf(tasks.keySet());
    }

    /**
     * Cancels all tasks. Subsequent calls have no effect.
     */
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            tasks.values().forEach(f -> f.cancel(false));
            tasks.clear();
            scheduler.shutdownNow();
        }
    }
}
