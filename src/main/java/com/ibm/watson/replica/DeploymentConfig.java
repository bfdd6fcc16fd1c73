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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable per-deployment configuration, replaced wholesale on reconfigure.
 * <p>
 * The JSON form defined by the {@link JsonProperty} names is what the controller
 * sends and must not be changed in a backwards-incompatible way.
 */
@JsonInclude(Include.NON_NULL)
public final class DeploymentConfig {
    public static final int DEFAULT_MAX_CONCURRENT_QUERIES = 100;
    public static final long DEFAULT_GRACEFUL_SHUTDOWN_WAIT_LOOP_MS = 2_000L;
    public static final long DEFAULT_GRACEFUL_SHUTDOWN_TIMEOUT_MS = 20_000L;
    public static final long DEFAULT_HEALTH_CHECK_PERIOD_MS = 10_000L;
    public static final long DEFAULT_HEALTH_CHECK_TIMEOUT_MS = 30_000L;

    public static final DeploymentConfig DEFAULT = new DeploymentConfig(null, null, null, null,
            null, null, null, null);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final Map<String, Object> userConfig; // null means "not set"
    private final int maxConcurrentQueries;
    private final long gracefulShutdownWaitLoopMillis;
    private final long gracefulShutdownTimeoutMillis;
    private final long healthCheckPeriodMillis;
    private final long healthCheckTimeoutMillis;
    private final AutoscalingConfig autoscalingConfig;
    private final LoggingConfig loggingConfig;

    @JsonCreator
    public DeploymentConfig(@JsonProperty("userConfig") Map<String, Object> userConfig,
                            @JsonProperty("maxConcurrentQueries") Integer maxConcurrentQueries,
                            @JsonProperty("gracefulShutdownWaitLoopMillis") Long gracefulShutdownWaitLoopMillis,
                            @JsonProperty("gracefulShutdownTimeoutMillis") Long gracefulShutdownTimeoutMillis,
                            @JsonProperty("healthCheckPeriodMillis") Long healthCheckPeriodMillis,
                            @JsonProperty("healthCheckTimeoutMillis") Long healthCheckTimeoutMillis,
                            @JsonProperty("autoscalingConfig") AutoscalingConfig autoscalingConfig,
                            @JsonProperty("loggingConfig") LoggingConfig loggingConfig) {
        this.userConfig = userConfig != null ? Collections.unmodifiableMap(new LinkedHashMap<>(userConfig)) : null;
        this.maxConcurrentQueries = maxConcurrentQueries != null ? maxConcurrentQueries
                : DEFAULT_MAX_CONCURRENT_QUERIES;
        this.gracefulShutdownWaitLoopMillis = gracefulShutdownWaitLoopMillis != null
                ? gracefulShutdownWaitLoopMillis : DEFAULT_GRACEFUL_SHUTDOWN_WAIT_LOOP_MS;
        this.gracefulShutdownTimeoutMillis = gracefulShutdownTimeoutMillis != null
                ? gracefulShutdownTimeoutMillis : DEFAULT_GRACEFUL_SHUTDOWN_TIMEOUT_MS;
        this.healthCheckPeriodMillis = healthCheckPeriodMillis != null ? healthCheckPeriodMillis
                : DEFAULT_HEALTH_CHECK_PERIOD_MS;
        this.healthCheckTimeoutMillis = healthCheckTimeoutMillis != null ? healthCheckTimeoutMillis
                : DEFAULT_HEALTH_CHECK_TIMEOUT_MS;
        this.autoscalingConfig = autoscalingConfig;
        this.loggingConfig = loggingConfig != null ? loggingConfig : LoggingConfig.DEFAULT;
        if (this.maxConcurrentQueries <= 0) {
            throw new IllegalArgumentException("maxConcurrentQueries must be positive");
        }
        if (this.gracefulShutdownWaitLoopMillis < 0L) {
            throw new IllegalArgumentException("gracefulShutdownWaitLoopMillis must not be negative");
        }
    }

    public static DeploymentConfig fromJson(byte[] json) throws IOException {
        return MAPPER.readValue(json, DeploymentConfig.class);
    }

    public byte[] toJson() {
        try {
            return MAPPER.writeValueAsBytes(this);
        } catch (JsonProcessingException jpe) {
            throw new IllegalStateException("Unserializable deployment config", jpe);
        }
    }

    // ------------------------------- copy-with ----------------------------------

    public DeploymentConfig withUserConfig(Map<String, Object> userConfig) {
        return new DeploymentConfig(userConfig, maxConcurrentQueries, gracefulShutdownWaitLoopMillis,
                gracefulShutdownTimeoutMillis, healthCheckPeriodMillis, healthCheckTimeoutMillis,
                autoscalingConfig, loggingConfig);
    }

    public DeploymentConfig withMaxConcurrentQueries(int maxConcurrentQueries) {
        return new DeploymentConfig(userConfig, maxConcurrentQueries, gracefulShutdownWaitLoopMillis,
                gracefulShutdownTimeoutMillis, healthCheckPeriodMillis, healthCheckTimeoutMillis,
                autoscalingConfig, loggingConfig);
    }

    public DeploymentConfig withGracefulShutdownWaitLoopMillis(long waitLoopMillis) {
        return new DeploymentConfig(userConfig, maxConcurrentQueries, waitLoopMillis,
                gracefulShutdownTimeoutMillis, healthCheckPeriodMillis, healthCheckTimeoutMillis,
                autoscalingConfig, loggingConfig);
    }

    public DeploymentConfig withAutoscalingConfig(AutoscalingConfig autoscalingConfig) {
        return new DeploymentConfig(userConfig, maxConcurrentQueries, gracefulShutdownWaitLoopMillis,
                gracefulShutdownTimeoutMillis, healthCheckPeriodMillis, healthCheckTimeoutMillis,
                autoscalingConfig, loggingConfig);
    }

    public DeploymentConfig withLoggingConfig(LoggingConfig loggingConfig) {
        return new DeploymentConfig(userConfig, maxConcurrentQueries, gracefulShutdownWaitLoopMillis,
                gracefulShutdownTimeoutMillis, healthCheckPeriodMillis, healthCheckTimeoutMillis,
                autoscalingConfig, loggingConfig);
    }

    // -------------------------------- getters -----------------------------------

    /**
     * @return the user-visible config passed to the handler's reconfigure method, or null
     */
    @JsonProperty("userConfig")
    public Map<String, Object> getUserConfig() {
        return userConfig;
    }

    @JsonProperty("maxConcurrentQueries")
    public int getMaxConcurrentQueries() {
        return maxConcurrentQueries;
    }

    /**
     * @return how long to wait between checks for ongoing requests while draining
     */
    @JsonProperty("gracefulShutdownWaitLoopMillis")
    public long getGracefulShutdownWaitLoopMillis() {
        return gracefulShutdownWaitLoopMillis;
    }

    /**
     * @return how long the controller lets a draining replica run before force-killing it
     */
    @JsonProperty("gracefulShutdownTimeoutMillis")
    public long getGracefulShutdownTimeoutMillis() {
        return gracefulShutdownTimeoutMillis;
    }

    @JsonProperty("healthCheckPeriodMillis")
    public long getHealthCheckPeriodMillis() {
        return healthCheckPeriodMillis;
    }

    @JsonProperty("healthCheckTimeoutMillis")
    public long getHealthCheckTimeoutMillis() {
        return healthCheckTimeoutMillis;
    }

    @JsonProperty("autoscalingConfig")
    public AutoscalingConfig getAutoscalingConfig() {
        return autoscalingConfig;
    }

    @JsonProperty("loggingConfig")
    public LoggingConfig getLoggingConfig() {
        return loggingConfig;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeploymentConfig)) {
            return false;
        }
        DeploymentConfig other = (DeploymentConfig) o;
        return maxConcurrentQueries == other.maxConcurrentQueries
               && gracefulShutdownWaitLoopMillis == other.gracefulShutdownWaitLoopMillis
               && gracefulShutdownTimeoutMillis == other.gracefulShutdownTimeoutMillis
               && healthCheckPeriodMillis == other.healthCheckPeriodMillis
               && healthCheckTimeoutMillis == other.healthCheckTimeoutMillis
               && Objects.equals(userConfig, other.userConfig)
               && Objects.equals(autoscalingConfig, other.autoscalingConfig)
               && loggingConfig.equals(other.loggingConfig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userConfig, maxConcurrentQueries, gracefulShutdownWaitLoopMillis,
                gracefulShutdownTimeoutMillis, healthCheckPeriodMillis, healthCheckTimeoutMillis,
                autoscalingConfig, loggingConfig);
    }

    @Override
    public String toString() {
        return "DeploymentConfig[userConfig=" + userConfig + ", maxConcurrentQueries=" + maxConcurrentQueries
               + ", gracefulShutdownWaitLoop=" + gracefulShutdownWaitLoopMillis + "ms, autoscaling="
               + autoscalingConfig + ", logging=" + loggingConfig + "]";
    }
}
