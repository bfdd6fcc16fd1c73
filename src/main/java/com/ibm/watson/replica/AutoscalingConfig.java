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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Autoscaling parameters. The replica itself only uses the metrics push
 * interval and look-back period; the replica bounds and target are carried
 * for the controller.
 */
public final class AutoscalingConfig {
    public static final long DEFAULT_METRICS_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_LOOK_BACK_PERIOD_MS = 30_000L;

    private final int minReplicas;
    private final int maxReplicas;
    private final double targetNumOngoingRequestsPerReplica;
    private final long metricsIntervalMillis;
    private final long lookBackPeriodMillis;

    @JsonCreator
    public AutoscalingConfig(@JsonProperty("minReplicas") Integer minReplicas,
                             @JsonProperty("maxReplicas") Integer maxReplicas,
                             @JsonProperty("targetNumOngoingRequestsPerReplica") Double target,
                             @JsonProperty("metricsIntervalMillis") Long metricsIntervalMillis,
                             @JsonProperty("lookBackPeriodMillis") Long lookBackPeriodMillis) {
        this.minReplicas = minReplicas != null ? minReplicas : 1;
        this.maxReplicas = maxReplicas != null ? maxReplicas : 1;
        this.targetNumOngoingRequestsPerReplica = target != null ? target : 1.0;
        this.metricsIntervalMillis = metricsIntervalMillis != null ? metricsIntervalMillis
                : DEFAULT_METRICS_INTERVAL_MS;
        this.lookBackPeriodMillis = lookBackPeriodMillis != null ? lookBackPeriodMillis
                : DEFAULT_LOOK_BACK_PERIOD_MS;
        if (this.minReplicas < 0 || this.maxReplicas < this.minReplicas) {
            throw new IllegalArgumentException("Invalid replica bounds: min=" + this.minReplicas
                                               + ", max=" + this.maxReplicas);
        }
        if (this.metricsIntervalMillis <= 0 || this.lookBackPeriodMillis <= 0) {
            throw new IllegalArgumentException("Autoscaling periods must be positive");
        }
    }

    @JsonProperty("minReplicas")
    public int getMinReplicas() {
        return minReplicas;
    }

    @JsonProperty("maxReplicas")
    public int getMaxReplicas() {
        return maxReplicas;
    }

    @JsonProperty("targetNumOngoingRequestsPerReplica")
    public double getTargetNumOngoingRequestsPerReplica() {
        return targetNumOngoingRequestsPerReplica;
    }

    @JsonProperty("metricsIntervalMillis")
    public long getMetricsIntervalMillis() {
        return metricsIntervalMillis;
    }

    @JsonProperty("lookBackPeriodMillis")
    public long getLookBackPeriodMillis() {
        return lookBackPeriodMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AutoscalingConfig)) {
            return false;
        }
        AutoscalingConfig other = (AutoscalingConfig) o;
        return minReplicas == other.minReplicas && maxReplicas == other.maxReplicas
               && Double.compare(targetNumOngoingRequestsPerReplica, other.targetNumOngoingRequestsPerReplica) == 0
               && metricsIntervalMillis == other.metricsIntervalMillis
               && lookBackPeriodMillis == other.lookBackPeriodMillis;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minReplicas, maxReplicas, targetNumOngoingRequestsPerReplica,
                metricsIntervalMillis, lookBackPeriodMillis);
    }

    @Override
    public String toString() {
        return "AutoscalingConfig[min=" + minReplicas + ", max=" + maxReplicas
               + ", target=" + targetNumOngoingRequestsPerReplica + ", metricsInterval=" + metricsIntervalMillis
               + "ms, lookBack=" + lookBackPeriodMillis + "ms]";
    }
}
