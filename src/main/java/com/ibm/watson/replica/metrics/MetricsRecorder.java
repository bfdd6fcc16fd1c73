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

/**
 * Receives one observation per completed request, and reports the replica's
 * load for autoscaling.
 */
public interface MetricsRecorder extends AutoCloseable {

    /**
     * Called once, when the replica starts.
     */
    void start();

    void recordRequest(String route, RequestStatus status, double latencyMillis, boolean isError);

    QueueDepth currentQueueDepth();

    /**
     * @param config new autoscaling config, null if autoscaling is disabled
     */
    void setAutoscalingConfig(AutoscalingConfig config);

    @Override
    void close();

    MetricsRecorder NO_OP = new MetricsRecorder() {
        @Override
        public void start() {}

        @Override
        public void recordRequest(String route, RequestStatus status, double latencyMillis, boolean isError) {}

        @Override
        public QueueDepth currentQueueDepth() {
            return QueueDepth.EMPTY;
        }

        @Override
        public void setAutoscalingConfig(AutoscalingConfig config) {}

        @Override
        public void close() {}
    };
}
