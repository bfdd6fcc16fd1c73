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

/**
 * Controller endpoint which receives replicas' autoscaling samples.
 */
@FunctionalInterface
public interface AutoscalingMetricsSink {

    /**
     * @param value               average number of ongoing requests over the look-back window
     * @param sendTimestampMillis time at which the sample was sent
     */
    void recordAutoscalingMetrics(String replicaTag, double value, long sendTimestampMillis) throws Exception;
}
