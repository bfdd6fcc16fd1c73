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

import com.google.common.util.concurrent.ListenableFuture;

/**
 * Inbound surface of a replica, called by the router (requests) and the
 * controller (lifecycle and health).
 */
public interface ReplicaApi {

    /**
     * @return future result of the call; cancelling it cancels the call
     */
    ListenableFuture<Object> handleRequest(RequestMetadata metadata, RequestArgs args);

    /**
     * For HTTP requests, {@code args} must be a single
     * {@link com.ibm.watson.replica.http.StreamingHttpRequest} and the items of
     * the returned stream are serialized batches of response messages.
     */
    ResponseStream<Object> handleRequestStreaming(RequestMetadata metadata, RequestArgs args) throws Exception;

    AllocationInfo isAllocated();

    /**
     * Initializes the handler if not already done, applies the user config of
     * {@code config} if provided, and runs a health check.
     *
     * @param config may be null
     */
    ReplicaMetadata initializeAndGetMetadata(DeploymentConfig config) throws InitializationException;

    ReplicaMetadata reconfigure(DeploymentConfig config) throws ReconfigureException;

    void checkHealth() throws HealthCheckException;

    QueueDepth getQueueDepth();

    int getNumOngoingRequests();

    /**
     * Waits for ongoing requests to complete then tears down the handler.
     * Subsequent calls have no effect.
     */
    void performGracefulShutdown();
}
