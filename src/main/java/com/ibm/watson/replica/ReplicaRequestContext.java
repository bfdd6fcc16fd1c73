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

import io.grpc.Context;

import java.util.HashMap;
import java.util.Map;

/**
 * Request-scoped information made available to user code via
 * {@link #current()} for the duration of each call.
 */
public final class ReplicaRequestContext {
    static final Context.Key<ReplicaRequestContext> KEY = Context.key("serve-request-context");

    // keys used in the logging ThreadContext
    static final String REQUEST_ID_LOG_KEY = "request_id";
    static final String ROUTE_LOG_KEY = "route";
    static final String APP_LOG_KEY = "application";
    static final String MODEL_ID_LOG_KEY = "model_id";

    private final String route;
    private final String requestId;
    private final String appName;
    private final String multiplexedModelId;
    private final GrpcRequestContext grpcContext;

    public ReplicaRequestContext(String route, String requestId, String appName, String multiplexedModelId,
                                 GrpcRequestContext grpcContext) {
        this.route = route;
        this.requestId = requestId;
        this.appName = appName;
        this.multiplexedModelId = multiplexedModelId != null ? multiplexedModelId : "";
        this.grpcContext = grpcContext;
    }

    /**
     * @return context of the request being handled by the current thread, or null if none
     */
    public static ReplicaRequestContext current() {
        return KEY.get();
    }

    public String getRoute() {
        return route;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getAppName() {
        return appName;
    }

    public String getMultiplexedModelId() {
        return multiplexedModelId;
    }

    public GrpcRequestContext getGrpcContext() {
        return grpcContext;
    }

    Map<String, String> toLogContext() {
        Map<String, String> map = new HashMap<>(8);
        map.put(REQUEST_ID_LOG_KEY, requestId);
        map.put(ROUTE_LOG_KEY, route);
        map.put(APP_LOG_KEY, appName);
        if (!multiplexedModelId.isEmpty()) {
            map.put(MODEL_ID_LOG_KEY, multiplexedModelId);
        }
        return map;
    }
}
