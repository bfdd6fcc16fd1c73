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

import java.util.Objects;

/**
 * Immutable per-request information which travels with a call from the
 * router to the replica.
 */
public final class RequestMetadata {
    public static final String DEFAULT_CALL_METHOD = "call";

    private final String requestId;
    private final String endpoint;
    private final String callMethod;
    private final String route;
    private final String multiplexedModelId;
    private final boolean httpRequest;
    private final boolean streaming;
    private final boolean grpcRequest;
    private final GrpcRequestContext grpcContext;

    private RequestMetadata(Builder b) {
        this.requestId = Objects.requireNonNull(b.requestId, "requestId");
        this.endpoint = b.endpoint;
        this.callMethod = b.callMethod;
        this.route = b.route;
        this.multiplexedModelId = b.multiplexedModelId;
        this.httpRequest = b.httpRequest;
        this.streaming = b.streaming;
        this.grpcRequest = b.grpcRequest;
        this.grpcContext = b.grpcContext;
        if (httpRequest && grpcRequest) {
            throw new IllegalArgumentException("Request can't be both HTTP and gRPC");
        }
    }

    public static Builder newBuilder(String requestId) {
        return new Builder(requestId);
    }

    public String getRequestId() {
        return requestId;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getCallMethod() {
        return callMethod;
    }

    public String getRoute() {
        return route;
    }

    /**
     * @return the multiplexed model id, empty if none
     */
    public String getMultiplexedModelId() {
        return multiplexedModelId;
    }

    public boolean isHttpRequest() {
        return httpRequest;
    }

    public boolean isStreaming() {
        return streaming;
    }

    public boolean isGrpcRequest() {
        return grpcRequest;
    }

    /**
     * @return protocol context of a gRPC request, null otherwise
     */
    public GrpcRequestContext getGrpcContext() {
        return grpcContext;
    }

    @Override
    public String toString() {
        return "RequestMetadata[id=" + requestId + ", method=" + callMethod + ", route=" + route
               + (httpRequest ? ", http" : "") + (grpcRequest ? ", grpc" : "") + (streaming ? ", streaming" : "")
               + (multiplexedModelId.isEmpty() ? "" : ", model=" + multiplexedModelId) + "]";
    }

    public static final class Builder {
        private final String requestId;
        private String endpoint = "";
        private String callMethod = DEFAULT_CALL_METHOD;
        private String route = "";
        private String multiplexedModelId = "";
        private boolean httpRequest;
        private boolean streaming;
        private boolean grpcRequest;
        private GrpcRequestContext grpcContext;

        private Builder(String requestId) {
            this.requestId = requestId;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = Objects.requireNonNull(endpoint);
            return this;
        }

        public Builder callMethod(String callMethod) {
            this.callMethod = Objects.requireNonNull(callMethod);
            return this;
        }

        public Builder route(String route) {
            this.route = Objects.requireNonNull(route);
            return this;
        }

        public Builder multiplexedModelId(String multiplexedModelId) {
            this.multiplexedModelId = multiplexedModelId != null ? multiplexedModelId : "";
            return this;
        }

        public Builder http(boolean httpRequest) {
            this.httpRequest = httpRequest;
            return this;
        }

        public Builder streaming(boolean streaming) {
            this.streaming = streaming;
            return this;
        }

        public Builder grpc(GrpcRequestContext grpcContext) {
            this.grpcRequest = true;
            this.grpcContext = Objects.requireNonNull(grpcContext);
            return this;
        }

        public RequestMetadata build() {
            return new RequestMetadata(this);
        }
    }
}
