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

import io.grpc.Metadata;
import io.grpc.Status;

/**
 * Protocol context of a gRPC request. Handler methods receive it by
 * declaring a parameter of this type, and may use it to read the invocation
 * metadata and to set the status and trailers of the response.
 */
public class GrpcRequestContext {
    private final String fullMethodName;
    private final Metadata invocationMetadata;
    private final Metadata trailingMetadata = new Metadata();

    private volatile Status.Code code = Status.Code.OK;
    private volatile String details = "";

    public GrpcRequestContext(String fullMethodName, Metadata invocationMetadata) {
        this.fullMethodName = fullMethodName;
        this.invocationMetadata = invocationMetadata != null ? invocationMetadata : new Metadata();
    }

    public String getFullMethodName() {
        return fullMethodName;
    }

    public Metadata getInvocationMetadata() {
        return invocationMetadata;
    }

    public Status.Code getCode() {
        return code;
    }

    public void setCode(Status.Code code) {
        this.code = code;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details != null ? details : "";
    }

    /**
     * @return trailing metadata to send with the response, may be added to by the handler
     */
    public Metadata getTrailingMetadata() {
        return trailingMetadata;
    }

    public Status toStatus() {
        Status status = Status.fromCode(code);
        return details.isEmpty() ? status : status.withDescription(details);
    }

    @Override
    public String toString() {
        return "GrpcRequestContext[" + fullMethodName + ", code=" + code + "]";
    }
}
