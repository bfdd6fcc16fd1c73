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

/**
 * A gRPC response (or streamed response item), serialized and paired with
 * the request's protocol context so that the status and trailers set by the
 * handler reach the caller.
 */
public final class GrpcResult {
    private final GrpcRequestContext context;
    private final byte[] payload;

    public GrpcResult(GrpcRequestContext context, byte[] payload) {
        this.context = context;
        this.payload = payload;
    }

    public GrpcRequestContext getContext() {
        return context;
    }

    public byte[] getPayload() {
        return payload;
    }
}
