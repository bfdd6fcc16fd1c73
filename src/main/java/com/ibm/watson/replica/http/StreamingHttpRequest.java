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

package com.ibm.watson.replica.http;

/**
 * The single argument of a streamed HTTP call: the serialized {@link HttpScope}
 * and the source of the request's inbound messages.
 */
public final class StreamingHttpRequest {
    private final byte[] scopeJson;
    private final HttpBodySource bodySource;

    public StreamingHttpRequest(byte[] scopeJson, HttpBodySource bodySource) {
        this.scopeJson = scopeJson;
        this.bodySource = bodySource;
    }

    public static StreamingHttpRequest of(HttpScope scope, HttpBodySource bodySource) {
        return new StreamingHttpRequest(scope.toJson(), bodySource);
    }

    public byte[] getScopeJson() {
        return scopeJson;
    }

    public HttpBodySource getBodySource() {
        return bodySource;
    }
}
