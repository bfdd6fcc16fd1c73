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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.io.IOException;
import java.util.Collections;

/**
 * Conversion of handler return values into HTTP responses.
 */
public final class HttpResponses {
    private static final ObjectMapper mapper = new ObjectMapper();

    private HttpResponses() {}

    /**
     * {@link HttpResponse}s are passed through, byte arrays become octet-stream
     * bodies, strings become text, null an empty 200, anything else JSON.
     */
    public static HttpResponse toResponse(Object result) throws JsonProcessingException {
        if (result instanceof HttpResponse) {
            return (HttpResponse) result;
        }
        if (result == null) {
            return new HttpResponse(HttpResponseStatus.OK.code(), Collections.emptyMap(), null);
        }
        if (result instanceof byte[]) {
            return HttpResponse.of(HttpResponseStatus.OK, HttpHeaderValues.APPLICATION_OCTET_STREAM, (byte[]) result);
        }
        if (result instanceof CharSequence) {
            return HttpResponse.text(HttpResponseStatus.OK, result.toString());
        }
        return HttpResponse.of(HttpResponseStatus.OK, HttpHeaderValues.APPLICATION_JSON,
                mapper.writeValueAsBytes(result));
    }

    public static void send(Object result, HttpSend send) throws IOException {
        toResponse(result).send(send);
    }

    public static HttpResponse internalError(Throwable t) {
        return HttpResponse.text(HttpResponseStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error, traceback: " + t + ".");
    }
}
