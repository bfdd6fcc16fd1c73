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

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A complete HTTP response. Handlers may return one of these to control the
 * status and headers; other return values are converted by {@link HttpResponses}.
 */
public class HttpResponse {
    private final int status;
    private final Map<String, String> headers;
    private final byte[] body;

    public HttpResponse(int status, Map<String, String> headers, byte[] body) {
        this.status = status;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body != null ? body : HttpMessage.NO_BODY;
    }

    public static HttpResponse of(HttpResponseStatus status, CharSequence contentType, byte[] body) {
        return new HttpResponse(status.code(),
                Collections.singletonMap(HttpHeaderNames.CONTENT_TYPE.toString(), contentType.toString()), body);
    }

    public static HttpResponse text(HttpResponseStatus status, String text) {
        return of(status, HttpHeaderValues.TEXT_PLAIN + "; charset=utf-8", text.getBytes(StandardCharsets.UTF_8));
    }

    public int getStatus() {
        return status;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public byte[] getBody() {
        return body;
    }

    /**
     * Emits this response as a start message followed by a single body message.
     */
    public void send(HttpSend send) throws IOException {
        Map<String, String> hdrs = new LinkedHashMap<>(headers);
        hdrs.put(HttpHeaderNames.CONTENT_LENGTH.toString(), String.valueOf(body.length));
        send.send(HttpMessage.responseStart(status, hdrs));
        send.send(HttpMessage.responseBody(body, false));
    }

    @Override
    public String toString() {
        return "HttpResponse[" + status + ", " + body.length + "B]";
    }
}
