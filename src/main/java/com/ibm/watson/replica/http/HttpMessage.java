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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One message of the HTTP gateway protocol spoken between the proxy and the
 * replica: an inbound body chunk, a disconnect notification, or an outbound
 * response start / body chunk.
 */
public final class HttpMessage {
    static final byte[] NO_BODY = new byte[0];

    public enum Type {
        REQUEST_BODY("http.request"),
        DISCONNECT("http.disconnect"),
        RESPONSE_START("http.response.start"),
        RESPONSE_BODY("http.response.body");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        static Type fromWireName(String name) {
            for (Type t : values()) {
                if (t.wireName.equals(name)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Unknown http message type: " + name);
        }
    }

    private final Type type;
    private final int status; // RESPONSE_START only
    private final Map<String, String> headers; // RESPONSE_START only
    private final byte[] body;
    private final boolean moreBody;

    HttpMessage(Type type, int status, Map<String, String> headers, byte[] body, boolean moreBody) {
        this.type = type;
        this.status = status;
        this.headers = headers;
        this.body = body;
        this.moreBody = moreBody;
    }

    public static HttpMessage requestBody(byte[] body, boolean moreBody) {
        return new HttpMessage(Type.REQUEST_BODY, 0, Collections.emptyMap(), nonNull(body), moreBody);
    }

    public static HttpMessage disconnect() {
        return new HttpMessage(Type.DISCONNECT, 0, Collections.emptyMap(), NO_BODY, false);
    }

    public static HttpMessage responseStart(int status, Map<String, String> headers) {
        return new HttpMessage(Type.RESPONSE_START, status,
                Collections.unmodifiableMap(new LinkedHashMap<>(headers)), NO_BODY, false);
    }

    public static HttpMessage responseBody(byte[] body, boolean moreBody) {
        return new HttpMessage(Type.RESPONSE_BODY, 0, Collections.emptyMap(), nonNull(body), moreBody);
    }

    private static byte[] nonNull(byte[] body) {
        return body != null ? body : NO_BODY;
    }

    public Type getType() {
        return type;
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

    public boolean isMoreBody() {
        return moreBody;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof HttpMessage)) {
            return false;
        }
        HttpMessage other = (HttpMessage) o;
        return type == other.type && status == other.status && moreBody == other.moreBody
               && headers.equals(other.headers) && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, status, headers, moreBody) * 31 + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "HttpMessage[" + type.wireName + (type == Type.RESPONSE_START ? " " + status : "")
               + ", body=" + body.length + "B" + (moreBody ? ", more" : "") + "]";
    }
}
