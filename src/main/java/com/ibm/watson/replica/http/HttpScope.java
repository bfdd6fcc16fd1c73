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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The request line and headers of an HTTP request, as forwarded by the proxy.
 * Header names are lower-case.
 */
public final class HttpScope {
    private static final ObjectMapper mapper = new ObjectMapper();

    private final String type;
    private final String method;
    private final String scheme;
    private final String path;
    private final String queryString;
    private final Map<String, String> headers;
    private final String client;

    @JsonCreator
    public HttpScope(@JsonProperty("type") String type,
                     @JsonProperty("method") String method,
                     @JsonProperty("scheme") String scheme,
                     @JsonProperty("path") String path,
                     @JsonProperty("queryString") String queryString,
                     @JsonProperty("headers") Map<String, String> headers,
                     @JsonProperty("client") String client) {
        this.type = type != null ? type : "http";
        this.method = method != null ? method.toUpperCase(Locale.ROOT) : "GET";
        this.scheme = scheme != null ? scheme : "http";
        this.path = path != null ? path : "/";
        this.queryString = queryString != null ? queryString : "";
        Map<String, String> hdrs = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((k, v) -> hdrs.put(k.toLowerCase(Locale.ROOT), v));
        }
        this.headers = Collections.unmodifiableMap(hdrs);
        this.client = client;
    }

    public static HttpScope of(String method, String path, Map<String, String> headers) {
        return new HttpScope("http", method, "http", path, "", headers, null);
    }

    public static HttpScope fromJson(byte[] json) throws IOException {
        return mapper.readValue(json, HttpScope.class);
    }

    public byte[] toJson() {
        try {
            return mapper.writeValueAsBytes(this);
        } catch (JsonProcessingException jpe) {
            throw new IllegalStateException(jpe);
        }
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("method")
    public String getMethod() {
        return method;
    }

    @JsonProperty("scheme")
    public String getScheme() {
        return scheme;
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    @JsonProperty("queryString")
    public String getQueryString() {
        return queryString;
    }

    @JsonProperty("headers")
    public Map<String, String> getHeaders() {
        return headers;
    }

    @JsonProperty("client")
    public String getClient() {
        return client;
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return method + " " + path + (queryString.isEmpty() ? "" : "?" + queryString);
    }
}
