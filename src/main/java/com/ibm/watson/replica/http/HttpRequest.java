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

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Request object given to plain (non-{@link HttpApp}) handlers for HTTP calls.
 * The body is read lazily from the receive channel, at most once.
 */
public class HttpRequest {
    private static final ObjectMapper mapper = new ObjectMapper();

    private final HttpScope scope;
    private final HttpReceive receive;

    private byte[] body;
    private boolean disconnected;

    public HttpRequest(HttpScope scope, HttpReceive receive) {
        this.scope = scope;
        this.receive = receive;
    }

    public HttpScope getScope() {
        return scope;
    }

    public String getMethod() {
        return scope.getMethod();
    }

    public String getPath() {
        return scope.getPath();
    }

    public String getQueryString() {
        return scope.getQueryString();
    }

    public String header(String name) {
        return scope.header(name);
    }

    /**
     * @return true if the client disconnected while the body was being read
     */
    public boolean isDisconnected() {
        return disconnected;
    }

    public synchronized byte[] body() throws IOException, InterruptedException {
        if (body == null) {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            while (true) {
                HttpMessage msg = receive.receive();
                if (msg.getType() == HttpMessage.Type.DISCONNECT) {
                    disconnected = true;
                    break;
                }
                baos.write(msg.getBody());
                if (!msg.isMoreBody()) {
                    break;
                }
            }
            body = baos.toByteArray();
        }
        return body;
    }

    public String text() throws IOException, InterruptedException {
        return new String(body(), StandardCharsets.UTF_8);
    }

    public <T> T json(Class<T> type) throws IOException, InterruptedException {
        return mapper.readValue(body(), type);
    }

    @Override
    public String toString() {
        return "HttpRequest[" + scope + "]";
    }
}
