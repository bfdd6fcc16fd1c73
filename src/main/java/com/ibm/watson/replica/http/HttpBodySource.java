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

import java.util.List;

/**
 * Caller-side source of the inbound messages of a streamed HTTP request,
 * typically a call back to the proxy which holds the client connection.
 */
@FunctionalInterface
public interface HttpBodySource {

    /**
     * Blocks until at least one message is available for the request.
     *
     * @return the next messages, in order; a {@link HttpMessage.Type#DISCONNECT}
     *     message ends the sequence
     */
    List<HttpMessage> receiveMessages(String requestId) throws Exception;
}
