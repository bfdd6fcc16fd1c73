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
 * Capability of handlers which speak the HTTP message protocol themselves,
 * typically an embedded web framework. Such handlers are given the raw scope,
 * receive and send channels instead of an {@link HttpRequest}, and are
 * responsible for sending their own response.
 */
public interface HttpApp {

    void call(HttpScope scope, HttpReceive receive, HttpSend send) throws Exception;

    /**
     * Lifespan startup hook, run once when the replica initializes the handler.
     */
    default void startup() throws Exception {}
}
