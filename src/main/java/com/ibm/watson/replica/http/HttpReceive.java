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

import java.io.IOException;

/**
 * Pulls the next inbound message of a request ({@link HttpMessage.Type#REQUEST_BODY}
 * or {@link HttpMessage.Type#DISCONNECT}), blocking until one is available.
 */
@FunctionalInterface
public interface HttpReceive {

    HttpMessage receive() throws IOException, InterruptedException;
}
