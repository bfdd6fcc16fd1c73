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

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

import java.util.concurrent.CancellationException;

/**
 * Outcome of a request, as recorded in access logs and metrics.
 */
public enum RequestStatus {
    OK,
    CANCELLED,
    ERROR;

    public static RequestStatus of(Throwable failure) {
        if (failure == null) {
            return OK;
        }
        return isCancellation(failure) ? CANCELLED : ERROR;
    }

    /**
     * Cancellation is signalled by the caller going away or cancelling, and is
     * reported as a status rather than an error.
     */
    public static boolean isCancellation(Throwable t) {
        for (int depth = 0; t != null && depth < 8; t = t.getCause(), depth++) {
            if (t instanceof CancellationException || t instanceof InterruptedException) {
                return true;
            }
            Status status = t instanceof StatusRuntimeException ? ((StatusRuntimeException) t).getStatus()
                    : t instanceof StatusException ? ((StatusException) t).getStatus() : null;
            if (status != null) {
                return status.getCode() == Status.Code.CANCELLED;
            }
        }
        return false;
    }
}
