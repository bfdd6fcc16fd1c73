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

import io.grpc.Context;

import java.util.concurrent.CancellationException;

/**
 * Completes a streaming request's envelope when its stream ends, fails, or
 * is cancelled, and makes the request's context current while each item is
 * produced.
 */
final class EnvelopedResponseStream implements ResponseStream<Object> {
    private final ResponseStream<?> stream;
    private final RequestEnvelope envelope;

    EnvelopedResponseStream(ResponseStream<?> stream, RequestEnvelope envelope) {
        this.stream = stream;
        this.envelope = envelope;
    }

    @Override
    public boolean hasNext() throws Exception {
        Context previous = envelope.attach();
        try {
            boolean more = stream.hasNext();
            if (!more) {
                envelope.complete(stream.isCancelled() ? new CancellationException("stream cancelled") : null);
            }
            return more;
        } catch (Exception | Error t) {
            envelope.complete(t);
            throw t;
        } finally {
            envelope.detach(previous);
        }
    }

    @Override
    public Object next() throws Exception {
        Context previous = envelope.attach();
        try {
            return stream.next();
        } catch (Exception | Error t) {
            envelope.complete(t);
            throw t;
        } finally {
            envelope.detach(previous);
        }
    }

    @Override
    public void cancel() {
        stream.cancel();
        envelope.complete(new CancellationException("stream cancelled"));
    }

    @Override
    public boolean isCancelled() {
        return stream.isCancelled();
    }
}
