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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary encoding of a batch of {@link HttpMessage}s: the message count,
 * then for each message its type name, status, headers, body and more-body
 * flag.
 */
public final class HttpMessageBatchSerializer {

    private HttpMessageBatchSerializer() {}

    public static byte[] serialize(List<HttpMessage> messages) throws IOException {
        int size = 4;
        for (HttpMessage msg : messages) {
            size += 32 + msg.getBody().length;
        }
        ByteArrayOutputStream baos = new ByteArrayOutputStream(size);
        try (DataOutputStream out = new DataOutputStream(baos)) {
            out.writeInt(messages.size());
            for (HttpMessage msg : messages) {
                out.writeUTF(msg.getType().wireName());
                out.writeInt(msg.getStatus());
                Map<String, String> headers = msg.getHeaders();
                out.writeInt(headers.size());
                for (Map.Entry<String, String> ent : headers.entrySet()) {
                    out.writeUTF(ent.getKey());
                    out.writeUTF(ent.getValue());
                }
                out.writeInt(msg.getBody().length);
                out.write(msg.getBody());
                out.writeBoolean(msg.isMoreBody());
            }
        }
        return baos.toByteArray();
    }

    public static List<HttpMessage> deserialize(byte[] bytes) throws IOException {
        DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes));
        int count = in.readInt();
        List<HttpMessage> messages = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            HttpMessage.Type type;
            try {
                type = HttpMessage.Type.fromWireName(in.readUTF());
            } catch (IllegalArgumentException iae) {
                throw new IOException(iae.getMessage());
            }
            int status = in.readInt();
            int headerCount = in.readInt();
            Map<String, String> headers = new LinkedHashMap<>();
            for (int h = 0; h < headerCount; h++) {
                headers.put(in.readUTF(), in.readUTF());
            }
            byte[] body = new byte[in.readInt()];
            in.readFully(body);
            boolean more = in.readBoolean();
            messages.add(new HttpMessage(type, status, Collections.unmodifiableMap(headers),
                    body.length == 0 ? HttpMessage.NO_BODY : body, more));
        }
        return messages;
    }
}
