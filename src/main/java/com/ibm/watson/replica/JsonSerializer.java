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

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * {@link Serializer} producing JSON. Values deserialize to plain maps, lists,
 * strings, numbers and booleans.
 */
public class JsonSerializer implements Serializer {

    private final ObjectMapper mapper;

    public JsonSerializer() {
        this(new ObjectMapper());
    }

    public JsonSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] serialize(Object value) throws IOException {
        return mapper.writeValueAsBytes(value);
    }

    @Override
    public Object deserialize(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, Object.class);
    }
}
