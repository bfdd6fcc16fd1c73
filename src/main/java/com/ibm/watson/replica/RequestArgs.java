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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Positional and named arguments of a call. Named arguments are bound to
 * handler method parameters by name.
 */
public final class RequestArgs {
    public static final RequestArgs EMPTY = new RequestArgs(Collections.emptyList(), Collections.emptyMap());

    private final List<Object> args;
    private final Map<String, Object> kwargs;

    private RequestArgs(List<Object> args, Map<String, Object> kwargs) {
        this.args = args;
        this.kwargs = kwargs;
    }

    public static RequestArgs of(Object... args) {
        return args.length == 0 ? EMPTY
                : new RequestArgs(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args))),
                        Collections.emptyMap());
    }

    public static RequestArgs of(List<?> args, Map<String, ?> kwargs) {
        return new RequestArgs(Collections.unmodifiableList(new ArrayList<>(args)),
                Collections.unmodifiableMap(new LinkedHashMap<>(kwargs)));
    }

    /**
     * @return list of positional args; may contain nulls
     */
    public List<Object> getArgs() {
        return args;
    }

    public Map<String, Object> getKwargs() {
        return kwargs;
    }

    public int size() {
        return args.size() + kwargs.size();
    }

    @Override
    public String toString() {
        return "RequestArgs[args=" + args.size() + ", kwargs=" + kwargs.keySet() + "]";
    }
}
