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

import com.google.common.primitives.Primitives;
import io.grpc.stub.StreamObserver;

import java.lang.reflect.Array;
import java.lang.reflect.Executable;
import java.lang.reflect.Parameter;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds {@link RequestArgs} onto the parameters of a handler method or
 * constructor.
 * <p>
 * Parameters of type {@link GrpcRequestContext} or {@link StreamObserver} are
 * injected rather than bound. The remaining parameters are filled first from the
 * positional arguments in order, then from the named arguments by parameter
 * name. A trailing varargs parameter absorbs any extra positional arguments.
 */
final class ArgumentBinder {

    private ArgumentBinder() {}

    static boolean isInjected(Class<?> type) {
        return type == GrpcRequestContext.class || StreamObserver.class.isAssignableFrom(type);
    }

    /**
     * @return the number of parameters which are bound from request arguments
     */
    static int bindableParameterCount(Executable exe) {
        int count = 0;
        for (Class<?> type : exe.getParameterTypes()) {
            if (!isInjected(type)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @param grpcContext   injected into a {@link GrpcRequestContext} parameter, may be null
     * @param observer      injected into a {@link StreamObserver} parameter, may be null
     * @throws UsageException if the arguments don't fit the parameters
     */
    static Object[] bind(Executable exe, String name, RequestArgs args,
                         GrpcRequestContext grpcContext, StreamObserver<?> observer) throws UsageException {
        Parameter[] params = exe.getParameters();
        Object[] values = new Object[params.length];
        List<Object> positional = args.getArgs();
        Map<String, Object> named = args.getKwargs();
        Set<String> usedNames = new HashSet<>();
        int nextPositional = 0;

        for (int i = 0; i < params.length; i++) {
            Parameter param = params[i];
            Class<?> type = param.getType();
            if (type == GrpcRequestContext.class) {
                values[i] = grpcContext;
                continue;
            }
            if (StreamObserver.class.isAssignableFrom(type)) {
                values[i] = observer;
                continue;
            }
            if (param.isVarArgs()) {
                Class<?> componentType = type.getComponentType();
                int count = positional.size() - nextPositional;
                Object array = Array.newInstance(componentType, count);
                for (int j = 0; j < count; j++) {
                    Array.set(array, j, checkType(name, param, componentType, positional.get(nextPositional++)));
                }
                values[i] = array;
                continue;
            }
            if (nextPositional < positional.size()) {
                if (param.isNamePresent() && named.containsKey(param.getName())) {
                    throw new UsageException(name + "() got multiple values for argument '"
                                             + param.getName() + "'");
                }
                values[i] = checkType(name, param, type, positional.get(nextPositional++));
            } else if (param.isNamePresent() && named.containsKey(param.getName())) {
                usedNames.add(param.getName());
                values[i] = checkType(name, param, type, named.get(param.getName()));
            } else {
                throw new UsageException(name + "() missing required argument '" + param.getName() + "'");
            }
        }
        if (nextPositional < positional.size()) {
            throw new UsageException(name + "() takes " + bindableParameterCount(exe)
                                     + " positional arguments but " + positional.size() + " were given");
        }
        for (String key : named.keySet()) {
            if (!usedNames.contains(key)) {
                throw new UsageException(name + "() got an unexpected keyword argument '" + key + "'");
            }
        }
        return values;
    }

    private static Object checkType(String name, Parameter param, Class<?> type, Object value)
            throws UsageException {
        if (value == null) {
            if (type.isPrimitive()) {
                throw new UsageException(name + "() argument '" + param.getName() + "' must not be null");
            }
            return null;
        }
        if (!Primitives.wrap(type).isInstance(value)) {
            throw new UsageException(name + "() argument '" + param.getName() + "' must be of type "
                                     + type.getSimpleName() + ", not " + value.getClass().getSimpleName());
        }
        return value;
    }
}
