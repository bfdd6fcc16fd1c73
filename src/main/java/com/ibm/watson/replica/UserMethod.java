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

import io.grpc.stub.StreamObserver;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Iterator;
import java.util.stream.BaseStream;

/**
 * A resolved, invocable handler method.
 */
final class UserMethod {

    enum Kind {
        /** returns a single result */
        UNARY,
        /** returns an {@link Iterator} or {@link BaseStream} */
        GENERATOR,
        /** emits results to a {@link StreamObserver} parameter */
        ASYNC_GENERATOR
    }

    private final String name;
    private final Object target;
    private final Method method; // null for function handlers
    private final DeploymentFunction function;
    private final Kind kind;

    private UserMethod(String name, Object target, Method method, DeploymentFunction function) {
        this.name = name;
        this.target = target;
        this.method = method;
        this.function = function;
        this.kind = method == null ? Kind.UNARY : kindOf(method);
    }

    static UserMethod of(Object target, Method method) {
        method.trySetAccessible();
        return new UserMethod(method.getName(), target, method, null);
    }

    static UserMethod ofFunction(String name, DeploymentFunction function) {
        return new UserMethod(name, function, null, function);
    }

    static Kind kindOf(Method method) {
        for (Class<?> type : method.getParameterTypes()) {
            if (StreamObserver.class.isAssignableFrom(type)) {
                return Kind.ASYNC_GENERATOR;
            }
        }
        Class<?> rt = method.getReturnType();
        return Iterator.class.isAssignableFrom(rt) || BaseStream.class.isAssignableFrom(rt)
                ? Kind.GENERATOR : Kind.UNARY;
    }

    String getName() {
        return name;
    }

    Kind getKind() {
        return kind;
    }

    boolean isFunction() {
        return function != null;
    }

    /**
     * @return number of parameters bound from request arguments, or -1 for
     *     function handlers, which accept any number
     */
    int getArity() {
        return method == null ? -1 : ArgumentBinder.bindableParameterCount(method);
    }

    /**
     * @return declared type of the first parameter bound from request arguments,
     *     {@code Object} for function handlers and null if there is none
     */
    Class<?> getFirstArgumentType() {
        if (method == null) {
            return Object.class;
        }
        for (Class<?> type : method.getParameterTypes()) {
            if (!ArgumentBinder.isInjected(type)) {
                return type;
            }
        }
        return null;
    }

    /**
     * Invokes the method, rethrowing whatever it throws as-is.
     *
     * @throws UsageException if the arguments can't be bound
     */
    Object invoke(RequestArgs args, GrpcRequestContext grpcContext, StreamObserver<?> observer)
            throws Exception {
        if (function != null) {
            if (!args.getKwargs().isEmpty()) {
                throw new UsageException("Function deployments accept positional arguments only, got "
                                         + args.getKwargs().keySet());
            }
            return function.call(args.getArgs().toArray());
        }
        Object[] values = ArgumentBinder.bind(method, name, args, grpcContext, observer);
        try {
            return method.invoke(target, values);
        } catch (InvocationTargetException ite) {
            Throwable cause = ite.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw (Exception) cause;
        }
    }

    @Override
    public String toString() {
        return name + (method != null ? "/" + getArity() : "") + "[" + kind + "]";
    }
}
