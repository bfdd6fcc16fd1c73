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

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The public methods of a handler instance, by name. Built once when the
 * handler is initialized.
 */
final class MethodTable {
    private final Object target;
    private final DeploymentFunction function;
    private final Map<String, List<Method>> methods;

    private MethodTable(Object target, DeploymentFunction function, Map<String, List<Method>> methods) {
        this.target = target;
        this.function = function;
        this.methods = methods;
    }

    static MethodTable forInstance(Object instance) {
        Map<String, List<Method>> methods = new TreeMap<>();
        for (Method m : instance.getClass().getMethods()) {
            if (m.getDeclaringClass() == Object.class || m.isSynthetic() || m.isBridge()
                || Modifier.isStatic(m.getModifiers())) {
                continue;
            }
            methods.computeIfAbsent(m.getName(), k -> new ArrayList<>(2)).add(m);
        }
        return new MethodTable(instance, null, methods);
    }

    /**
     * A function handler answers to every method name.
     */
    static MethodTable forFunction(DeploymentFunction function) {
        return new MethodTable(function, function, Collections.emptyMap());
    }

    List<String> getMethodNames() {
        return new ArrayList<>(methods.keySet());
    }

    /**
     * Resolves a method by name. If the method is overloaded, the overload whose
     * number of bindable parameters equals {@code arity} is preferred.
     *
     * @param arity expected number of bound arguments, or -1 if not known
     * @throws MethodNotFoundException if there's no public method of that name
     */
    UserMethod resolve(String name, int arity) throws MethodNotFoundException {
        if (function != null) {
            return UserMethod.ofFunction(name, function);
        }
        List<Method> candidates = methods.get(name);
        if (candidates == null) {
            throw new MethodNotFoundException(name, getMethodNames());
        }
        Method chosen = candidates.get(0);
        if (candidates.size() > 1 && arity >= 0) {
            for (Method m : candidates) {
                if (ArgumentBinder.bindableParameterCount(m) == arity) {
                    chosen = m;
                    break;
                }
            }
        }
        return UserMethod.of(target, chosen);
    }

    /**
     * @return the method with exactly the given parameter types, or null
     */
    UserMethod find(String name, Class<?>... parameterTypes) {
        List<Method> candidates = methods.get(name);
        if (candidates != null) {
            for (Method m : candidates) {
                if (Arrays.equals(m.getParameterTypes(), parameterTypes)) {
                    return UserMethod.of(target, m);
                }
            }
        }
        return null;
    }
}
