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

import java.util.List;

public class MethodNotFoundException extends ReplicaException {
    private static final long serialVersionUID = 1L;

    private final String methodName;
    private final List<String> availableMethods;

    public MethodNotFoundException(String methodName, List<String> availableMethods) {
        super("Tried to call a method '" + methodName + "' that does not exist. Available methods: "
              + availableMethods + ".");
        this.methodName = methodName;
        this.availableMethods = List.copyOf(availableMethods);
    }

    public String getMethodName() {
        return methodName;
    }

    /**
     * @return sorted names of the handler's public methods
     */
    public List<String> getAvailableMethods() {
        return availableMethods;
    }
}
