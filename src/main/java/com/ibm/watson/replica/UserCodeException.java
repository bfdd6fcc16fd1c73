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

/**
 * Wraps an exception thrown by user handler code, attaching the name of the
 * method that was executing.
 */
public class UserCodeException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String methodName;

    public UserCodeException(String methodName, Throwable cause) {
        super("Exception in user method '" + methodName + "': " + cause, cause);
        this.methodName = methodName;
    }

    public String getMethodName() {
        return methodName;
    }

    static UserCodeException wrap(String methodName, Throwable t) {
        return t instanceof UserCodeException ? (UserCodeException) t : new UserCodeException(methodName, t);
    }
}
