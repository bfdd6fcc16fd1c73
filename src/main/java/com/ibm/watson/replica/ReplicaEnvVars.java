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
 * Configuration environment variable constants. Each may alternatively
 * be provided as a system property of the same name.
 */
public final class ReplicaEnvVars {

    private ReplicaEnvVars() {}

    // core size of the pool which runs user requests
    public static final String REQUEST_THREADS_ENV_VAR = "SERVE_REQUEST_THREADS";

    public static final String GAUGE_METRIC_SET_PERIOD_ENV_VAR = "SERVE_GAUGE_METRIC_SET_PERIOD_MS";
    public static final String AUTOSCALING_METRIC_RECORD_PERIOD_ENV_VAR = "SERVE_AUTOSCALING_METRIC_RECORD_PERIOD_MS";

    // "false" disables per-request access log records regardless of deployment logging config
    public static final String ACCESS_LOG_ENV_VAR = "SERVE_ACCESS_LOG";

    // reported back to the controller from isAllocated()
    public static final String LOG_FILE_ENV_VAR = "SERVE_LOG_FILE";

    static String getStringParameter(String name, String defaultVal) {
        String value = System.getenv(name);
        return value != null ? value : System.getProperty(name, defaultVal);
    }

    static int getIntParameter(String name, int defaultVal) {
        String value = System.getenv(name);
        return value != null ? Integer.parseInt(value) : Integer.getInteger(name, defaultVal);
    }

    static long getLongParameter(String name, long defaultVal) {
        String value = System.getenv(name);
        return value != null ? Long.parseLong(value) : Long.getLong(name, defaultVal);
    }
}
