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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.util.Locale;

import static com.ibm.watson.replica.ReplicaEnvVars.ACCESS_LOG_ENV_VAR;
import static com.ibm.watson.replica.ReplicaEnvVars.LOG_FILE_ENV_VAR;
import static com.ibm.watson.replica.ReplicaEnvVars.getStringParameter;

/**
 * Applies a deployment's {@link LoggingConfig} to the replica's loggers.
 */
final class ReplicaLogging {
    private static final Logger logger = LogManager.getLogger(ReplicaLogging.class);

    static final String BASE_LOGGER_NAME = "com.ibm.watson.replica";
    static final String ACCESS_LOGGER_NAME = BASE_LOGGER_NAME + ".access";

    private ReplicaLogging() {}

    /**
     * @return whether access log records should be written
     */
    static boolean configure(String componentName, LoggingConfig config) {
        Level level = Level.toLevel(config.getLogLevel(), Level.INFO);
        boolean accessLog = config.isEnableAccessLog()
                            && !"false".equalsIgnoreCase(getStringParameter(ACCESS_LOG_ENV_VAR, "true"));
        Configurator.setLevel(BASE_LOGGER_NAME, level);
        Configurator.setLevel(ACCESS_LOGGER_NAME, accessLog ? Level.INFO : Level.OFF);
        logger.info("Logging for " + componentName + " configured at level " + level
                    + (accessLog ? "" : ", access log disabled"));
        return accessLog;
    }

    static String accessLogMessage(String callMethod, RequestStatus status, double latencyMillis) {
        return String.format(Locale.ROOT, "CALL %s %s %.1fms", callMethod, status, latencyMillis);
    }

    /**
     * @return path of the replica's log file, or null if not known
     */
    static String logFilePath() {
        return getStringParameter(LOG_FILE_ENV_VAR, null);
    }
}
