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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * The logging-specific portion of a deployment config. A change to this
 * portion causes the replica's log configuration to be reapplied.
 */
public final class LoggingConfig {
    public static final LoggingConfig DEFAULT = new LoggingConfig(null, null);

    private final String logLevel;
    private final boolean enableAccessLog;

    @JsonCreator
    public LoggingConfig(@JsonProperty("logLevel") String logLevel,
                         @JsonProperty("enableAccessLog") Boolean enableAccessLog) {
        this.logLevel = logLevel != null ? logLevel.toUpperCase() : "INFO";
        this.enableAccessLog = enableAccessLog == null || enableAccessLog;
    }

    @JsonProperty("logLevel")
    public String getLogLevel() {
        return logLevel;
    }

    @JsonProperty("enableAccessLog")
    public boolean isEnableAccessLog() {
        return enableAccessLog;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof LoggingConfig)) {
            return false;
        }
        LoggingConfig other = (LoggingConfig) o;
        return logLevel.equals(other.logLevel) && enableAccessLog == other.enableAccessLog;
    }

    @Override
    public int hashCode() {
        return Objects.hash(logLevel, enableAccessLog);
    }

    @Override
    public String toString() {
        return "LoggingConfig[logLevel=" + logLevel + ", enableAccessLog=" + enableAccessLog + "]";
    }
}
