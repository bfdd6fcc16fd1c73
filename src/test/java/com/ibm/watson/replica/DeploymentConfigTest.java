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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeploymentConfigTest {

    @Test
    void testDefaultsFromJson() throws Exception {
        DeploymentConfig config = DeploymentConfig.fromJson("{\"maxConcurrentQueries\": 8}"
                .getBytes(StandardCharsets.UTF_8));
        assertEquals(8, config.getMaxConcurrentQueries());
        assertNull(config.getUserConfig());
        assertNull(config.getAutoscalingConfig());
        assertEquals(DeploymentConfig.DEFAULT_GRACEFUL_SHUTDOWN_WAIT_LOOP_MS,
                config.getGracefulShutdownWaitLoopMillis());
        assertEquals(LoggingConfig.DEFAULT, config.getLoggingConfig());
        assertEquals("INFO", config.getLoggingConfig().getLogLevel());
        assertTrue(config.getLoggingConfig().isEnableAccessLog());
    }

    @Test
    void testJsonPreservesAllFields() throws Exception {
        DeploymentConfig config = DeploymentConfig.DEFAULT
                .withUserConfig(Map.of("threshold", 0.5, "labels", "a,b"))
                .withMaxConcurrentQueries(4)
                .withGracefulShutdownWaitLoopMillis(100)
                .withAutoscalingConfig(new AutoscalingConfig(2, 5, 1.5, 1000L, 5000L))
                .withLoggingConfig(new LoggingConfig("debug", false));
        DeploymentConfig parsed = DeploymentConfig.fromJson(config.toJson());
        assertEquals(config, parsed);
        assertEquals("DEBUG", parsed.getLoggingConfig().getLogLevel());
        assertEquals(5, parsed.getAutoscalingConfig().getMaxReplicas());
    }

    @Test
    void testInvalidConfigsRejected() {
        assertThrows(IOException.class, () -> DeploymentConfig.fromJson("{\"maxConcurrentQuerys\": 1}"
                .getBytes(StandardCharsets.UTF_8)));
        assertThrows(IllegalArgumentException.class, () -> DeploymentConfig.DEFAULT.withMaxConcurrentQueries(0));
        assertThrows(IllegalArgumentException.class,
                () -> DeploymentConfig.DEFAULT.withGracefulShutdownWaitLoopMillis(-1));
        assertThrows(IllegalArgumentException.class, () -> new AutoscalingConfig(3, 2, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new AutoscalingConfig(null, null, null, 0L, null));
    }

    @Test
    void testVersionComparisons() {
        DeploymentConfig base = DeploymentConfig.DEFAULT.withUserConfig(Map.of("k", "v"));
        DeploymentVersion v1 = new DeploymentVersion("code-1", base);

        DeploymentVersion sameConfig = DeploymentVersion.fromDeploymentVersion(v1, base);
        assertFalse(sameConfig.requiresReplicaRestart(v1));
        assertFalse(sameConfig.requiresReplicaReconfigure(v1));
        assertEquals(v1, sameConfig);

        DeploymentVersion newUserConfig = DeploymentVersion.fromDeploymentVersion(v1,
                base.withUserConfig(Map.of("k", "w")));
        assertTrue(newUserConfig.requiresReplicaReconfigure(v1));
        assertFalse(newUserConfig.requiresLongPollBroadcast(v1));

        DeploymentVersion newConcurrency = DeploymentVersion.fromDeploymentVersion(v1,
                base.withMaxConcurrentQueries(3));
        assertTrue(newConcurrency.requiresReplicaReconfigure(v1));
        assertTrue(newConcurrency.requiresLongPollBroadcast(v1));

        // autoscaling and logging changes are applied without calling the handler
        DeploymentVersion newAutoscaling = DeploymentVersion.fromDeploymentVersion(v1,
                base.withAutoscalingConfig(new AutoscalingConfig(1, 2, 1.0, null, null))
                        .withLoggingConfig(new LoggingConfig("WARN", true)));
        assertFalse(newAutoscaling.requiresReplicaReconfigure(v1));

        assertTrue(new DeploymentVersion("code-2", base).requiresReplicaRestart(v1));
    }
}
