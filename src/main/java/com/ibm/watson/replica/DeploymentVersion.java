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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.util.Objects;

/**
 * Version of a deployment as seen by one replica: the code version it was
 * created with plus the config it currently runs with. Derived versions keep
 * the code version, so the controller can tell whether a replica's advertised
 * state is stale and what kind of update it needs.
 */
public final class DeploymentVersion {
    private final String codeVersion;
    private final DeploymentConfig deploymentConfig;

    private final String reconfigureHash;

    public DeploymentVersion(String codeVersion, DeploymentConfig deploymentConfig) {
        this.codeVersion = Objects.requireNonNull(codeVersion, "codeVersion");
        this.deploymentConfig = Objects.requireNonNull(deploymentConfig, "deploymentConfig");
        this.reconfigureHash = computeReconfigureHash(deploymentConfig);
    }

    public static DeploymentVersion fromDeploymentVersion(DeploymentVersion version, DeploymentConfig config) {
        return new DeploymentVersion(version.codeVersion, config);
    }

    private static String computeReconfigureHash(DeploymentConfig config) {
        Hasher hasher = Hashing.sha256().newHasher();
        try {
            hasher.putBytes(DeploymentConfig.MAPPER.writeValueAsBytes(config.getUserConfig()));
        } catch (JsonProcessingException jpe) {
            throw new IllegalArgumentException("User config is not serializable", jpe);
        }
        hasher.putLong(config.getGracefulShutdownWaitLoopMillis())
                .putLong(config.getGracefulShutdownTimeoutMillis())
                .putLong(config.getHealthCheckPeriodMillis())
                .putLong(config.getHealthCheckTimeoutMillis())
                .putInt(config.getMaxConcurrentQueries());
        return hasher.hash().toString();
    }

    public String getCodeVersion() {
        return codeVersion;
    }

    public DeploymentConfig getDeploymentConfig() {
        return deploymentConfig;
    }

    /**
     * @return true if moving to the other version needs a new replica (different code)
     */
    public boolean requiresReplicaRestart(DeploymentVersion other) {
        return !codeVersion.equals(other.codeVersion);
    }

    /**
     * @return true if moving to the other version needs a reconfigure call on this replica
     */
    public boolean requiresReplicaReconfigure(DeploymentVersion other) {
        return !reconfigureHash.equals(other.reconfigureHash);
    }

    /**
     * @return true if routers need to hear about the other version
     */
    public boolean requiresLongPollBroadcast(DeploymentVersion other) {
        return deploymentConfig.getMaxConcurrentQueries() != other.deploymentConfig.getMaxConcurrentQueries();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DeploymentVersion)) {
            return false;
        }
        DeploymentVersion other = (DeploymentVersion) o;
        return codeVersion.equals(other.codeVersion) && reconfigureHash.equals(other.reconfigureHash);
    }

    @Override
    public int hashCode() {
        return (codeVersion + reconfigureHash).hashCode();
    }

    @Override
    public String toString() {
        return "DeploymentVersion[code=" + codeVersion + ", config=" + reconfigureHash.substring(0, 12) + "]";
    }
}
