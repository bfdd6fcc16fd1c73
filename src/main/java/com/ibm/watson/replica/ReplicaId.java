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

import java.util.Objects;

/**
 * Identity of a single replica: its deployment plus a replica tag of the form
 * {@code <app>#<deployment>#<suffix>} (or {@code <deployment>#<suffix>} when
 * the deployment doesn't belong to a named app).
 */
public final class ReplicaId {
    static final String DELIMITER = "#";

    private final DeploymentId deploymentId;
    private final String replicaSuffix;

    public ReplicaId(DeploymentId deploymentId, String replicaSuffix) {
        this.deploymentId = Objects.requireNonNull(deploymentId, "deploymentId");
        this.replicaSuffix = Objects.requireNonNull(replicaSuffix, "replicaSuffix");
    }

    public static ReplicaId fromReplicaTag(String replicaTag) {
        String[] parts = replicaTag.split(DELIMITER, -1);
        if (parts.length == 3) {
            return new ReplicaId(new DeploymentId(parts[1], parts[0]), parts[2]);
        }
        if (parts.length == 2) {
            return new ReplicaId(new DeploymentId(parts[0], ""), parts[1]);
        }
        throw new IllegalArgumentException("Invalid replica tag: \"" + replicaTag + "\"");
    }

    public DeploymentId getDeploymentId() {
        return deploymentId;
    }

    public String getReplicaSuffix() {
        return replicaSuffix;
    }

    public String getReplicaTag() {
        String app = deploymentId.getApp();
        return (app.isEmpty() ? "" : app + DELIMITER) + deploymentId.getName() + DELIMITER + replicaSuffix;
    }

    /**
     * @return name used to identify this replica's component in logs
     */
    public String getComponentName() {
        return deploymentId.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReplicaId && getReplicaTag().equals(((ReplicaId) o).getReplicaTag());
    }

    @Override
    public int hashCode() {
        return getReplicaTag().hashCode();
    }

    @Override
    public String toString() {
        return getReplicaTag();
    }
}
