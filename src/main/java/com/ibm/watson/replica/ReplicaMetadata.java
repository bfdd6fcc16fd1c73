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
 * What a replica reports back to the controller after initialization and
 * after each reconfigure.
 */
public final class ReplicaMetadata {
    private final DeploymentConfig deploymentConfig;
    private final DeploymentVersion version;

    public ReplicaMetadata(DeploymentConfig deploymentConfig, DeploymentVersion version) {
        this.deploymentConfig = deploymentConfig;
        this.version = version;
    }

    public DeploymentConfig getDeploymentConfig() {
        return deploymentConfig;
    }

    public DeploymentVersion getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "ReplicaMetadata[" + version + ", " + deploymentConfig + "]";
    }
}
