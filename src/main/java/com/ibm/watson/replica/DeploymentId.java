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
 * Identifies a deployment within an application. The app name may be empty.
 */
public final class DeploymentId {
    private final String name;
    private final String app;

    public DeploymentId(String name, String app) {
        this.name = Objects.requireNonNull(name, "name");
        this.app = app != null ? app : "";
    }

    public String getName() {
        return name;
    }

    public String getApp() {
        return app;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeploymentId)) {
            return false;
        }
        DeploymentId other = (DeploymentId) o;
        return name.equals(other.name) && app.equals(other.app);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + app.hashCode();
    }

    @Override
    public String toString() {
        return app.isEmpty() ? name : app + "_" + name;
    }
}
