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
 * Returned by {@link ReplicaApi#isAllocated()}; identifies where the replica ended up running.
 */
public final class AllocationInfo {
    private final long pid;
    private final String replicaTag;
    private final String hostName;
    private final String hostAddress;
    private final String logFilePath;

    public AllocationInfo(long pid, String replicaTag, String hostName, String hostAddress, String logFilePath) {
        this.pid = pid;
        this.replicaTag = replicaTag;
        this.hostName = hostName;
        this.hostAddress = hostAddress;
        this.logFilePath = logFilePath;
    }

    public long getPid() {
        return pid;
    }

    public String getReplicaTag() {
        return replicaTag;
    }

    public String getHostName() {
        return hostName;
    }

    public String getHostAddress() {
        return hostAddress;
    }

    /**
     * @return path of this replica's log file, or null if it only logs to the console
     */
    public String getLogFilePath() {
        return logFilePath;
    }

    @Override
    public String toString() {
        return "AllocationInfo[pid=" + pid + ", replica=" + replicaTag + ", host=" + hostName
               + "/" + hostAddress + ", log=" + logFilePath + "]";
    }
}
