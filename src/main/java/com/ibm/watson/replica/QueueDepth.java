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
 * Snapshot of the requests this replica currently holds.
 */
public final class QueueDepth {
    public static final QueueDepth EMPTY = new QueueDepth(0, 0);

    private final int pending;
    private final int running;

    public QueueDepth(int pending, int running) {
        this.pending = pending;
        this.running = running;
    }

    /**
     * @return requests accepted but not yet started
     */
    public int getPending() {
        return pending;
    }

    public int getRunning() {
        return running;
    }

    public int total() {
        return pending + running;
    }

    @Override
    public String toString() {
        return "QueueDepth[pending=" + pending + ", running=" + running + "]";
    }
}
