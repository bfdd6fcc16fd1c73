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

import io.grpc.Status;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReplicaIdTest {

    @Test
    void testReplicaTags() {
        ReplicaId id = ReplicaId.fromReplicaTag("shop#ranker#a1b2");
        assertEquals(new DeploymentId("ranker", "shop"), id.getDeploymentId());
        assertEquals("a1b2", id.getReplicaSuffix());
        assertEquals("shop#ranker#a1b2", id.getReplicaTag());
        assertEquals("shop_ranker", id.getComponentName());

        ReplicaId noApp = ReplicaId.fromReplicaTag("ranker#a1b2");
        assertEquals("", noApp.getDeploymentId().getApp());
        assertEquals("ranker#a1b2", noApp.getReplicaTag());
        assertEquals("ranker", noApp.getComponentName());
        assertEquals(noApp, new ReplicaId(new DeploymentId("ranker", null), "a1b2"));

        assertThrows(IllegalArgumentException.class, () -> ReplicaId.fromReplicaTag("ranker"));
        assertThrows(IllegalArgumentException.class, () -> ReplicaId.fromReplicaTag("a#b#c#d"));
    }

    @Test
    void testRequestStatusClassification() {
        assertEquals(RequestStatus.OK, RequestStatus.of(null));
        assertEquals(RequestStatus.CANCELLED, RequestStatus.of(new CancellationException()));
        assertEquals(RequestStatus.CANCELLED, RequestStatus.of(new InterruptedException()));
        assertEquals(RequestStatus.CANCELLED, RequestStatus.of(Status.CANCELLED.asRuntimeException()));
        assertEquals(RequestStatus.CANCELLED,
                RequestStatus.of(new UserCodeException("m", Status.CANCELLED.asException())));
        assertEquals(RequestStatus.ERROR, RequestStatus.of(Status.UNAVAILABLE.asRuntimeException()));
        assertEquals(RequestStatus.ERROR, RequestStatus.of(new UserCodeException("m",
                new IllegalStateException())));
    }
}
