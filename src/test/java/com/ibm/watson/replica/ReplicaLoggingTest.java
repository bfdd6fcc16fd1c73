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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplicaLoggingTest {

    @AfterEach
    void restore() {
        ReplicaLogging.configure("test", LoggingConfig.DEFAULT);
    }

    @Test
    void testLevelsApplied() {
        assertTrue(ReplicaLogging.configure("app_model", new LoggingConfig("debug", true)));
        assertEquals(Level.DEBUG, LogManager.getLogger(ReplicaLogging.BASE_LOGGER_NAME).getLevel());
        assertEquals(Level.INFO, LogManager.getLogger(ReplicaLogging.ACCESS_LOGGER_NAME).getLevel());

        assertFalse(ReplicaLogging.configure("app_model", new LoggingConfig("WARN", false)));
        assertEquals(Level.WARN, LogManager.getLogger(ReplicaLogging.BASE_LOGGER_NAME).getLevel());
        assertEquals(Level.OFF, LogManager.getLogger(ReplicaLogging.ACCESS_LOGGER_NAME).getLevel());
    }

    @Test
    void testAccessLogMessage() {
        assertEquals("CALL predict OK 12.3ms", ReplicaLogging.accessLogMessage("predict", RequestStatus.OK, 12.34));
        assertEquals("CALL call CANCELLED 0.0ms",
                ReplicaLogging.accessLogMessage("call", RequestStatus.CANCELLED, 0.01));
    }
}
