/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.stepflow.workflow;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class StepResultTest {

    @Test
    void testCompleted() {
        Instant start = Instant.now();
        StepResult result = StepResult.completed("s", 42, 2, start, start.plusMillis(250));

        assertTrue(result.isSuccessful());
        assertEquals(StepState.COMPLETED, result.getState());
        assertEquals(42, result.getOutput());
        assertEquals(2, result.getAttempts());
        assertEquals(Duration.ofMillis(250), result.getDuration());
        assertTrue(result.getErrorMessage().isEmpty());
        assertTrue(result.getCause().isEmpty());
    }

    @Test
    void testFailureMessageFallsBackToExceptionType() {
        Instant now = Instant.now();
        StepResult result = StepResult.failed("s", new NullPointerException(), 1, now, now);

        assertEquals("NullPointerException", result.getErrorMessage().orElseThrow());
        assertFalse(result.isSuccessful());
        assertFalse(result.isCancelled());
        assertTrue(result.wasAttempted());
    }

    @Test
    void testCancelledBeforeFirstAttempt() {
        Instant now = Instant.now();
        StepResult result = StepResult.failed("s", new StepCancelledException("s"), 0, now, now);

        assertTrue(result.isCancelled());
        assertFalse(result.wasAttempted());
    }

    @Test
    void testNegativeAttemptsRejected() {
        Instant now = Instant.now();
        assertThrows(IllegalArgumentException.class, () -> StepResult.completed("s", null, -1, now, now));
    }
}
