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

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single attempt: the action's output, or the reason the attempt failed.
 */
public final class AttemptOutcome {

    private final boolean success;
    private final Object output;
    private final Throwable failure;

    private AttemptOutcome(boolean success, Object output, Throwable failure) {
        this.success = success;
        this.output = output;
        this.failure = failure;
    }

    public static AttemptOutcome success(Object output) {
        return new AttemptOutcome(true, output, null);
    }

    public static AttemptOutcome failure(Throwable failure) {
        return new AttemptOutcome(false, null, Objects.requireNonNull(failure, "Failure cannot be null"));
    }

    public boolean isSuccess() {
        return success;
    }

    public Object getOutput() {
        return output;
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return success
                ? "AttemptOutcome{success, output=" + output + '}'
                : "AttemptOutcome{failure=" + failure + '}';
    }
}
