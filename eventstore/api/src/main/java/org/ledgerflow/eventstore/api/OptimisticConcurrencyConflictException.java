/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.ledgerflow.eventstore.api;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The version of the aggregate's event stream was not the expected one, so no events have been written to the event store.
 * This happens when the aggregate was modified by someone else after it was loaded. The caller should reload the aggregate,
 * validate the command against the fresh state and try again. The event store never retries by itself.
 */
public class OptimisticConcurrencyConflictException extends RuntimeException {
    public final String aggregateId;
    public final long expectedVersion;
    public final long actualVersion;

    public OptimisticConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion) {
        super(String.format("Concurrency conflict for aggregate %s: expected version %d but was %d. Reload the aggregate and retry.", aggregateId, expectedVersion, actualVersion));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public OptimisticConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion, Throwable cause) {
        this(aggregateId, expectedVersion, actualVersion);
        initCause(cause);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptimisticConcurrencyConflictException)) return false;
        OptimisticConcurrencyConflictException that = (OptimisticConcurrencyConflictException) o;
        return expectedVersion == that.expectedVersion && actualVersion == that.actualVersion && Objects.equals(aggregateId, that.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, expectedVersion, actualVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", OptimisticConcurrencyConflictException.class.getSimpleName() + "[", "]")
                .add("aggregateId='" + aggregateId + "'")
                .add("expectedVersion=" + expectedVersion)
                .add("actualVersion=" + actualVersion)
                .add("message=" + super.getMessage())
                .toString();
    }
}
