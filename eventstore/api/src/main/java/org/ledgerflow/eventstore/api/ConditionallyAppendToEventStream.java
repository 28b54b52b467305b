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

import io.cloudevents.CloudEvent;
import org.jspecify.annotations.NullMarked;

import java.util.List;
import java.util.stream.Stream;

/**
 * An interface that should be implemented by event stores that supports appending to an aggregate's event stream
 * under an optimistic concurrency check.
 */
@NullMarked
public interface ConditionallyAppendToEventStream {

    /**
     * Append events to the event stream of an aggregate if, and only if, the current version of the stream is equal to
     * {@code expectedVersion}. The events are assigned the versions {@code expectedVersion + 1}, {@code expectedVersion + 2}
     * and so on, and are written as one atomic unit. Nothing is written if the check fails.
     * Appending no events when the version matches writes nothing and returns the current version.
     *
     * @param aggregateId     The id of the aggregate
     * @param expectedVersion The version the event stream must have for the events to be written ({@code 0} for a new aggregate)
     * @param events          The events to append
     * @return A {@link WriteResult} holding the version before and after the write
     * @throws OptimisticConcurrencyConflictException If the current version of the event stream is not equal to {@code expectedVersion}
     */
    WriteResult append(String aggregateId, long expectedVersion, Stream<CloudEvent> events);

    /**
     * @see #append(String, long, Stream)
     */
    default WriteResult append(String aggregateId, long expectedVersion, List<CloudEvent> events) {
        return append(aggregateId, expectedVersion, events.stream());
    }
}
