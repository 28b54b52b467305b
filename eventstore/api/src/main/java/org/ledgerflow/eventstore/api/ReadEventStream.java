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

/**
 * An interface that should be implemented by event stores that supports reading an {@link EventStream}.
 */
@NullMarked
public interface ReadEventStream {

    /**
     * Read all events of an aggregate in version order.
     *
     * @param aggregateId The id of the aggregate whose event stream to read.
     * @return An {@link EventStream} containing the events of the aggregate. Will return an {@link EventStream} with version {@code 0} if the aggregate doesn't exist.
     */
    default EventStream<CloudEvent> read(String aggregateId) {
        return readFrom(aggregateId, 0);
    }

    /**
     * Read the events of an aggregate whose version is greater than {@code afterVersion}, in version order.
     * The {@link EventStream#version()} of the returned stream is the current version of the aggregate, regardless of {@code afterVersion}.
     *
     * @param aggregateId  The id of the aggregate whose event stream to read.
     * @param afterVersion Only events with a version greater than this are returned
     * @return An {@link EventStream} containing the matching events.
     */
    EventStream<CloudEvent> readFrom(String aggregateId, long afterVersion);
}
