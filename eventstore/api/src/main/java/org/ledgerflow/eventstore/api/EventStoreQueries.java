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

import java.util.stream.Stream;

/**
 * Queries across all aggregates. They scan the whole log and are meant for secondary lookups until a projection
 * takes over that job, not for the transactional use case.
 */
@NullMarked
public interface EventStoreQueries {

    /**
     * @return All cloud events in the event store, in the order they were appended.
     */
    Stream<CloudEvent> readAll();

    /**
     * @param eventType The cloud event type (see {@link CloudEvent#getType()})
     * @return All cloud events of the given type, in the order they were appended.
     */
    Stream<CloudEvent> readByType(String eventType);
}
