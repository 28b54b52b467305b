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

package org.ledgerflow.aggregate;

import java.time.Instant;

/**
 * An immutable fact describing one state transition of one aggregate. Implementations are records, grouped per
 * aggregate type under a sealed interface.
 * <p>
 * The version of an event is not part of the event itself. It is assigned by the event store when the event is
 * appended and travels in the stored envelope.
 */
public interface DomainEvent {

    /**
     * @return A unique id of this event
     */
    String eventId();

    /**
     * @return The id of the aggregate this event belongs to
     */
    String aggregateId();

    /**
     * @return When the event occurred
     */
    Instant occurredAt();

    /**
     * @return A stable name identifying the kind of event, used as discriminator when the event is stored
     */
    String eventType();
}
