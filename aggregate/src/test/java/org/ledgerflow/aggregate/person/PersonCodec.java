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

package org.ledgerflow.aggregate.person;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.ledgerflow.aggregate.DomainEventCodec;
import org.ledgerflow.aggregate.person.PersonEvent.NameDefined;
import org.ledgerflow.aggregate.person.PersonEvent.NameWasChanged;
import org.ledgerflow.aggregate.person.PersonEvent.PersonTagged;

import java.net.URI;
import java.util.Map;

public class PersonCodec {
    public static final URI SOURCE = URI.create("urn:ledgerflow:person");

    public static DomainEventCodec<PersonEvent> create() {
        return DomainEventCodec.<PersonEvent>builder(new ObjectMapper(), SOURCE)
                .register("NameDefined", NameDefined.class,
                        e -> Map.of("personId", e.aggregateId(), "name", e.name()),
                        p -> new NameDefined(p.eventId(), p.aggregateId(), p.occurredAt(), p.string("name")))
                .register("NameWasChanged", NameWasChanged.class,
                        e -> Map.of("personId", e.aggregateId(), "name", e.name()),
                        p -> new NameWasChanged(p.eventId(), p.aggregateId(), p.occurredAt(), p.string("name")))
                .register("PersonTagged", PersonTagged.class,
                        e -> Map.of("personId", e.aggregateId(), "tag", e.tag()),
                        p -> new PersonTagged(p.eventId(), p.aggregateId(), p.occurredAt(), p.string("tag")))
                .build();
    }
}
