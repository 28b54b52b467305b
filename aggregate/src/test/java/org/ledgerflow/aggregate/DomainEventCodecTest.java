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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.ledgerflow.aggregate.person.PersonCodec;
import org.ledgerflow.aggregate.person.PersonEvent;
import org.ledgerflow.aggregate.person.PersonEvent.NameDefined;
import org.ledgerflow.eventstore.api.StorageFaultException;

import java.net.URI;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.ledgerflow.cloudevents.AggregateCloudEventExtension.aggregate;

@DisplayNameGeneration(ReplaceUnderscores.class)
class DomainEventCodecTest {

    private final DomainEventCodec<PersonEvent> codec = PersonCodec.create();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Nested
    @DisplayName("encoding")
    class Encoding {

        @Test
        void maps_the_domain_event_to_the_cloud_event_envelope() throws Exception {
            // Given
            Instant occurredAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            NameDefined nameDefined = new NameDefined("event1", "person1", occurredAt, "John Doe");

            // When
            CloudEvent cloudEvent = codec.toCloudEvent(nameDefined);

            // Then
            assertThat(cloudEvent.getId()).isEqualTo("event1");
            assertThat(cloudEvent.getSource()).isEqualTo(PersonCodec.SOURCE);
            assertThat(cloudEvent.getType()).isEqualTo("NameDefined");
            assertThat(cloudEvent.getSubject()).isEqualTo("person1");
            assertThat(cloudEvent.getTime()).isEqualTo(OffsetDateTime.ofInstant(occurredAt, UTC));
            assertThat(cloudEvent.getDataContentType()).isEqualTo("application/json");
            assertThat(objectMapper.readValue(cloudEvent.getData().toBytes(), Map.class)).isEqualTo(Map.of("personId", "person1", "name", "John Doe"));
        }

        @Test
        void handles_only_its_own_aggregate_type() {
            assertThat(codec.handles(PersonCodec.SOURCE)).isTrue();
            assertThat(codec.handles(URI.create("urn:ledgerflow:account"))).isFalse();
        }

        @Test
        void rejects_events_without_registration() {
            // Given
            DomainEventCodec<PersonEvent> emptyCodec = DomainEventCodec.<PersonEvent>builder(objectMapper, PersonCodec.SOURCE).build();

            // Then
            assertThatThrownBy(() -> emptyCodec.toCloudEvent(new NameDefined("event1", "person1", Instant.now(), "John Doe")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void rejects_the_same_event_type_registered_twice() {
            assertThatThrownBy(() -> DomainEventCodec.<PersonEvent>builder(objectMapper, PersonCodec.SOURCE)
                    .register("NameDefined", NameDefined.class, e -> Map.of(), p -> null)
                    .register("NameDefined", PersonEvent.NameWasChanged.class, e -> Map.of(), p -> null)
                    .build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Event type NameDefined is registered more than once");
        }
    }

    @Nested
    @DisplayName("decoding")
    class Decoding {

        @Test
        void decodes_a_stored_json_payload_using_the_decoder_of_its_type() {
            // Given
            Instant occurredAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            CloudEvent stored = stored("NameDefined", "{\"personId\":\"person1\",\"name\":\"John Doe\"}", occurredAt);

            // When
            PersonEvent event = codec.toDomainEvent(stored);

            // Then
            assertThat(event).isEqualTo(new NameDefined("event1", "person1", occurredAt, "John Doe"));
        }

        @Test
        void unknown_event_type_is_reported_as_such() {
            // Given
            CloudEvent stored = stored("NameForgotten", "{}", Instant.now());

            // When
            Throwable throwable = catchThrowable(() -> codec.toDomainEvent(stored));

            // Then
            assertThat(throwable).isExactlyInstanceOf(UnknownEventTypeException.class);
            assertThat(((UnknownEventTypeException) throwable).eventType).isEqualTo("NameForgotten");
            assertThat(codec.supports("NameForgotten")).isFalse();
            assertThat(codec.supports("NameDefined")).isTrue();
        }

        @Test
        void missing_payload_field_is_a_storage_fault() {
            // Given
            CloudEvent stored = stored("NameDefined", "{\"personId\":\"person1\"}", Instant.now());

            // When
            Throwable throwable = catchThrowable(() -> codec.toDomainEvent(stored));

            // Then
            assertThat(throwable).isExactlyInstanceOf(StorageFaultException.class)
                    .hasMessage("Field \"name\" of NameDefined event event1 is missing");
        }

        @Test
        void payload_that_is_not_json_is_a_storage_fault() {
            // Given
            CloudEvent stored = stored("NameDefined", "not json", Instant.now());

            // When
            Throwable throwable = catchThrowable(() -> codec.toDomainEvent(stored));

            // Then
            assertThat(throwable).isExactlyInstanceOf(StorageFaultException.class).hasMessageContaining("JSON");
        }
    }

    private static CloudEvent stored(String type, String json, Instant time) {
        return CloudEventBuilder.v1()
                .withId("event1")
                .withSource(PersonCodec.SOURCE)
                .withType(type)
                .withSubject("person1")
                .withTime(OffsetDateTime.ofInstant(time, UTC))
                .withDataContentType("application/json")
                .withData(json.getBytes(UTF_8))
                .withExtension(aggregate("person1", 1))
                .build();
    }
}
