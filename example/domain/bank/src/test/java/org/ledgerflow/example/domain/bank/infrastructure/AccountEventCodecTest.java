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

package org.ledgerflow.example.domain.bank.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.ledgerflow.aggregate.DomainEventCodec;
import org.ledgerflow.aggregate.UnknownEventTypeException;
import org.ledgerflow.eventstore.api.StorageFaultException;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent.AccountCreated;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent.MoneyDeposited;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent.MoneyWithdrawn;
import org.ledgerflow.example.domain.bank.model.account.Money;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.ledgerflow.example.domain.bank.model.account.Currency.UAH;
import static org.ledgerflow.example.domain.bank.model.account.Currency.USD;

@DisplayNameGeneration(ReplaceUnderscores.class)
class AccountEventCodecTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30.123Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DomainEventCodec<AccountEvent> codec = AccountEventCodec.create(objectMapper);

    @Test
    void every_account_event_type_is_registered() {
        assertThat(codec.eventTypes()).containsExactly("AccountCreated", "MoneyDeposited", "MoneyWithdrawn");
        assertThat(new HashSet<>(codec.eventClasses())).containsExactlyInAnyOrder(AccountEvent.class.getPermittedSubclasses());
    }

    @Nested
    class Encoding {

        @Test
        void money_is_stored_as_plain_strings_next_to_the_currency() throws IOException {
            // Given
            MoneyDeposited deposited = new MoneyDeposited("event1", "account1", NOW, Money.of("100.50", UAH), Money.of("100.50", UAH));

            // When
            CloudEvent cloudEvent = codec.toCloudEvent(deposited);

            // Then
            assertThat(cloudEvent.getType()).isEqualTo("MoneyDeposited");
            assertThat(cloudEvent.getSource()).isEqualTo(AccountEventCodec.ACCOUNT_SOURCE);
            assertThat(cloudEvent.getSubject()).isEqualTo("account1");
            assertThat(cloudEvent.getTime()).isEqualTo(OffsetDateTime.ofInstant(NOW, UTC));
            assertThat(objectMapper.readValue(cloudEvent.getData().toBytes(), Map.class)).isEqualTo(Map.of(
                    "accountId", "account1",
                    "amount", "100.50",
                    "currency", "UAH",
                    "newBalance", "100.50"));
        }

        @Test
        void round_trips_every_event_shape_through_json() {
            roundTrip(new AccountCreated("event1", "account1", NOW, "user1", USD));
            roundTrip(new MoneyDeposited("event2", "account1", NOW, Money.of("100.50", USD), Money.of("100.50", USD)));
            roundTrip(new MoneyWithdrawn("event3", "account1", NOW, Money.of("30.25", USD), Money.of("70.25", USD)));
        }

        private void roundTrip(AccountEvent event) {
            CloudEvent stored = fromJson(event.eventType(), new String(codec.toCloudEvent(event).getData().toBytes(), UTF_8));

            assertThat(codec.toDomainEvent(stored)).isEqualTo(event);
        }
    }

    @Nested
    class Decoding {

        @Test
        void currency_is_decoded_into_a_typed_value() {
            // Given
            CloudEvent stored = fromJson("AccountCreated", "{\"accountId\":\"account1\",\"userId\":\"user1\",\"currency\":\"UAH\"}");

            // When
            AccountEvent event = codec.toDomainEvent(stored);

            // Then
            assertThat(event).isInstanceOfSatisfying(AccountCreated.class, created -> {
                assertThat(created.currency()).isSameAs(UAH);
                assertThat(created.userId()).isEqualTo("user1");
                assertThat(created.aggregateId()).isEqualTo("account1");
                assertThat(created.occurredAt()).isEqualTo(NOW);
            });
        }

        @Test
        void amounts_stored_as_json_numbers_are_accepted() {
            CloudEvent stored = fromJson("MoneyDeposited", "{\"accountId\":\"account1\",\"amount\":5.5,\"currency\":\"USD\",\"newBalance\":\"5.50\"}");

            AccountEvent event = codec.toDomainEvent(stored);

            assertThat(event).isInstanceOfSatisfying(MoneyDeposited.class, deposited -> assertThat(deposited.amount()).isEqualTo(Money.of("5.50", USD)));
        }

        @Test
        void event_types_without_a_decoder_are_rejected() {
            // Given
            CloudEvent stored = fromJson("AccountFrozen", "{\"accountId\":\"account1\"}");

            // When
            Throwable throwable = catchThrowable(() -> codec.toDomainEvent(stored));

            // Then
            assertThat(throwable).isExactlyInstanceOf(UnknownEventTypeException.class);
            assertThat(((UnknownEventTypeException) throwable).eventType).isEqualTo("AccountFrozen");
        }

        @Test
        void unknown_currency_is_a_storage_fault() {
            CloudEvent stored = fromJson("AccountCreated", "{\"accountId\":\"account1\",\"userId\":\"user1\",\"currency\":\"EUR\"}");

            assertThat(catchThrowable(() -> codec.toDomainEvent(stored))).isExactlyInstanceOf(StorageFaultException.class);
        }

        @Test
        void invalid_amount_is_a_storage_fault() {
            CloudEvent stored = fromJson("MoneyWithdrawn", "{\"accountId\":\"account1\",\"amount\":\"-1.00\",\"currency\":\"UAH\",\"newBalance\":\"0.00\"}");

            assertThat(catchThrowable(() -> codec.toDomainEvent(stored))).isExactlyInstanceOf(StorageFaultException.class);
        }

        @Test
        void missing_field_is_a_storage_fault() {
            CloudEvent stored = fromJson("AccountCreated", "{\"accountId\":\"account1\",\"currency\":\"UAH\"}");

            Throwable throwable = catchThrowable(() -> codec.toDomainEvent(stored));

            assertThat(throwable).isExactlyInstanceOf(StorageFaultException.class).hasMessage("Field \"userId\" of AccountCreated event event1 is missing");
        }
    }

    private static CloudEvent fromJson(String type, String json) {
        return CloudEventBuilder.v1()
                .withId("event1")
                .withSource(AccountEventCodec.ACCOUNT_SOURCE)
                .withType(type)
                .withTime(OffsetDateTime.ofInstant(NOW, UTC))
                .withSubject("account1")
                .withData("application/json", json.getBytes(UTF_8))
                .build();
    }
}
