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

package org.ledgerflow.example.domain.bank.model.account;

import org.ledgerflow.aggregate.DomainEvent;

import java.time.Instant;

/**
 * The events of an {@link Account}. The aggregate id of every event is the account id.
 */
public sealed interface AccountEvent extends DomainEvent {

    record AccountCreated(String eventId, String aggregateId, Instant occurredAt, String userId, Currency currency) implements AccountEvent {
        public static final String TYPE = "AccountCreated";

        @Override
        public String eventType() {
            return TYPE;
        }
    }

    record MoneyDeposited(String eventId, String aggregateId, Instant occurredAt, Money amount, Money newBalance) implements AccountEvent {
        public static final String TYPE = "MoneyDeposited";

        @Override
        public String eventType() {
            return TYPE;
        }
    }

    record MoneyWithdrawn(String eventId, String aggregateId, Instant occurredAt, Money amount, Money newBalance) implements AccountEvent {
        public static final String TYPE = "MoneyWithdrawn";

        @Override
        public String eventType() {
            return TYPE;
        }
    }
}
