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

package org.ledgerflow.example.domain.bank.model.user;

import org.ledgerflow.aggregate.DomainEvent;

import java.time.Instant;

/**
 * The events of a {@link User}. The aggregate id of every event is the user id.
 */
public sealed interface UserEvent extends DomainEvent {

    record UserCreated(String eventId, String aggregateId, Instant occurredAt, Email email, String hashedPassword, UserRole role) implements UserEvent {
        public static final String TYPE = "UserCreated";

        @Override
        public String eventType() {
            return TYPE;
        }
    }

    record UserEmailChanged(String eventId, String aggregateId, Instant occurredAt, Email oldEmail, Email newEmail) implements UserEvent {
        public static final String TYPE = "UserEmailChanged";

        @Override
        public String eventType() {
            return TYPE;
        }
    }
}
