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
import org.ledgerflow.aggregate.DomainEventCodec;
import org.ledgerflow.aggregate.Payload;
import org.ledgerflow.example.domain.bank.model.user.Email;
import org.ledgerflow.example.domain.bank.model.user.UserEvent;
import org.ledgerflow.example.domain.bank.model.user.UserEvent.UserCreated;
import org.ledgerflow.example.domain.bank.model.user.UserEvent.UserEmailChanged;
import org.ledgerflow.example.domain.bank.model.user.UserRole;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

public final class UserEventCodec {
    public static final URI USER_SOURCE = URI.create("urn:ledgerflow:bank:user");

    private UserEventCodec() {
    }

    public static DomainEventCodec<UserEvent> create(ObjectMapper objectMapper) {
        return DomainEventCodec.<UserEvent>builder(objectMapper, USER_SOURCE)
                .register(UserCreated.TYPE, UserCreated.class, UserEventCodec::encodeUserCreated, UserEventCodec::decodeUserCreated)
                .register(UserEmailChanged.TYPE, UserEmailChanged.class, UserEventCodec::encodeUserEmailChanged, UserEventCodec::decodeUserEmailChanged)
                .build();
    }

    private static Map<String, Object> encodeUserCreated(UserCreated e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("userId", e.aggregateId());
        fields.put("email", e.email().value());
        fields.put("hashedPassword", e.hashedPassword());
        fields.put("role", e.role().name());
        return fields;
    }

    private static UserCreated decodeUserCreated(Payload p) {
        return new UserCreated(p.eventId(), p.aggregateId(), p.occurredAt(), new Email(p.string("email")), p.string("hashedPassword"),
                p.enumValue("role", UserRole.class));
    }

    private static Map<String, Object> encodeUserEmailChanged(UserEmailChanged e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("userId", e.aggregateId());
        fields.put("oldEmail", e.oldEmail().value());
        fields.put("newEmail", e.newEmail().value());
        return fields;
    }

    private static UserEmailChanged decodeUserEmailChanged(Payload p) {
        return new UserEmailChanged(p.eventId(), p.aggregateId(), p.occurredAt(), new Email(p.string("oldEmail")), new Email(p.string("newEmail")));
    }
}
