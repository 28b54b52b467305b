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

import org.ledgerflow.aggregate.DomainEventCodec;
import org.ledgerflow.aggregate.EventSourcedRepository;
import org.ledgerflow.eventstore.api.EventStore;
import org.ledgerflow.example.domain.bank.model.user.Email;
import org.ledgerflow.example.domain.bank.model.user.User;
import org.ledgerflow.example.domain.bank.model.user.UserEvent;
import org.ledgerflow.example.domain.bank.model.user.UserEvent.UserCreated;
import org.ledgerflow.example.domain.bank.model.user.UserEvent.UserEmailChanged;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

public class UserRepository extends EventSourcedRepository<User, UserEvent> {

    public UserRepository(EventStore eventStore, DomainEventCodec<UserEvent> codec) {
        super(eventStore, codec, User::reconstitute);
    }

    /**
     * Find the user whose current email is {@code email}. Users that had the address once but changed it are not returned.
     */
    public Optional<User> findByEmail(Email email) {
        requireNonNull(email, "Email cannot be null");
        return scanAll()
                .filter(event -> everHad(event, email))
                .map(UserEvent::aggregateId)
                .distinct()
                .map(this::findById)
                .flatMap(Optional::stream)
                .filter(user -> user.email().equals(email))
                .findFirst();
    }

    private static boolean everHad(UserEvent event, Email email) {
        if (event instanceof UserCreated) {
            return ((UserCreated) event).email().equals(email);
        } else if (event instanceof UserEmailChanged) {
            return ((UserEmailChanged) event).newEmail().equals(email);
        }
        return false;
    }
}
