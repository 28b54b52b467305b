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

import org.ledgerflow.aggregate.AggregateRoot;
import org.ledgerflow.aggregate.EventHandlers;
import org.ledgerflow.example.domain.bank.model.user.UserEvent.UserCreated;
import org.ledgerflow.example.domain.bank.model.user.UserEvent.UserEmailChanged;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static java.time.temporal.ChronoUnit.MILLIS;
import static java.util.Objects.requireNonNull;

/**
 * A user of the bank. The password is only ever handled in hashed form.
 */
public class User extends AggregateRoot<User, UserEvent> {
    static final EventHandlers<User, UserEvent> HANDLERS = EventHandlers.<User, UserEvent>builder()
            .on(UserCreated.class, User::when)
            .on(UserEmailChanged.class, User::when)
            .build();

    private Email email;
    private String hashedPassword;
    private UserRole role;
    private Instant createdAt;
    private Instant updatedAt;

    private User(String userId) {
        super(userId);
    }

    public static User register(String userId, Email email, String hashedPassword, UserRole role) {
        requireNonNull(email, "Email cannot be null");
        requireNonNull(hashedPassword, "Hashed password cannot be null");
        requireNonNull(role, "Role cannot be null");
        User user = new User(userId);
        user.record(new UserCreated(UUID.randomUUID().toString(), userId, now(), email, hashedPassword, role));
        return user;
    }

    public static User reconstitute(String userId, List<UserEvent> events) {
        return replay(new User(userId), events);
    }

    public void changeEmail(Email newEmail) {
        requireNonNull(newEmail, "Email cannot be null");
        if (email.equals(newEmail)) {
            throw new EmailUnchangedException(newEmail);
        }
        record(new UserEmailChanged(UUID.randomUUID().toString(), id(), now(), email, newEmail));
    }

    public Email email() {
        return email;
    }

    public String hashedPassword() {
        return hashedPassword;
    }

    public UserRole role() {
        return role;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    @Override
    protected EventHandlers<User, UserEvent> eventHandlers() {
        return HANDLERS;
    }

    private void when(UserCreated e) {
        this.email = e.email();
        this.hashedPassword = e.hashedPassword();
        this.role = e.role();
        this.createdAt = e.occurredAt();
        this.updatedAt = e.occurredAt();
    }

    private void when(UserEmailChanged e) {
        this.email = e.newEmail();
        this.updatedAt = e.occurredAt();
    }

    private static Instant now() {
        return Instant.now().truncatedTo(MILLIS);
    }
}
