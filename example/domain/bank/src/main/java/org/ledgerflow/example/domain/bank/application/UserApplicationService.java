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

package org.ledgerflow.example.domain.bank.application;

import org.ledgerflow.example.domain.bank.infrastructure.UserRepository;
import org.ledgerflow.example.domain.bank.model.user.Email;
import org.ledgerflow.example.domain.bank.model.user.User;
import org.ledgerflow.example.domain.bank.model.user.UserAlreadyExistsException;
import org.ledgerflow.example.domain.bank.model.user.UserNotFoundException;
import org.ledgerflow.example.domain.bank.model.user.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

@Service
public class UserApplicationService {
    private static final Logger log = LoggerFactory.getLogger(UserApplicationService.class);

    private final UserRepository userRepository;

    public UserApplicationService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * @param hashedPassword The password, already hashed by the caller
     * @return The id of the new user
     * @throws UserAlreadyExistsException If another user has the email
     */
    public String registerUser(Email email, String hashedPassword, UserRole role) {
        if (userRepository.findByEmail(email).isPresent()) {
            throw new UserAlreadyExistsException(email);
        }
        String userId = UUID.randomUUID().toString();
        userRepository.save(User.register(userId, email, hashedPassword, role));
        log.info("Registered user {} with role {}", userId, role);
        return userId;
    }

    public void changeEmail(String userId, Email newEmail) {
        User user = userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
        Optional<User> owner = userRepository.findByEmail(newEmail);
        if (owner.isPresent() && !owner.get().id().equals(userId)) {
            throw new UserAlreadyExistsException(newEmail);
        }
        user.changeEmail(newEmail);
        userRepository.save(user);
        log.info("Changed email of user {}", userId);
    }

    public Optional<User> findUser(String userId) {
        return userRepository.findById(userId);
    }
}
