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

package org.ledgerflow.example.domain.bank.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.ledgerflow.aggregate.DomainEventCodec;
import org.ledgerflow.eventstore.api.EventStore;
import org.ledgerflow.example.domain.bank.application.AccountApplicationService;
import org.ledgerflow.example.domain.bank.infrastructure.AccountEventCodec;
import org.ledgerflow.example.domain.bank.infrastructure.AccountRepository;
import org.ledgerflow.example.domain.bank.infrastructure.UserEventCodec;
import org.ledgerflow.example.domain.bank.infrastructure.UserRepository;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent;
import org.ledgerflow.example.domain.bank.model.user.UserEvent;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the bank on top of whatever {@link EventStore} bean the application defines.
 */
@Configuration
@ComponentScan(basePackageClasses = AccountApplicationService.class)
public class BankConfiguration {

    @Bean
    public DomainEventCodec<AccountEvent> accountEventCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return AccountEventCodec.create(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public DomainEventCodec<UserEvent> userEventCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return UserEventCodec.create(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public AccountRepository accountRepository(EventStore eventStore, DomainEventCodec<AccountEvent> accountEventCodec) {
        return new AccountRepository(eventStore, accountEventCodec);
    }

    @Bean
    public UserRepository userRepository(EventStore eventStore, DomainEventCodec<UserEvent> userEventCodec) {
        return new UserRepository(eventStore, userEventCodec);
    }
}
