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
import org.ledgerflow.example.domain.bank.model.account.Account;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent.AccountCreated;
import org.ledgerflow.example.domain.bank.model.account.Currency;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Lookups by user scan every {@code AccountCreated} event in the store. A projection keyed by user id would replace them.
 */
public class AccountRepository extends EventSourcedRepository<Account, AccountEvent> {

    public AccountRepository(EventStore eventStore, DomainEventCodec<AccountEvent> codec) {
        super(eventStore, codec, Account::reconstitute);
    }

    public Optional<Account> findByUserIdAndCurrency(String userId, Currency currency) {
        requireNonNull(userId, "User id cannot be null");
        requireNonNull(currency, "Currency cannot be null");
        return accountIdsWhere(created -> created.userId().equals(userId) && created.currency() == currency).stream()
                .findFirst()
                .flatMap(this::findById);
    }

    public List<Account> findByUserId(String userId) {
        requireNonNull(userId, "User id cannot be null");
        return accountIdsWhere(created -> created.userId().equals(userId)).stream()
                .map(this::findById)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    private List<String> accountIdsWhere(Predicate<AccountCreated> predicate) {
        return scan(AccountCreated.TYPE)
                .map(AccountCreated.class::cast)
                .filter(predicate)
                .map(AccountCreated::aggregateId)
                .distinct()
                .collect(Collectors.toList());
    }
}
