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

import org.ledgerflow.eventstore.api.OptimisticConcurrencyConflictException;
import org.ledgerflow.example.domain.bank.infrastructure.AccountRepository;
import org.ledgerflow.example.domain.bank.model.account.Account;
import org.ledgerflow.example.domain.bank.model.account.AccountAlreadyExistsException;
import org.ledgerflow.example.domain.bank.model.account.AccountNotFoundException;
import org.ledgerflow.example.domain.bank.model.account.Currency;
import org.ledgerflow.example.domain.bank.model.account.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Loads an account, runs one command against it and saves it. An {@link OptimisticConcurrencyConflictException} is
 * passed on to the caller, who decides whether to repeat the whole command.
 */
@Service
public class AccountApplicationService {
    private static final Logger log = LoggerFactory.getLogger(AccountApplicationService.class);

    private final AccountRepository accountRepository;

    public AccountApplicationService(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    /**
     * @return The id of the new account
     * @throws AccountAlreadyExistsException If the user already has an account in {@code currency}
     */
    public String openAccount(String userId, Currency currency) {
        if (accountRepository.findByUserIdAndCurrency(userId, currency).isPresent()) {
            throw new AccountAlreadyExistsException(userId, currency);
        }
        String accountId = UUID.randomUUID().toString();
        accountRepository.save(Account.open(accountId, userId, currency));
        log.info("Opened {} account {} for user {}", currency, accountId, userId);
        return accountId;
    }

    public void deposit(String accountId, Money amount) {
        execute(accountId, account -> account.deposit(amount));
    }

    public void withdraw(String accountId, Money amount) {
        execute(accountId, account -> account.withdraw(amount));
    }

    public Optional<AccountBalance> getBalance(String accountId) {
        return accountRepository.findById(accountId)
                .map(account -> new AccountBalance(account.id(), account.balance().amount(), account.currency(), account.updatedAt()));
    }

    public List<AccountSummary> getUserAccounts(String userId) {
        return accountRepository.findByUserId(userId).stream()
                .map(account -> new AccountSummary(account.id(), account.balance().amount(), account.currency(), account.createdAt()))
                .collect(Collectors.toList());
    }

    private void execute(String accountId, Consumer<Account> command) {
        Account account = accountRepository.findById(accountId).orElseThrow(() -> new AccountNotFoundException(accountId));
        command.accept(account);
        accountRepository.save(account);
        log.debug("Account {} is at version {} with balance {}", accountId, account.version(), account.balance());
    }
}
