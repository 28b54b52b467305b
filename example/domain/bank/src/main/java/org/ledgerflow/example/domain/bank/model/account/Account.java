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

import org.ledgerflow.aggregate.AggregateRoot;
import org.ledgerflow.aggregate.EventHandlers;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent.AccountCreated;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent.MoneyDeposited;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent.MoneyWithdrawn;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static java.time.temporal.ChronoUnit.MILLIS;
import static java.util.Objects.requireNonNull;

/**
 * A bank account of one user in one currency. The balance starts at zero and never goes negative.
 */
public class Account extends AggregateRoot<Account, AccountEvent> {
    static final EventHandlers<Account, AccountEvent> HANDLERS = EventHandlers.<Account, AccountEvent>builder()
            .on(AccountCreated.class, Account::when)
            .on(MoneyDeposited.class, Account::when)
            .on(MoneyWithdrawn.class, Account::when)
            .build();

    private String userId;
    private Currency currency;
    private Money balance;
    private Instant createdAt;
    private Instant updatedAt;

    private Account(String accountId) {
        super(accountId);
    }

    public static Account open(String accountId, String userId, Currency currency) {
        requireNonNull(userId, "User id cannot be null");
        requireNonNull(currency, "Currency cannot be null");
        Account account = new Account(accountId);
        account.record(new AccountCreated(newEventId(), accountId, now(), userId, currency));
        return account;
    }

    public static Account reconstitute(String accountId, List<AccountEvent> events) {
        return replay(new Account(accountId), events);
    }

    public void deposit(Money amount) {
        requireValidAmount(amount);
        record(new MoneyDeposited(newEventId(), id(), now(), amount, balance.add(amount)));
    }

    public void withdraw(Money amount) {
        requireValidAmount(amount);
        if (balance.isLessThan(amount)) {
            throw new InsufficientFundsException(balance, amount);
        }
        record(new MoneyWithdrawn(newEventId(), id(), now(), amount, balance.subtract(amount)));
    }

    public String userId() {
        return userId;
    }

    public Currency currency() {
        return currency;
    }

    public Money balance() {
        return balance;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    @Override
    protected EventHandlers<Account, AccountEvent> eventHandlers() {
        return HANDLERS;
    }

    private void requireValidAmount(Money amount) {
        requireNonNull(amount, "Amount cannot be null");
        if (amount.currency() != currency) {
            throw new CurrencyMismatchException(currency, amount.currency());
        }
        if (amount.isZero()) {
            throw new NonPositiveAmountException(amount);
        }
    }

    private void when(AccountCreated e) {
        this.userId = e.userId();
        this.currency = e.currency();
        this.balance = Money.zero(e.currency());
        this.createdAt = e.occurredAt();
        this.updatedAt = e.occurredAt();
    }

    private void when(MoneyDeposited e) {
        this.balance = e.newBalance();
        this.updatedAt = e.occurredAt();
    }

    private void when(MoneyWithdrawn e) {
        this.balance = e.newBalance();
        this.updatedAt = e.occurredAt();
    }

    private static String newEventId() {
        return UUID.randomUUID().toString();
    }

    private static Instant now() {
        return Instant.now().truncatedTo(MILLIS);
    }
}
