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

import io.cloudevents.CloudEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.ledgerflow.eventstore.api.EventStore;
import org.ledgerflow.eventstore.api.OptimisticConcurrencyConflictException;
import org.ledgerflow.eventstore.jpa.EventRecordRepository;
import org.ledgerflow.example.domain.bank.application.AccountApplicationService;
import org.ledgerflow.example.domain.bank.application.AccountSummary;
import org.ledgerflow.example.domain.bank.application.UserApplicationService;
import org.ledgerflow.example.domain.bank.infrastructure.AccountRepository;
import org.ledgerflow.example.domain.bank.model.account.Account;
import org.ledgerflow.example.domain.bank.model.account.Money;
import org.ledgerflow.example.domain.bank.model.user.Email;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.ledgerflow.example.domain.bank.model.account.Currency.UAH;
import static org.ledgerflow.example.domain.bank.model.account.Currency.USD;
import static org.ledgerflow.example.domain.bank.model.user.UserRole.ROLE_USER;

@SpringJUnitConfig(BankJpaTestConfig.class)
@DisplayNameGeneration(ReplaceUnderscores.class)
class BankJpaIntegrationTest {

    @Autowired
    private EventRecordRepository eventRecordRepository;
    @Autowired
    private EventStore eventStore;
    @Autowired
    private AccountRepository accountRepository;
    @Autowired
    private AccountApplicationService accountApplicationService;
    @Autowired
    private UserApplicationService userApplicationService;

    @BeforeEach
    void delete_all_events() {
        eventRecordRepository.deleteAllInBatch();
    }

    @Test
    void user_and_accounts_are_stored_in_the_relational_event_store() {
        // Given
        String userId = userApplicationService.registerUser(new Email("john@example.com"), "hash", ROLE_USER);
        String uahAccountId = accountApplicationService.openAccount(userId, UAH);
        accountApplicationService.openAccount(userId, USD);

        // When
        accountApplicationService.deposit(uahAccountId, Money.of("100.50", UAH));
        accountApplicationService.withdraw(uahAccountId, Money.of("30.25", UAH));

        // Then
        assertThat(accountApplicationService.getBalance(uahAccountId).orElseThrow().balance()).isEqualTo(new BigDecimal("70.25"));
        assertThat(accountApplicationService.getUserAccounts(userId)).extracting(AccountSummary::currency).containsExactly(UAH, USD);
        assertThat(eventStore.read(uahAccountId).events().map(CloudEvent::getType)).containsExactly("AccountCreated", "MoneyDeposited", "MoneyWithdrawn");
        assertThat(eventRecordRepository.count()).isEqualTo(5);
    }

    @Test
    void changed_email_is_found_after_reloading_from_the_database() {
        // Given
        String userId = userApplicationService.registerUser(new Email("john@example.com"), "hash", ROLE_USER);

        // When
        userApplicationService.changeEmail(userId, new Email("johnny@example.com"));

        // Then
        assertThat(userApplicationService.findUser(userId)).hasValueSatisfying(user -> {
            assertThat(user.email()).isEqualTo(new Email("johnny@example.com"));
            assertThat(user.version()).isEqualTo(2);
        });
    }

    @Test
    void stale_account_cannot_be_saved() {
        // Given
        Account account = Account.open("account1", "user1", UAH);
        account.deposit(Money.of("100.50", UAH));
        account.withdraw(Money.of("30.25", UAH));
        accountRepository.save(account);
        Account first = accountRepository.findById("account1").orElseThrow();
        Account second = accountRepository.findById("account1").orElseThrow();
        first.withdraw(Money.of("50.00", UAH));
        second.withdraw(Money.of("50.00", UAH));
        accountRepository.save(first);

        // When
        Throwable throwable = catchThrowable(() -> accountRepository.save(second));

        // Then
        assertThat(throwable).isEqualTo(new OptimisticConcurrencyConflictException("account1", 3, 4));
        assertThat(accountRepository.findById("account1").orElseThrow().balance()).isEqualTo(Money.of("20.25", UAH));
    }
}
