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
import org.ledgerflow.example.domain.bank.model.account.AccountEvent;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent.AccountCreated;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent.MoneyDeposited;
import org.ledgerflow.example.domain.bank.model.account.AccountEvent.MoneyWithdrawn;
import org.ledgerflow.example.domain.bank.model.account.Currency;
import org.ledgerflow.example.domain.bank.model.account.Money;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps {@link AccountEvent}s to and from their stored form. Amounts are stored as strings with two fraction digits.
 */
public final class AccountEventCodec {
    public static final URI ACCOUNT_SOURCE = URI.create("urn:ledgerflow:bank:account");

    private AccountEventCodec() {
    }

    public static DomainEventCodec<AccountEvent> create(ObjectMapper objectMapper) {
        return DomainEventCodec.<AccountEvent>builder(objectMapper, ACCOUNT_SOURCE)
                .register(AccountCreated.TYPE, AccountCreated.class, AccountEventCodec::encodeAccountCreated, AccountEventCodec::decodeAccountCreated)
                .register(MoneyDeposited.TYPE, MoneyDeposited.class, e -> encodeMovement(e.aggregateId(), e.amount(), e.newBalance()),
                        p -> new MoneyDeposited(p.eventId(), p.aggregateId(), p.occurredAt(), money(p, "amount"), money(p, "newBalance")))
                .register(MoneyWithdrawn.TYPE, MoneyWithdrawn.class, e -> encodeMovement(e.aggregateId(), e.amount(), e.newBalance()),
                        p -> new MoneyWithdrawn(p.eventId(), p.aggregateId(), p.occurredAt(), money(p, "amount"), money(p, "newBalance")))
                .build();
    }

    private static Map<String, Object> encodeAccountCreated(AccountCreated e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("accountId", e.aggregateId());
        fields.put("userId", e.userId());
        fields.put("currency", e.currency().name());
        return fields;
    }

    private static AccountCreated decodeAccountCreated(Payload p) {
        return new AccountCreated(p.eventId(), p.aggregateId(), p.occurredAt(), p.string("userId"), p.enumValue("currency", Currency.class));
    }

    private static Map<String, Object> encodeMovement(String accountId, Money amount, Money newBalance) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("accountId", accountId);
        fields.put("amount", amount.toPlainString());
        fields.put("currency", amount.currency().name());
        fields.put("newBalance", newBalance.toPlainString());
        return fields;
    }

    private static Money money(Payload payload, String name) {
        return new Money(payload.decimal(name), payload.enumValue("currency", Currency.class));
    }
}
