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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.ledgerflow.example.domain.bank.model.account.Currency.UAH;
import static org.ledgerflow.example.domain.bank.model.account.Currency.USD;

@DisplayNameGeneration(ReplaceUnderscores.class)
class MoneyTest {

    @Nested
    class Creation {

        @Test
        void amounts_are_scaled_to_two_fraction_digits() {
            assertThat(Money.of("100.5", UAH).toPlainString()).isEqualTo("100.50");
            assertThat(Money.zero(USD).toPlainString()).isEqualTo("0.00");
            assertThat(new Money(new BigDecimal("7"), UAH).amount()).isEqualTo(new BigDecimal("7.00"));
        }

        @Test
        void amounts_with_more_than_two_fraction_digits_are_rejected() {
            Throwable throwable = catchThrowable(() -> Money.of("10.005", UAH));

            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("10.005");
        }

        @Test
        void negative_amounts_are_rejected() {
            Throwable throwable = catchThrowable(() -> Money.of("-1.00", UAH));

            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Amount cannot be negative: -1.00");
        }

        @Test
        void non_decimal_amounts_are_rejected() {
            assertThat(catchThrowable(() -> Money.of("ten", UAH))).isExactlyInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void money_with_equal_amount_and_currency_is_equal_regardless_of_scale_in_input() {
            assertThat(Money.of("5", UAH)).isEqualTo(Money.of("5.00", UAH)).isNotEqualTo(Money.of("5.00", USD));
        }
    }

    @Nested
    class Arithmetic {

        @Test
        void add_and_subtract_keep_two_fraction_digits() {
            Money balance = Money.of("100.50", UAH).subtract(Money.of("30.25", UAH)).add(Money.of("0.05", UAH));

            assertThat(balance).isEqualTo(Money.of("70.30", UAH));
        }

        @Test
        void subtracting_more_than_available_is_rejected() {
            Throwable throwable = catchThrowable(() -> Money.of("1.00", UAH).subtract(Money.of("1.01", UAH)));

            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void currencies_must_match() {
            Throwable throwable = catchThrowable(() -> Money.of("1.00", UAH).add(Money.of("1.00", USD)));

            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Currency mismatch: UAH and USD");
        }

        @Test
        void comparisons() {
            assertThat(Money.of("0.00", UAH).isZero()).isTrue();
            assertThat(Money.of("0.01", UAH).isZero()).isFalse();
            assertThat(Money.of("9.99", UAH).isLessThan(Money.of("10.00", UAH))).isTrue();
            assertThat(Money.of("10.00", UAH).isLessThan(Money.of("10.00", UAH))).isFalse();
        }
    }
}
