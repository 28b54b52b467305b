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

package org.ledgerflow.aggregate;

import org.jspecify.annotations.NullMarked;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

import static java.util.Objects.requireNonNull;

/**
 * A statically built table from event type to the mutator that applies an event of that type to an aggregate.
 * Each aggregate type declares one instance, for example:
 * <pre>
 * private static final EventHandlers&lt;Account, AccountEvent&gt; HANDLERS = EventHandlers.&lt;Account, AccountEvent&gt;builder()
 *         .on(AccountCreated.class, Account::when)
 *         .on(MoneyDeposited.class, Account::when)
 *         .build();
 * </pre>
 *
 * @param <A> The aggregate type
 * @param <E> The event type of the aggregate
 */
@NullMarked
public final class EventHandlers<A, E> {
    private final Map<Class<? extends E>, BiConsumer<A, E>> handlers;

    private EventHandlers(Map<Class<? extends E>, BiConsumer<A, E>> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    public static <A, E> Builder<A, E> builder() {
        return new Builder<>();
    }

    /**
     * Apply the {@code event} to the {@code aggregate} using the handler registered for the class of the event.
     *
     * @return {@code true} if a handler was found, {@code false} otherwise.
     */
    public boolean handle(A aggregate, E event) {
        BiConsumer<A, E> handler = handlers.get(event.getClass());
        if (handler == null) {
            return false;
        }
        handler.accept(aggregate, event);
        return true;
    }

    /**
     * @return The event classes that have a handler
     */
    public Set<Class<? extends E>> handledTypes() {
        return handlers.keySet();
    }

    public static final class Builder<A, E> {
        private final Map<Class<? extends E>, BiConsumer<A, E>> handlers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register the mutator for events of class {@code type}.
         */
        public <T extends E> Builder<A, E> on(Class<T> type, BiConsumer<A, T> handler) {
            requireNonNull(type, "Event type cannot be null");
            requireNonNull(handler, "Handler cannot be null");
            if (handlers.containsKey(type)) {
                throw new IllegalArgumentException("A handler for " + type.getSimpleName() + " is already registered");
            }
            handlers.put(type, (aggregate, event) -> handler.accept(aggregate, type.cast(event)));
            return this;
        }

        public EventHandlers<A, E> build() {
            return new EventHandlers<>(handlers);
        }
    }
}
