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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Base class of event-sourced aggregates. Command methods of the concrete aggregate validate their rules against the
 * current state and then {@link #record(DomainEvent) record} a new event. Every event, new or historical, goes through
 * the same {@link EventHandlers} table to mutate the state, so loading an aggregate is a replay of the same mutators
 * that produced its events.
 * <p>
 * The {@link #version()} is the number of events applied to the instance, including the uncommitted ones.
 *
 * @param <A> The concrete aggregate type
 * @param <E> The event type of the aggregate
 */
public abstract class AggregateRoot<A extends AggregateRoot<A, E>, E extends DomainEvent> {
    private static final Logger log = LoggerFactory.getLogger(AggregateRoot.class);

    private final String id;
    private long version;
    private final List<E> uncommittedEvents = new ArrayList<>();

    protected AggregateRoot(String id) {
        requireNonNull(id, "Aggregate id cannot be null");
        this.id = id;
    }

    /**
     * @return The mutators of the concrete aggregate type
     */
    protected abstract EventHandlers<A, E> eventHandlers();

    /**
     * Add the event to the uncommitted events and apply it right away, so the new state is visible to the caller
     * before the aggregate is saved.
     */
    protected final void record(E event) {
        requireNonNull(event, "Event cannot be null");
        uncommittedEvents.add(event);
        apply(event);
    }

    private void apply(E event) {
        version++;
        if (!eventHandlers().handle(self(), event)) {
            log.debug("No handler for event type {} in {}, ignoring it", event.eventType(), getClass().getSimpleName());
        }
    }

    /**
     * Fold historical events into a freshly constructed instance. No events are recorded.
     *
     * @param fresh  A new instance with version 0 and no uncommitted events
     * @param events The events of the aggregate in version order
     * @return {@code fresh}, with all events applied
     */
    protected static <A extends AggregateRoot<A, E>, E extends DomainEvent> A replay(A fresh, Iterable<? extends E> events) {
        AggregateRoot<A, E> aggregate = fresh;
        if (aggregate.version != 0 || !aggregate.uncommittedEvents.isEmpty()) {
            throw new IllegalArgumentException("Can only replay events into a new instance");
        }
        for (E event : events) {
            aggregate.apply(event);
        }
        return fresh;
    }

    public String id() {
        return id;
    }

    public long version() {
        return version;
    }

    /**
     * @return A read-only view of the events recorded since the aggregate was loaded or last saved
     */
    public List<E> uncommittedEvents() {
        return Collections.unmodifiableList(uncommittedEvents);
    }

    public void markEventsAsCommitted() {
        uncommittedEvents.clear();
    }

    @SuppressWarnings("unchecked")
    private A self() {
        return (A) this;
    }
}
