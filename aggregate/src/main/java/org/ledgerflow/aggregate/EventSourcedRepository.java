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

import io.cloudevents.CloudEvent;
import org.ledgerflow.eventstore.api.EventStore;
import org.ledgerflow.eventstore.api.EventStream;
import org.ledgerflow.eventstore.api.OptimisticConcurrencyConflictException;
import org.ledgerflow.eventstore.api.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Saves and loads aggregates of one type through an {@link EventStore}.
 * <p>
 * Saving appends the uncommitted events of the aggregate, expecting the version the aggregate had before those events
 * were recorded. Loading reads all events of the aggregate and replays them into a new instance.
 * <p>
 * Subclasses add lookups by other attributes than the id with {@link #scan(String)} and {@link #scanAll()}. These read
 * every event of the given kind in the store, which is fine until a projection is in place.
 *
 * @param <A> The aggregate type
 * @param <E> The event type of the aggregate
 */
public abstract class EventSourcedRepository<A extends AggregateRoot<A, E>, E extends DomainEvent> {
    private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);

    private final EventStore eventStore;
    private final DomainEventCodec<E> codec;
    private final BiFunction<String, List<E>, A> reconstitution;

    /**
     * @param eventStore     The event store
     * @param codec          The codec of the aggregate's events
     * @param reconstitution The {@code reconstitute} function of the aggregate type, building an instance from its id and events
     */
    protected EventSourcedRepository(EventStore eventStore, DomainEventCodec<E> codec, BiFunction<String, List<E>, A> reconstitution) {
        requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        requireNonNull(codec, DomainEventCodec.class.getSimpleName() + " cannot be null");
        requireNonNull(reconstitution, "Reconstitution function cannot be null");
        this.eventStore = eventStore;
        this.codec = codec;
        this.reconstitution = reconstitution;
    }

    /**
     * Append the uncommitted events of the {@code aggregate} and mark them as committed. Does nothing if there are none.
     *
     * @throws OptimisticConcurrencyConflictException If the aggregate was changed by someone else after it was loaded.
     *                                                The aggregate keeps its uncommitted events and should be discarded.
     */
    public void save(A aggregate) {
        requireNonNull(aggregate, "Aggregate cannot be null");
        List<E> uncommittedEvents = aggregate.uncommittedEvents();
        if (uncommittedEvents.isEmpty()) {
            return;
        }

        long expectedVersion = aggregate.version() - uncommittedEvents.size();
        WriteResult writeResult = eventStore.append(aggregate.id(), expectedVersion, uncommittedEvents.stream().map(codec::toCloudEvent));
        aggregate.markEventsAsCommitted();
        log.debug("Saved {} {} (version {} -> {})", aggregate.getClass().getSimpleName(), aggregate.id(), writeResult.getOldVersion(), writeResult.getNewVersion());
    }

    /**
     * @return The aggregate with the given id, or an empty {@code Optional} if it has no events or its events belong to
     * another aggregate type.
     */
    public Optional<A> findById(String id) {
        requireNonNull(id, "Id cannot be null");
        EventStream<CloudEvent> eventStream = eventStore.read(id);
        if (eventStream.isEmpty()) {
            return Optional.empty();
        }
        URI source = eventStream.events().findFirst().orElseThrow().getSource();
        if (!codec.handles(source)) {
            log.debug("Stream {} belongs to aggregate type {}, not found", id, source);
            return Optional.empty();
        }
        List<E> events = eventStream.map(codec::toDomainEvent).eventList();
        return Optional.of(reconstitution.apply(id, events));
    }

    /**
     * @return All events of the given type, decoded, in the order they were appended.
     */
    protected Stream<E> scan(String eventType) {
        return eventStore.readByType(eventType).map(codec::toDomainEvent);
    }

    /**
     * @return All events in the store that this repository's codec knows, decoded, in the order they were appended.
     * Events of other aggregate types are skipped.
     */
    protected Stream<E> scanAll() {
        return eventStore.readAll().filter(cloudEvent -> codec.supports(cloudEvent.getType())).map(codec::toDomainEvent);
    }

    protected DomainEventCodec<E> codec() {
        return codec;
    }
}
