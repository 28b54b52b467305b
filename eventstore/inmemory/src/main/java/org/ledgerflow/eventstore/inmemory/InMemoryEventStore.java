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

package org.ledgerflow.eventstore.inmemory;

import io.cloudevents.CloudEvent;
import io.cloudevents.SpecVersion;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.ledgerflow.cloudevents.AggregateCloudEventExtension;
import org.ledgerflow.eventstore.api.EventStore;
import org.ledgerflow.eventstore.api.EventStream;
import org.ledgerflow.eventstore.api.OptimisticConcurrencyConflictException;
import org.ledgerflow.eventstore.api.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.cloudevents.AggregateExtensionGetter.getAggregateVersion;

/**
 * This is an {@link EventStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes.
 * <p>
 * The version check and the write of an append run inside {@link ConcurrentMap#compute(Object, java.util.function.BiFunction)}
 * for the aggregate, so appends to the same aggregate are serialized while appends to different aggregates run in parallel.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<String, List<CloudEvent>> state = new ConcurrentHashMap<>();
    // Global append order, guarded by itself
    private final List<CloudEvent> appendLog = new ArrayList<>();

    @Override
    public WriteResult append(String aggregateId, long expectedVersion, Stream<CloudEvent> events) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        requireNonNull(events, "Events cannot be null");
        List<CloudEvent> eventsToAppend = events
                .peek(e -> requireTrue(e.getSpecVersion() == SpecVersion.V1, "Spec version needs to be " + SpecVersion.V1))
                .collect(Collectors.toList());

        final AtomicLong currentVersionContainer = new AtomicLong();
        state.compute(aggregateId, (__, currentEvents) -> {
            long currentVersion = calculateVersion(currentEvents);
            currentVersionContainer.set(currentVersion);
            if (currentVersion != expectedVersion) {
                throw new OptimisticConcurrencyConflictException(aggregateId, expectedVersion, currentVersion);
            } else if (eventsToAppend.isEmpty()) {
                return currentEvents;
            }

            List<CloudEvent> newEvents = applyAggregateExtension(eventsToAppend, aggregateId, currentVersion);
            List<CloudEvent> eventList = currentEvents == null ? new ArrayList<>() : new ArrayList<>(currentEvents);
            eventList.addAll(newEvents);
            synchronized (appendLog) {
                appendLog.addAll(newEvents);
            }
            return Collections.unmodifiableList(eventList);
        });

        long oldVersion = currentVersionContainer.get();
        long newVersion = oldVersion + eventsToAppend.size();
        log.debug("Appended {} event(s) to aggregate {} (version {} -> {})", eventsToAppend.size(), aggregateId, oldVersion, newVersion);
        return new WriteResult(aggregateId, oldVersion, newVersion);
    }

    @Override
    public EventStream<CloudEvent> readFrom(String aggregateId, long afterVersion) {
        requireNonNull(aggregateId, "Aggregate id cannot be null");
        List<CloudEvent> events = state.get(aggregateId);
        if (events == null) {
            return EventStream.of(aggregateId, 0, Collections.emptyList());
        }
        List<CloudEvent> eventsAfterVersion = afterVersion <= 0 ? events : events.stream().filter(e -> getAggregateVersion(e) > afterVersion).collect(Collectors.toList());
        return EventStream.of(aggregateId, calculateVersion(events), eventsAfterVersion);
    }

    @Override
    public boolean exists(String aggregateId) {
        return state.containsKey(aggregateId);
    }

    @Override
    public Stream<CloudEvent> readAll() {
        synchronized (appendLog) {
            return new ArrayList<>(appendLog).stream();
        }
    }

    @Override
    public Stream<CloudEvent> readByType(String eventType) {
        requireNonNull(eventType, "Event type cannot be null");
        return readAll().filter(e -> eventType.equals(e.getType()));
    }

    private static List<CloudEvent> applyAggregateExtension(List<CloudEvent> events, String aggregateId, long currentVersion) {
        List<CloudEvent> result = new ArrayList<>(events.size());
        long version = currentVersion;
        for (CloudEvent event : events) {
            result.add(CloudEventBuilder.v1(event).withExtension(new AggregateCloudEventExtension(aggregateId, ++version)).build());
        }
        return result;
    }

    private static long calculateVersion(List<CloudEvent> events) {
        if (events == null || events.isEmpty()) {
            return 0;
        }
        return getAggregateVersion(events.get(events.size() - 1));
    }

    private static void requireTrue(boolean bool, String message) {
        if (!bool) {
            throw new IllegalArgumentException(message);
        }
    }
}
