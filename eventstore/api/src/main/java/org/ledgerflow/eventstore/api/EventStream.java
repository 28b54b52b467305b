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

package org.ledgerflow.eventstore.api;

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Represents the event stream of an aggregate.
 */
@SuppressWarnings("NullableProblems")
public interface EventStream<T> extends Iterable<T> {

    /**
     * @return The id of the aggregate
     */
    String id();

    /**
     * The version of the aggregate when the stream was read. It is equal to {@code 0} if the aggregate has no events.
     *
     * @return The current version of the event stream
     * @see #isEmpty()
     */
    long version();

    /**
     * @return The events as a {@link Stream}. Can be called more than once.
     */
    Stream<T> events();

    @Override
    default Iterator<T> iterator() {
        return events().iterator();
    }

    /**
     * @return {@code true} if the aggregate has no events, {@code false} otherwise.
     */
    default boolean isEmpty() {
        return version() == 0;
    }

    /**
     * @return The events in this stream as a list
     */
    default List<T> eventList() {
        return events().collect(Collectors.toList());
    }

    /**
     * Apply a mapping function to the {@link EventStream}
     *
     * @param fn   The function to apply for each event.
     * @param <T2> The return type
     * @return A new {@link EventStream} where events are converted to {@code T2}.
     */
    default <T2> EventStream<T2> map(Function<T, T2> fn) {
        return new EventStream<T2>() {

            @Override
            public String id() {
                return EventStream.this.id();
            }

            @Override
            public long version() {
                return EventStream.this.version();
            }

            @Override
            public Stream<T2> events() {
                return EventStream.this.events().map(fn);
            }

            @Override
            public String toString() {
                return "EventStream{" +
                        "id='" + id() + '\'' +
                        ", version=" + version() +
                        '}';
            }
        };
    }

    /**
     * Create an {@link EventStream} backed by an immutable copy of the supplied events.
     *
     * @param id      The id of the aggregate
     * @param version The version of the aggregate
     * @param events  The events
     * @param <T>     The event type
     * @return An {@link EventStream}
     */
    static <T> EventStream<T> of(String id, long version, List<T> events) {
        List<T> copy = List.copyOf(events);
        return new EventStream<T>() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public long version() {
                return version;
            }

            @Override
            public Stream<T> events() {
                return copy.stream();
            }

            @Override
            public String toString() {
                return "EventStream{" +
                        "id='" + id + '\'' +
                        ", version=" + version +
                        ", events=" + copy +
                        '}';
            }
        };
    }
}
