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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.data.PojoCloudEventData;
import org.ledgerflow.eventstore.api.StorageFaultException;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.function.Function;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;
import static org.ledgerflow.cloudevents.AggregateCloudEventExtension.AGGREGATE_ID;

/**
 * Converts the domain events of one aggregate type to and from {@link CloudEvent}s. Every event type is registered
 * explicitly with an encoder, that turns the event into its payload fields, and a decoder, that builds the event back
 * from a {@link Payload}. The payload is serialized to JSON (content type {@value #CONTENT_TYPE}) with a Jackson
 * {@link ObjectMapper}.
 * <p>
 * The cloud event id is the event id, the source is the aggregate type, the type is {@link DomainEvent#eventType()},
 * the time is {@link DomainEvent#occurredAt()} and the subject is the aggregate id.
 *
 * @param <E> The event type of the aggregate
 */
public final class DomainEventCodec<E extends DomainEvent> {
    static final String CONTENT_TYPE = "application/json";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper objectMapper;
    private final URI aggregateType;
    private final Map<String, Registration<? extends E>> byEventType;
    private final Map<Class<?>, Registration<? extends E>> byClass;

    private DomainEventCodec(ObjectMapper objectMapper, URI aggregateType, List<Registration<? extends E>> registrations) {
        this.objectMapper = objectMapper;
        this.aggregateType = aggregateType;
        Map<String, Registration<? extends E>> byEventType = new LinkedHashMap<>();
        Map<Class<?>, Registration<? extends E>> byClass = new HashMap<>();
        for (Registration<? extends E> registration : registrations) {
            if (byEventType.put(registration.eventType, registration) != null) {
                throw new IllegalArgumentException("Event type " + registration.eventType + " is registered more than once");
            }
            if (byClass.put(registration.type, registration) != null) {
                throw new IllegalArgumentException(registration.type.getSimpleName() + " is registered more than once");
            }
        }
        this.byEventType = Collections.unmodifiableMap(byEventType);
        this.byClass = Collections.unmodifiableMap(byClass);
    }

    public static <E extends DomainEvent> Builder<E> builder(ObjectMapper objectMapper, URI aggregateType) {
        return new Builder<>(objectMapper, aggregateType);
    }

    /**
     * Converts the {@code domainEvent} into a {@link CloudEvent}.
     *
     * @param domainEvent The domain event to convert
     * @return A {@link CloudEvent} converted from the <code>domainEvent</code>.
     */
    public CloudEvent toCloudEvent(E domainEvent) {
        requireNonNull(domainEvent, "Domain event cannot be null");
        Registration<? extends E> registration = byClass.get(domainEvent.getClass());
        if (registration == null) {
            throw new IllegalArgumentException("No encoder registered for " + domainEvent.getClass().getName());
        }
        Map<String, Object> fields = registration.encode(domainEvent);
        // @formatter:off
        PojoCloudEventData<Map<String, Object>> cloudEventData = PojoCloudEventData.wrap(fields, objectMapper::writeValueAsBytes);
        // @formatter:on
        return CloudEventBuilder.v1()
                .withId(domainEvent.eventId())
                .withSource(aggregateType)
                .withType(registration.eventType)
                .withTime(OffsetDateTime.ofInstant(domainEvent.occurredAt(), UTC))
                .withSubject(domainEvent.aggregateId())
                .withDataContentType(CONTENT_TYPE)
                .withData(cloudEventData)
                .build();
    }

    /**
     * Converts the {@link CloudEvent} back into a domain event using the decoder registered for its type.
     *
     * @param cloudEvent The cloud event to convert
     * @return The domain event
     * @throws UnknownEventTypeException If no decoder is registered for the type of the cloud event
     * @throws StorageFaultException     If the cloud event is corrupt
     */
    public E toDomainEvent(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, "Cloud event cannot be null");
        Registration<? extends E> registration = byEventType.get(cloudEvent.getType());
        if (registration == null) {
            throw new UnknownEventTypeException(cloudEvent.getType(), cloudEvent.getId());
        }

        Payload payload = new Payload(cloudEvent.getId(), cloudEvent.getType(), aggregateIdOf(cloudEvent), occurredAtOf(cloudEvent), fieldsOf(cloudEvent));
        try {
            return registration.decoder.apply(payload);
        } catch (StorageFaultException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new StorageFaultException("Cannot decode " + cloudEvent.getType() + " event " + cloudEvent.getId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return {@code true} if {@code source} is the aggregate type of this codec, i.e. the source of the cloud events it creates
     */
    public boolean handles(URI source) {
        return aggregateType.equals(source);
    }

    /**
     * @return {@code true} if a decoder is registered for {@code eventType}
     */
    public boolean supports(String eventType) {
        return byEventType.containsKey(eventType);
    }

    /**
     * @return The registered event types, in registration order
     */
    public Set<String> eventTypes() {
        return byEventType.keySet();
    }

    /**
     * @return The registered event classes
     */
    public Set<Class<?>> eventClasses() {
        return byClass.keySet();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> fieldsOf(CloudEvent cloudEvent) {
        CloudEventData data = cloudEvent.getData();
        if (data == null) {
            throw new StorageFaultException(cloudEvent.getType() + " event " + cloudEvent.getId() + " has no data");
        } else if (data instanceof PojoCloudEventData && ((PojoCloudEventData<Object>) data).getValue() instanceof Map) {
            return (Map<String, Object>) ((PojoCloudEventData<Object>) data).getValue();
        }

        try {
            Map<String, Object> fields = objectMapper.readValue(data.toBytes(), MAP_TYPE);
            if (fields == null) {
                throw new StorageFaultException(cloudEvent.getType() + " event " + cloudEvent.getId() + " has no payload");
            }
            return fields;
        } catch (IOException e) {
            throw new StorageFaultException(cloudEvent.getType() + " event " + cloudEvent.getId() + " does not contain a JSON object", e);
        }
    }

    private static String aggregateIdOf(CloudEvent cloudEvent) {
        Object aggregateId = cloudEvent.getExtension(AGGREGATE_ID);
        if (aggregateId instanceof String) {
            return (String) aggregateId;
        } else if (cloudEvent.getSubject() != null) {
            return cloudEvent.getSubject();
        }
        throw new StorageFaultException(cloudEvent.getType() + " event " + cloudEvent.getId() + " has no aggregate id");
    }

    private static Instant occurredAtOf(CloudEvent cloudEvent) {
        if (cloudEvent.getTime() == null) {
            throw new StorageFaultException(cloudEvent.getType() + " event " + cloudEvent.getId() + " has no time");
        }
        return cloudEvent.getTime().toInstant();
    }

    private static final class Registration<T> {
        private final String eventType;
        private final Class<T> type;
        private final Function<T, Map<String, Object>> encoder;
        private final Function<Payload, T> decoder;

        private Registration(String eventType, Class<T> type, Function<T, Map<String, Object>> encoder, Function<Payload, T> decoder) {
            this.eventType = eventType;
            this.type = type;
            this.encoder = encoder;
            this.decoder = decoder;
        }

        private Map<String, Object> encode(Object event) {
            return encoder.apply(type.cast(event));
        }
    }

    public static final class Builder<E extends DomainEvent> {
        private final ObjectMapper objectMapper;
        private final URI aggregateType;
        private final List<Registration<? extends E>> registrations = new ArrayList<>();

        private Builder(ObjectMapper objectMapper, URI aggregateType) {
            requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
            requireNonNull(aggregateType, "Aggregate type cannot be null");
            this.objectMapper = objectMapper;
            this.aggregateType = aggregateType;
        }

        /**
         * Register an event type.
         *
         * @param eventType The discriminator stored as cloud event type
         * @param type      The event class
         * @param encoder   A function returning the payload fields of an event. Values must be serializable by Jackson.
         * @param decoder   A function building the event from its stored {@link Payload}
         */
        public <T extends E> Builder<E> register(String eventType, Class<T> type, Function<T, Map<String, Object>> encoder, Function<Payload, T> decoder) {
            requireNonNull(eventType, "Event type cannot be null");
            requireNonNull(type, "Event class cannot be null");
            requireNonNull(encoder, "Encoder cannot be null");
            requireNonNull(decoder, "Decoder cannot be null");
            registrations.add(new Registration<>(eventType, type, encoder, decoder));
            return this;
        }

        /**
         * @return A {@link DomainEventCodec} instance with the registered event types
         */
        public DomainEventCodec<E> build() {
            return new DomainEventCodec<>(objectMapper, aggregateType, registrations);
        }
    }
}
