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
import org.jspecify.annotations.Nullable;
import org.ledgerflow.eventstore.api.StorageFaultException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * A decoded cloud event as seen by a decoder function of {@link DomainEventCodec}: the envelope attributes plus typed
 * access to the payload fields. A missing or malformed field means the stored event is corrupt, which is reported as a
 * {@link StorageFaultException}.
 */
@NullMarked
public final class Payload {
    private final String eventId;
    private final String eventType;
    private final String aggregateId;
    private final Instant occurredAt;
    private final Map<String, Object> fields;

    Payload(String eventId, String eventType, String aggregateId, Instant occurredAt, Map<String, Object> fields) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.aggregateId = aggregateId;
        this.occurredAt = occurredAt;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public String eventId() {
        return eventId;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public String string(String name) {
        Object value = required(name);
        if (!(value instanceof String)) {
            throw malformed(name, "a string", value);
        }
        return (String) value;
    }

    /**
     * Read a decimal field. Both JSON strings ({@code "100.50"}) and JSON numbers are accepted.
     */
    public BigDecimal decimal(String name) {
        Object value = required(name);
        try {
            if (value instanceof String) {
                return new BigDecimal((String) value);
            } else if (value instanceof Number) {
                return new BigDecimal(value.toString());
            }
        } catch (NumberFormatException e) {
            throw new StorageFaultException(describe(name) + " is not a decimal: " + value, e);
        }
        throw malformed(name, "a decimal", value);
    }

    public <T extends Enum<T>> T enumValue(String name, Class<T> type) {
        String value = string(name);
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            throw new StorageFaultException(describe(name) + " is not a known " + type.getSimpleName() + ": " + value, e);
        }
    }

    private Object required(String name) {
        @Nullable Object value = fields.get(name);
        if (value == null) {
            throw new StorageFaultException(describe(name) + " is missing");
        }
        return value;
    }

    private StorageFaultException malformed(String name, String expected, Object value) {
        return new StorageFaultException(describe(name) + " is not " + expected + ": " + value);
    }

    private String describe(String name) {
        return "Field \"" + name + "\" of " + eventType + " event " + eventId;
    }
}
