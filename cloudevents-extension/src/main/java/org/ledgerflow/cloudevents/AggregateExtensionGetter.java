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

package org.ledgerflow.cloudevents;

import io.cloudevents.CloudEvent;

import static org.ledgerflow.cloudevents.AggregateCloudEventExtension.AGGREGATE_ID;
import static org.ledgerflow.cloudevents.AggregateCloudEventExtension.AGGREGATE_VERSION;

/**
 * Utility class that reads the {@link AggregateCloudEventExtension} values, converted to the correct type, from a {@link CloudEvent}.
 */
public class AggregateExtensionGetter {

    /**
     * Get the aggregate version from a {@link CloudEvent} that has {@link AggregateCloudEventExtension} applied.
     *
     * @param cloudEvent The cloud event
     * @return the version of the event in its aggregate's event stream
     */
    public static long getAggregateVersion(CloudEvent cloudEvent) {
        if (!cloudEvent.getExtensionNames().contains(AGGREGATE_VERSION)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + AGGREGATE_VERSION + " key");
        }

        Object aggregateVersion = cloudEvent.getExtension(AGGREGATE_VERSION);
        if (!(aggregateVersion instanceof Number)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + AGGREGATE_VERSION + " value that is a number");
        }
        return ((Number) aggregateVersion).longValue();
    }

    /**
     * Get the aggregate id from a {@link CloudEvent} that has {@link AggregateCloudEventExtension} applied.
     *
     * @param cloudEvent The cloud event
     * @return the id of the aggregate the event belongs to
     */
    public static String getAggregateId(CloudEvent cloudEvent) {
        if (!cloudEvent.getExtensionNames().contains(AGGREGATE_ID)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + AGGREGATE_ID + " key");
        }

        Object aggregateId = cloudEvent.getExtension(AGGREGATE_ID);
        if (!(aggregateId instanceof String)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + AGGREGATE_ID + " value that is an instance of " + String.class.getSimpleName());
        }
        return (String) aggregateId;
    }
}
