package org.ledgerflow.eventstore.jpa;

import io.cloudevents.CloudEvent;

public interface CloudEventConverter<T> {
  T toDao(long version, String aggregateId, CloudEvent e);

  CloudEvent toCloudEvent(T t);
}
