package org.ledgerflow.eventstore.jpa;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import java.time.Instant;
import java.time.OffsetDateTime;
import lombok.val;
import org.ledgerflow.cloudevents.AggregateCloudEventExtension;
import org.ledgerflow.eventstore.api.StorageFaultException;

/**
 * Maps between a {@link CloudEvent} and an {@link EventRecordEntity}. The payload is stored as JSON
 * text, the subject of the cloud event is the aggregate id.
 */
public class EventRecordConverter implements CloudEventConverter<EventRecordEntity> {
  static final String JSON = "application/json";

  @Override
  public EventRecordEntity toDao(long version, String aggregateId, CloudEvent e) {
    if (e.getData() == null) {
      throw new IllegalArgumentException("Cloud event " + e.getId() + " has no data");
    }
    val occurredAt = e.getTime() == null ? Instant.now() : e.getTime().toInstant();
    return EventRecordEntity.builder()
        .eventId(e.getId())
        .aggregateId(aggregateId)
        .aggregateType(e.getSource())
        .eventType(e.getType())
        .eventData(new String(e.getData().toBytes(), UTF_8))
        .version(version)
        .occurredAt(occurredAt)
        .build();
  }

  @Override
  public CloudEvent toCloudEvent(EventRecordEntity dao) {
    if (dao.eventData() == null || dao.aggregateType() == null || dao.occurredAt() == null) {
      throw new StorageFaultException(
          "Event record " + dao.id() + " of aggregate " + dao.aggregateId() + " is incomplete");
    }
    return CloudEventBuilder.v1()
        .withId(dao.eventId())
        .withSource(dao.aggregateType())
        .withType(dao.eventType())
        .withSubject(dao.aggregateId())
        .withTime(OffsetDateTime.ofInstant(dao.occurredAt(), UTC))
        .withDataContentType(JSON)
        .withData(dao.eventData().getBytes(UTF_8))
        .withExtension(new AggregateCloudEventExtension(dao.aggregateId(), dao.version()))
        .build();
  }
}
