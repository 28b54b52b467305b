package org.ledgerflow.eventstore.jpa;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.net.URI;
import java.time.Instant;
import lombok.*;
import lombok.experimental.Accessors;

/**
 * One row per event. The identity column gives the global append order, the unique index on
 * (aggregate_id, version) is the backstop against two writers claiming the same version.
 */
@Entity
@Table(
    name = "event_store",
    indexes = {
      @Index(name = "IDX_event_store_aggregate_id", columnList = "aggregate_id"),
      @Index(name = "IDX_event_store_event_type", columnList = "event_type"),
      @Index(name = "IDX_event_store_occurred_at", columnList = "occurred_at"),
      @Index(
          name = "U_event_store_aggregate_version",
          columnList = "aggregate_id, version",
          unique = true)
    })
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Accessors(fluent = true)
public class EventRecordEntity {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "event_id", nullable = false, updatable = false)
  private String eventId;

  @Column(name = "aggregate_id", nullable = false, updatable = false)
  private String aggregateId;

  @Column(name = "aggregate_type", nullable = false, updatable = false)
  @Convert(converter = URIConverter.class)
  private URI aggregateType;

  @Column(name = "event_type", nullable = false, updatable = false)
  private String eventType;

  @Column(name = "event_data", nullable = false, updatable = false, length = 65535)
  private String eventData;

  @Column(name = "version", nullable = false, updatable = false)
  private long version;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;
}
