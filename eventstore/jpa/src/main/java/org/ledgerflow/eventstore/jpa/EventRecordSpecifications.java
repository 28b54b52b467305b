package org.ledgerflow.eventstore.jpa;

import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

final class EventRecordSpecifications {
  static final Sort BY_VERSION = Sort.by(Sort.Direction.ASC, "version");
  static final Sort BY_APPEND_ORDER = Sort.by(Sort.Direction.ASC, "id");

  private EventRecordSpecifications() {}

  static Specification<EventRecordEntity> byAggregateId(String aggregateId) {
    return (root, query, cb) -> cb.equal(root.get("aggregateId"), aggregateId);
  }

  static Specification<EventRecordEntity> afterVersion(long version) {
    return (root, query, cb) -> cb.greaterThan(root.<Long>get("version"), version);
  }

  static Specification<EventRecordEntity> byEventType(String eventType) {
    return (root, query, cb) -> cb.equal(root.get("eventType"), eventType);
  }
}
