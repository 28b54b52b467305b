package org.ledgerflow.eventstore.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EventRecordRepository
    extends JpaRepository<EventRecordEntity, Long>, JpaSpecificationExecutor<EventRecordEntity> {

  /**
   * @return the highest version stored for the aggregate, or {@code null} if it has no events
   */
  @Query("select max(e.version) from EventRecordEntity e where e.aggregateId = :aggregateId")
  Long findMaxVersion(@Param("aggregateId") String aggregateId);

  boolean existsByAggregateId(String aggregateId);
}
