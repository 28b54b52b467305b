package org.ledgerflow.eventstore.jpa;

import static java.util.Objects.requireNonNull;
import static org.ledgerflow.eventstore.jpa.EventRecordSpecifications.*;

import io.cloudevents.CloudEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.val;
import org.hibernate.exception.ConstraintViolationException;
import org.ledgerflow.eventstore.api.EventStore;
import org.ledgerflow.eventstore.api.EventStream;
import org.ledgerflow.eventstore.api.OptimisticConcurrencyConflictException;
import org.ledgerflow.eventstore.api.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * An {@link EventStore} backed by a relational database through Spring Data JPA.
 *
 * <p>The version check and the batch insert of an append run in one transaction. Two transactions
 * that both pass the version check race on the unique (aggregate_id, version) index, and the loser
 * gets an {@link OptimisticConcurrencyConflictException}. Other integrity violations, such as a
 * payload that does not fit the column, propagate as the original {@link
 * DataIntegrityViolationException}.
 */
public class JPAEventStore implements EventStore {
  private static final Logger log = LoggerFactory.getLogger(JPAEventStore.class);
  private static final String UNIQUE_VERSION_CONSTRAINT = "U_EVENT_STORE_AGGREGATE_VERSION";

  private final EventRecordRepository eventLog;
  private final CloudEventConverter<EventRecordEntity> converter;
  private final TransactionTemplate transactionTemplate;
  private final TransactionTemplate readOnlyTransactionTemplate;

  @Builder
  public JPAEventStore(
      EventRecordRepository eventLog,
      CloudEventConverter<EventRecordEntity> converter,
      PlatformTransactionManager transactionManager) {
    requireNonNull(eventLog, EventRecordRepository.class.getSimpleName() + " cannot be null");
    requireNonNull(transactionManager, "Transaction manager cannot be null");
    this.eventLog = eventLog;
    this.converter = converter == null ? new EventRecordConverter() : converter;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.readOnlyTransactionTemplate = new TransactionTemplate(transactionManager);
    this.readOnlyTransactionTemplate.setReadOnly(true);
  }

  @Override
  public WriteResult append(String aggregateId, long expectedVersion, Stream<CloudEvent> events) {
    requireNonNull(aggregateId, "Aggregate id cannot be null");
    requireNonNull(events, "Events cannot be null");
    val eventList = events.collect(Collectors.toList());

    try {
      return transactionTemplate.execute(
          status -> {
            val currentVersion = currentVersion(aggregateId);
            if (currentVersion != expectedVersion) {
              throw new OptimisticConcurrencyConflictException(
                  aggregateId, expectedVersion, currentVersion);
            }
            if (eventList.isEmpty()) {
              return new WriteResult(aggregateId, currentVersion, currentVersion);
            }

            List<EventRecordEntity> daos = new ArrayList<>(eventList.size());
            long version = currentVersion;
            for (CloudEvent event : eventList) {
              daos.add(converter.toDao(++version, aggregateId, event));
            }
            eventLog.saveAllAndFlush(daos);
            log.debug(
                "Appended {} event(s) to aggregate {} (version {} -> {})",
                daos.size(),
                aggregateId,
                currentVersion,
                version);
            return new WriteResult(aggregateId, currentVersion, version);
          });
    } catch (DataIntegrityViolationException e) {
      val actualVersion = readOnlyTransactionTemplate.execute(status -> currentVersion(aggregateId));
      if (actualVersion == expectedVersion && !violatesUniqueVersion(e)) {
        throw e;
      }
      log.debug(
          "Unique version constraint violated for aggregate {}, expected version {} but was {}",
          aggregateId,
          expectedVersion,
          actualVersion);
      throw new OptimisticConcurrencyConflictException(
          aggregateId, expectedVersion, actualVersion, e);
    }
  }

  /**
   * The version of the returned stream is the version of its last event, so it matches the events
   * even if another transaction appends while they are read. Without events after {@code
   * afterVersion} it is the current version, capped at {@code afterVersion}.
   */
  @Override
  public EventStream<CloudEvent> readFrom(String aggregateId, long afterVersion) {
    requireNonNull(aggregateId, "Aggregate id cannot be null");
    return readOnlyTransactionTemplate.execute(
        status -> {
          val records =
              eventLog.findAll(
                  byAggregateId(aggregateId).and(afterVersion(afterVersion)), BY_VERSION);
          if (records.isEmpty()) {
            val version = Math.min(currentVersion(aggregateId), Math.max(afterVersion, 0));
            return EventStream.<CloudEvent>of(aggregateId, version, List.of());
          }
          val version = records.get(records.size() - 1).version();
          val events = records.stream().map(converter::toCloudEvent).collect(Collectors.toList());
          return EventStream.of(aggregateId, version, events);
        });
  }

  @Override
  public boolean exists(String aggregateId) {
    return eventLog.existsByAggregateId(aggregateId);
  }

  @Override
  public Stream<CloudEvent> readAll() {
    return readOnlyTransactionTemplate
        .execute(
            status ->
                eventLog.findAll(BY_APPEND_ORDER).stream()
                    .map(converter::toCloudEvent)
                    .collect(Collectors.toList()))
        .stream();
  }

  @Override
  public Stream<CloudEvent> readByType(String eventType) {
    requireNonNull(eventType, "Event type cannot be null");
    return readOnlyTransactionTemplate
        .execute(
            status ->
                eventLog.findAll(byEventType(eventType), BY_APPEND_ORDER).stream()
                    .map(converter::toCloudEvent)
                    .collect(Collectors.toList()))
        .stream();
  }

  private static boolean violatesUniqueVersion(DataIntegrityViolationException e) {
    for (Throwable cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof ConstraintViolationException) {
        val constraintName = ((ConstraintViolationException) cause).getConstraintName();
        return constraintName != null
            && constraintName.toUpperCase(Locale.ROOT).contains(UNIQUE_VERSION_CONSTRAINT);
      }
    }
    return false;
  }

  private long currentVersion(String aggregateId) {
    val maxVersion = eventLog.findMaxVersion(aggregateId);
    return maxVersion == null ? 0 : maxVersion;
  }
}
