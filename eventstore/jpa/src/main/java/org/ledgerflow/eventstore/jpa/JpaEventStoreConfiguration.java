package org.ledgerflow.eventstore.jpa;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Enables the {@link EventRecordRepository} and exposes a {@link JPAEventStore}. The application
 * provides the {@code DataSource}, the entity manager factory (scanning {@link #ENTITY_PACKAGE})
 * and the {@link PlatformTransactionManager}.
 */
@Configuration
@EnableJpaRepositories(basePackageClasses = EventRecordRepository.class)
public class JpaEventStoreConfiguration {
  public static final String ENTITY_PACKAGE = "org.ledgerflow.eventstore.jpa";

  @Bean
  public JPAEventStore jpaEventStore(
      EventRecordRepository eventRecordRepository, PlatformTransactionManager transactionManager) {
    return JPAEventStore.builder()
        .eventLog(eventRecordRepository)
        .converter(new EventRecordConverter())
        .transactionManager(transactionManager)
        .build();
  }
}
