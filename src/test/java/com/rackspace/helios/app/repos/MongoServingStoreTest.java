package com.rackspace.helios.app.repos;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.rackspace.helios.app.exceptions.StoreUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

class MongoServingStoreTest {

  final ReactiveMongoTemplate mongoTemplate = mock(ReactiveMongoTemplate.class);
  final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  final MongoServingStore servingStore = new MongoServingStore(mongoTemplate, meterRegistry);

  @Test
  void insertsIntoNamedCollection() {
    final List<String> records = List.of("a", "b", "c");
    when(mongoTemplate.insert(records, "silver_production"))
        .thenReturn(Flux.fromIterable(records));

    StepVerifier.create(servingStore.publish("silver_production", records))
        .expectNext(3L)
        .verifyComplete();
  }

  @Test
  void nothingToPublish() {
    StepVerifier.create(servingStore.publish("silver_production", List.of()))
        .expectNext(0L)
        .verifyComplete();

    verifyNoInteractions(mongoTemplate);
  }

  @Test
  void failuresAreCountedAndMapped() {
    when(mongoTemplate.insert(anyCollection(), anyString()))
        .thenReturn(Flux.error(new DataAccessResourceFailureException("down")));

    StepVerifier.create(servingStore.publish("gold_production", List.of("a")))
        .expectError(StoreUnavailableException.class)
        .verify();

    assertThat(meterRegistry.get("helios.db.operation.errors").tag("type", "serving").counter().count())
        .isEqualTo(1);
  }
}
