/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.helios.app.repos;

import static com.rackspace.helios.app.SeriesFixtures.HOUR;
import static com.rackspace.helios.app.SeriesFixtures.START;
import static com.rackspace.helios.app.SeriesFixtures.hourly;
import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.helios.app.CassandraContainerSetup;
import com.rackspace.helios.app.model.AggregateKind;
import com.rackspace.helios.app.model.AnomalyFlag;
import com.rackspace.helios.app.model.CorrelationResult;
import com.rackspace.helios.app.model.ForecastConfig;
import com.rackspace.helios.app.model.ForecastDiagnostics;
import com.rackspace.helios.app.model.ForecastResult;
import com.rackspace.helios.app.model.ForecastRun;
import com.rackspace.helios.app.model.GoldSummary;
import com.rackspace.helios.app.model.QualityFlag;
import com.rackspace.helios.app.model.RawPoint;
import com.rackspace.helios.app.model.SilverSeries;
import com.rackspace.helios.app.model.TimeSeriesPoint;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import org.apache.commons.lang3.RandomStringUtils;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.CassandraContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class CassandraStoresTest {

  @Container
  public static CassandraContainer<?> cassandraContainer = new CassandraContainer<>(
      CassandraContainerSetup.DOCKER_IMAGE);

  @TestConfiguration
  @Import(CassandraContainerSetup.class)
  public static class TestConfig {
    @Bean
    CassandraContainer<?> cassandraContainer() {
      return cassandraContainer;
    }
  }

  @Autowired
  BronzeStore bronzeStore;

  @Autowired
  SeriesStore seriesStore;

  @Autowired
  SummaryStore summaryStore;

  @Autowired
  ResultsStore resultsStore;

  private static String randomEntity() {
    return RandomStringUtils.randomAlphanumeric(8);
  }

  @Nested
  class bronze {

    @Test
    void appendAndReadAcrossPartitions() {
      final String entityId = randomEntity();
      final RawPoint first = new RawPoint()
          .setEntityId(entityId)
          .setMetric("production")
          .setTimestamp(OffsetDateTime.parse("2024-01-01T02:00:00+01:00"))
          .setValue(10)
          .setUnit("MWh")
          .setSource("nordpool");
      final RawPoint second = new RawPoint()
          .setEntityId(entityId)
          .setMetric("production")
          .setTimestamp(OffsetDateTime.parse("2024-01-20T05:00:00Z"))
          .setValue(40);

      Flux.just(first, second)
          .concatMap(bronzeStore::append)
          .then()
          .block();

      StepVerifier.create(bronzeStore.readRange(entityId, "production",
              Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"))
              .collectList())
          .assertNext(points -> {
            assertThat(points).hasSize(2);
            assertThat(points.get(0).getTimestamp())
                .isEqualTo(OffsetDateTime.parse("2024-01-01T02:00:00+01:00"));
            assertThat(points.get(0).getSource()).isEqualTo("nordpool");
            assertThat(points.get(0).getUnit()).isEqualTo("MWh");
            assertThat(points.get(0).getValue()).isEqualTo(10.0);
            assertThat(points.get(0).getIngestedAt()).isNotNull();
            assertThat(points.get(1).getSource()).isNull();
            assertThat(points.get(1).getValue()).isEqualTo(40.0);
          })
          .verifyComplete();
    }

    @Test
    void rangeIsHalfOpen() {
      final String entityId = randomEntity();
      bronzeStore.append(new RawPoint()
          .setEntityId(entityId)
          .setMetric("consumption")
          .setTimestamp(OffsetDateTime.parse("2024-01-02T00:00:00Z"))
          .setValue(1)).block();

      StepVerifier.create(bronzeStore.readRange(entityId, "consumption",
              Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z")))
          .verifyComplete();
    }
  }

  @Nested
  class silver {

    @Test
    void writeAndReadOnGrid() {
      final String entityId = randomEntity();
      final SilverSeries series = hourly(entityId, "production", 1.0, null, 3.0, 4.0);

      seriesStore.writeSeries(series).block();

      StepVerifier.create(seriesStore.readSeries(entityId, "production",
              START, START.plus(HOUR.multipliedBy(4))))
          .assertNext(read -> {
            assertThat(read.getStart()).isEqualTo(START);
            assertThat(read.getInterval()).isEqualTo(HOUR);
            assertThat(read.getPoints())
                .extracting(TimeSeriesPoint::getValue)
                .containsExactly(1.0, null, 3.0, 4.0);
            assertThat(read.getPoints().get(1).getQualityFlag()).isEqualTo(QualityFlag.MISSING);
          })
          .verifyComplete();
    }

    @Test
    void nothingStored() {
      StepVerifier.create(seriesStore.readSeries(randomEntity(), "production",
              START, START.plus(Duration.ofDays(1))))
          .assertNext(read -> assertThat(read.isEmpty()).isTrue())
          .verifyComplete();
    }
  }

  @Test
  void summaries() {
    final String entityId = randomEntity();
    final GoldSummary summary = new GoldSummary()
        .setEntityId(entityId)
        .setMetric("production")
        .setWindowStart(START)
        .setWindowEnd(START.plus(Duration.ofDays(1)))
        .setWindow(Duration.ofDays(1))
        .setAggregateKind(AggregateKind.SUM)
        .setValue(276)
        .setPointsPresent(24)
        .setPointsExpected(24)
        .setCompletenessRatio(1);

    summaryStore.writeSummaries(List.of(summary)).block();

    StepVerifier.create(summaryStore.readSummaries(entityId, "production", AggregateKind.SUM,
            START, START.plus(Duration.ofDays(2))))
        .expectNext(summary)
        .verifyComplete();
    StepVerifier.create(summaryStore.readSummaries(entityId, "production", AggregateKind.MEAN,
            START, START.plus(Duration.ofDays(2))))
        .verifyComplete();
  }

  @Test
  void anomalies() {
    final String entityId = randomEntity();
    final AnomalyFlag flag = new AnomalyFlag()
        .setEntityId(entityId)
        .setMetric("production")
        .setTimestamp(START.plus(HOUR.multipliedBy(5)))
        .setSeverity(12.5)
        .setMethod("rolling-mad")
        .setReferenceValue(102)
        .setValue(1000);

    resultsStore.writeAnomalies(List.of(flag)).block();

    StepVerifier.create(resultsStore.readAnomalies(entityId, "production",
            START, START.plus(Duration.ofDays(1))))
        .expectNext(flag)
        .verifyComplete();
  }

  @Test
  void correlations() {
    final String entityPair = randomEntity() + "|" + randomEntity();
    final CorrelationResult result = new CorrelationResult()
        .setEntityPair(entityPair)
        .setMetricPair("temperature_2m|consumption")
        .setWindowStart(START)
        .setWindowEnd(START.plus(HOUR.multipliedBy(48)))
        .setLag(3)
        .setCoefficient(0.93)
        .setPairedPoints(45);

    resultsStore.writeCorrelations(List.of(result)).block();

    StepVerifier.create(resultsStore.readCorrelations(entityPair, START, START.plus(Duration.ofDays(1))))
        .expectNext(result)
        .verifyComplete();
  }

  @Test
  void forecasts() {
    final String entityId = randomEntity();
    final Instant generatedAt = Instant.parse("2024-02-01T12:00:00Z");
    final Instant trainingEnd = Instant.parse("2024-01-29T00:00:00Z");
    final ForecastConfig config = new ForecastConfig().setArOrder(2).setMaOrder(0);
    final ForecastResult result = new ForecastResult()
        .setEntityId(entityId)
        .setMetric("consumption")
        .setGeneratedAt(generatedAt)
        .setHorizonTimestamp(trainingEnd)
        .setPointEstimate(1170)
        .setLowerBound(1160)
        .setUpperBound(1180)
        .setModelId("model-" + entityId);
    final ForecastDiagnostics diagnostics = new ForecastDiagnostics()
        .setModelId("model-" + entityId)
        .setEntityId(entityId)
        .setMetric("consumption")
        .setTrainingStart(START)
        .setTrainingEnd(trainingEnd)
        .setConfig(config)
        .setExogenous(List.of(entityId + "/temperature_2m"))
        .setSeasonalProfile(new double[]{1, 2, 3})
        .setExogenousCoefficients(new double[]{-15})
        .setArCoefficients(new double[]{0.5, 0.1})
        .setMaCoefficients(new double[0])
        .setResidualMean(0.01)
        .setResidualStdDev(1.1)
        .setResidualCount(671)
        .setIterations(1)
        .setConverged(true);

    resultsStore.writeForecasts(new ForecastRun(List.of(result), diagnostics)).block();

    StepVerifier.create(resultsStore.readForecasts(entityId, "consumption", generatedAt))
        .expectNext(result)
        .verifyComplete();
    StepVerifier.create(resultsStore.readForecastModel("model-" + entityId))
        .assertNext(read -> {
          assertThat(read.getConfig()).isEqualTo(config);
          assertThat(read.getArCoefficients()).containsExactly(0.5, 0.1);
          assertThat(read.getMaCoefficients()).isEmpty();
          assertThat(read.getExogenous()).containsExactly(entityId + "/temperature_2m");
          assertThat(read.isConverged()).isTrue();
        })
        .verifyComplete();
  }
}
