package com.rackspace.helios.app.web;

import static com.rackspace.helios.app.SeriesFixtures.START;
import static com.rackspace.helios.app.SeriesFixtures.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.helios.app.exceptions.CoverageException;
import com.rackspace.helios.app.exceptions.FitConvergenceException;
import com.rackspace.helios.app.exceptions.InsufficientDataException;
import com.rackspace.helios.app.exceptions.MissingPointException;
import com.rackspace.helios.app.exceptions.StoreUnavailableException;
import com.rackspace.helios.app.model.CorrelationResult;
import com.rackspace.helios.app.model.ForecastConfig;
import com.rackspace.helios.app.model.TransformResult;
import com.rackspace.helios.app.services.PipelineService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@ActiveProfiles(profiles = {"test", "pipeline"})
@WebFluxTest(PipelineController.class)
@Import(RestExceptionHandler.class)
class PipelineControllerTest {

  @MockBean
  PipelineService pipelineService;

  @Autowired
  WebTestClient webTestClient;

  private static Map<String, Object> stage(String start, String end) {
    return Map.of(
        "entityId", "NO1",
        "metric", "production",
        "start", start,
        "end", end);
  }

  private static Map<String, Object> forecastRequest() {
    return Map.of(
        "entityId", "NO1",
        "metric", "consumption",
        "exogenous", List.of(Map.of("entityId", "NO1", "metric", "temperature_2m")),
        "trainingEnd", "2024-02-01T00:00:00Z");
  }

  @Test
  void silver() {
    when(pipelineService.runSilver(any()))
        .thenReturn(Mono.just(new TransformResult(hourly("NO1", "production", 1.0, 2.0), List.of())));

    webTestClient.post()
        .uri("/api/pipeline/silver")
        .bodyValue(stage("2024-01-01T00:00:00Z", "2024-01-01T02:00:00Z"))
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.series.points.length()").isEqualTo(2)
        .jsonPath("$.series.points[0].timestamp").isEqualTo("2024-01-01T00:00:00Z")
        .jsonPath("$.series.points[0].qualityFlag").isEqualTo("RAW")
        .jsonPath("$.rejected").isEmpty();
  }

  @Test
  void emptyRange() {
    webTestClient.post()
        .uri("/api/pipeline/gold")
        .bodyValue(stage("2024-01-02T00:00:00Z", "2024-01-01T00:00:00Z"))
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.message").isEqualTo("start must be before end");

    verify(pipelineService, never()).runGold(any());
  }

  @Test
  void missingField() {
    webTestClient.post()
        .uri("/api/pipeline/anomalies")
        .bodyValue(Map.of("metric", "production", "start", "2024-01-01T00:00:00Z",
            "end", "2024-01-02T00:00:00Z"))
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.message").value(message -> assertThat((String) message).contains("entityId"));
  }

  @Test
  void bestCorrelations() {
    final Instant windowEnd = START.plusSeconds(48 * 3600);
    when(pipelineService.runCorrelation(any()))
        .thenReturn(Mono.just(List.of(
            correlation(0, 0.4, windowEnd),
            correlation(3, -0.9, windowEnd))));

    webTestClient.post()
        .uri("/api/pipeline/correlations?best=true")
        .bodyValue(Map.of(
            "weather", Map.of("entityId", "NO1", "metric", "temperature_2m"),
            "energy", Map.of("entityId", "NO1", "metric", "consumption"),
            "start", "2024-01-01T00:00:00Z",
            "end", "2024-01-03T00:00:00Z"))
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.length()").isEqualTo(1)
        .jsonPath("$[0].lag").isEqualTo(3);
  }

  @Test
  void forecastCoverageGap() {
    when(pipelineService.runForecast(any()))
        .thenReturn(Mono.error(new CoverageException("NO1/temperature_2m",
            Instant.parse("2024-02-01T05:00:00Z"))));

    webTestClient.post()
        .uri("/api/pipeline/forecasts")
        .bodyValue(forecastRequest())
        .exchange()
        .expectStatus().isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY)
        .expectBody()
        .jsonPath("$.message").isEqualTo(
            "Exogenous series NO1/temperature_2m has no value at 2024-02-01T05:00:00Z");
  }

  @Test
  void forecastInsufficientData() {
    when(pipelineService.runForecast(any()))
        .thenReturn(Mono.error(new InsufficientDataException("too short")));

    webTestClient.post()
        .uri("/api/pipeline/forecasts")
        .bodyValue(forecastRequest())
        .exchange()
        .expectStatus().isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
  }

  @Test
  void forecastMissingTrainingPoint() {
    when(pipelineService.runForecast(any()))
        .thenReturn(Mono.error(new MissingPointException("Training window has a missing point")));

    webTestClient.post()
        .uri("/api/pipeline/forecasts")
        .bodyValue(forecastRequest())
        .exchange()
        .expectStatus().isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY)
        .expectBody()
        .jsonPath("$.message").isEqualTo("Training window has a missing point");
  }

  @Test
  void unexpectedStateIsServerError() {
    when(pipelineService.runForecast(any()))
        .thenReturn(Mono.error(new IllegalStateException("stored configuration differs")));

    webTestClient.post()
        .uri("/api/pipeline/forecasts")
        .bodyValue(forecastRequest())
        .exchange()
        .expectStatus().is5xxServerError();
  }

  @Test
  void forecastNotConverging() {
    when(pipelineService.runForecast(any()))
        .thenReturn(Mono.error(new FitConvergenceException("did not converge", new ForecastConfig())));

    webTestClient.post()
        .uri("/api/pipeline/forecasts")
        .bodyValue(forecastRequest())
        .exchange()
        .expectStatus().isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY)
        .expectBody()
        .jsonPath("$.detail").isEqualTo(new ForecastConfig().toString());
  }

  @Test
  void forecastTimedOut() {
    when(pipelineService.runForecast(any()))
        .thenReturn(Mono.error(new TimeoutException("fit")));

    webTestClient.post()
        .uri("/api/pipeline/forecasts")
        .bodyValue(forecastRequest())
        .exchange()
        .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
  }

  @Test
  void forecastTrainingRangeReversed() {
    webTestClient.post()
        .uri("/api/pipeline/forecasts")
        .bodyValue(Map.of(
            "entityId", "NO1",
            "metric", "consumption",
            "trainingStart", "2024-03-01T00:00:00Z",
            "trainingEnd", "2024-02-01T00:00:00Z"))
        .exchange()
        .expectStatus().isBadRequest();

    verify(pipelineService, never()).runForecast(any());
  }

  @Test
  void publish() {
    when(pipelineService.publish(any()))
        .thenReturn(Mono.just(24L));

    webTestClient.post()
        .uri("/api/pipeline/publish")
        .bodyValue(Map.of(
            "table", "silver_production",
            "source", "SILVER",
            "entityId", "NO1",
            "metric", "production",
            "start", "2024-01-01T00:00:00Z",
            "end", "2024-01-02T00:00:00Z"))
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.table").isEqualTo("silver_production")
        .jsonPath("$.published").isEqualTo(24);
  }

  @Test
  void storeUnavailable() {
    when(pipelineService.runAnomalies(any()))
        .thenReturn(Mono.error(new StoreUnavailableException("down", new RuntimeException())));

    webTestClient.post()
        .uri("/api/pipeline/anomalies")
        .bodyValue(stage("2024-01-01T00:00:00Z", "2024-01-02T00:00:00Z"))
        .exchange()
        .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
  }

  private static CorrelationResult correlation(int lag, double coefficient, Instant windowEnd) {
    return new CorrelationResult()
        .setEntityPair("NO1|NO1")
        .setMetricPair("temperature_2m|consumption")
        .setWindowStart(START)
        .setWindowEnd(windowEnd)
        .setLag(lag)
        .setCoefficient(coefficient)
        .setPairedPoints(48);
  }
}
