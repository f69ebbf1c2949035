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

package com.rackspace.helios.app.web;

import com.rackspace.helios.app.model.AnomalyFlag;
import com.rackspace.helios.app.model.CorrelationRequest;
import com.rackspace.helios.app.model.CorrelationResult;
import com.rackspace.helios.app.model.ForecastRequest;
import com.rackspace.helios.app.model.ForecastRun;
import com.rackspace.helios.app.model.GoldSummary;
import com.rackspace.helios.app.model.PublishRequest;
import com.rackspace.helios.app.model.PublishResponse;
import com.rackspace.helios.app.model.StageRequest;
import com.rackspace.helios.app.model.TransformResult;
import com.rackspace.helios.app.services.CorrelationEngine;
import com.rackspace.helios.app.services.PipelineService;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Triggers one pipeline stage per request. Every stage reads its input from the stores and
 * responds with the output it wrote.
 */
@RestController
@RequestMapping("/api/pipeline")
@Profile("pipeline")
public class PipelineController {

  private final PipelineService pipelineService;

  @Autowired
  public PipelineController(PipelineService pipelineService) {
    this.pipelineService = pipelineService;
  }

  @PostMapping("/silver")
  public Mono<TransformResult> silver(@RequestBody @Validated StageRequest request) {
    return pipelineService.runSilver(validRange(request));
  }

  @PostMapping("/gold")
  public Mono<List<GoldSummary>> gold(@RequestBody @Validated StageRequest request) {
    return pipelineService.runGold(validRange(request));
  }

  @PostMapping("/anomalies")
  public Mono<List<AnomalyFlag>> anomalies(@RequestBody @Validated StageRequest request) {
    return pipelineService.runAnomalies(validRange(request));
  }

  /**
   * @param best when set, responds with only the best lag of each window; all results are
   * stored either way
   */
  @PostMapping("/correlations")
  public Mono<List<CorrelationResult>> correlations(@RequestBody @Validated CorrelationRequest request,
                                                    @RequestParam(defaultValue = "false") boolean best) {
    if (!request.getStart().isBefore(request.getEnd())) {
      throw new IllegalArgumentException("start must be before end");
    }
    return pipelineService.runCorrelation(request)
        .map(results -> best ? CorrelationEngine.bestLags(results) : results);
  }

  @PostMapping("/forecasts")
  public Mono<ForecastRun> forecasts(@RequestBody @Validated ForecastRequest request) {
    if (request.getTrainingStart() != null
        && !request.getTrainingStart().isBefore(request.getTrainingEnd())) {
      throw new IllegalArgumentException("trainingStart must be before trainingEnd");
    }
    return pipelineService.runForecast(request);
  }

  @PostMapping("/publish")
  public Mono<PublishResponse> publish(@RequestBody @Validated PublishRequest request) {
    if (!request.getStart().isBefore(request.getEnd())) {
      throw new IllegalArgumentException("start must be before end");
    }
    return pipelineService.publish(request)
        .map(count -> new PublishResponse().setTable(request.getTable()).setPublished(count));
  }

  private static StageRequest validRange(StageRequest request) {
    if (!request.getStart().isBefore(request.getEnd())) {
      throw new IllegalArgumentException("start must be before end");
    }
    return request;
  }
}
