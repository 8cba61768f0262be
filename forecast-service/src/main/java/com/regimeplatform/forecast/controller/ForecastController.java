package com.regimeplatform.forecast.controller;

import com.regimeplatform.common.config.PipelineConfig;
import com.regimeplatform.common.config.ServiceLimits;
import com.regimeplatform.common.state.ManagerStats;
import com.regimeplatform.forecast.dto.PredictRequest;
import com.regimeplatform.forecast.dto.PredictResponse;
import com.regimeplatform.forecast.dto.RestoreRequest;
import com.regimeplatform.forecast.dto.SnapshotResponse;
import com.regimeplatform.forecast.dto.TruthRequest;
import com.regimeplatform.forecast.dto.TruthResponse;
import com.regimeplatform.forecast.service.ForecastService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class ForecastController {

    private final ForecastService forecastService;
    private final PipelineConfig pipelineConfig;
    private final ServiceLimits serviceLimits;

    public ForecastController(ForecastService forecastService, PipelineConfig pipelineConfig,
                              ServiceLimits serviceLimits) {
        this.forecastService = forecastService;
        this.pipelineConfig  = pipelineConfig;
        this.serviceLimits   = serviceLimits;
    }

    @PostMapping("/predict")
    public Mono<ResponseEntity<PredictResponse>> predict(@RequestBody PredictRequest request) {
        return forecastService.predict(request).map(ResponseEntity::ok);
    }

    @PostMapping("/truth")
    public Mono<ResponseEntity<TruthResponse>> truth(@RequestBody TruthRequest request) {
        return forecastService.truth(request).map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<ManagerStats>> stats() {
        return forecastService.stats().map(ResponseEntity::ok);
    }

    @PostMapping("/snapshot")
    public Mono<ResponseEntity<SnapshotResponse>> snapshot() {
        return forecastService.snapshot().map(ResponseEntity::ok);
    }

    @GetMapping("/snapshots")
    public Mono<ResponseEntity<List<String>>> snapshots() {
        return forecastService.snapshots().map(ResponseEntity::ok);
    }

    @PostMapping("/restore")
    public Mono<ResponseEntity<SnapshotResponse>> restore(@RequestBody(required = false) RestoreRequest request) {
        return forecastService.restore(request == null ? null : request.name()).map(ResponseEntity::ok);
    }

    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> config() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pipeline", pipelineConfig);
        body.put("service", serviceLimits);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
