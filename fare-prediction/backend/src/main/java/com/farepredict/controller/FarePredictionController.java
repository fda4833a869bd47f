package com.farepredict.controller;

import com.farepredict.dto.BatchPredictionItem;
import com.farepredict.dto.BatchPredictionRequest;
import com.farepredict.dto.HealthResponse;
import com.farepredict.dto.ModelDescriptor;
import com.farepredict.dto.PredictionResponse;
import com.farepredict.service.ModelRegistryService;
import com.farepredict.service.PredictionService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequiredArgsConstructor
public class FarePredictionController {

    private final PredictionService    predictionService;
    private final ModelRegistryService modelRegistry;

    @GetMapping("/api/models")
    public ResponseEntity<Map<String, ModelDescriptor>> listModels() {
        Map<String, ModelDescriptor> models = new LinkedHashMap<>();
        modelRegistry.describeAll().forEach(d -> models.put(d.getIdentifier(), d));
        return ResponseEntity.ok(models);
    }

    @PostMapping("/api/predict")
    public ResponseEntity<PredictionResponse> predict(
            @RequestBody JsonNode request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /api/predict | model={} | pickupDatetime={} | requestId={}",
                 request.path("model").asText(null), request.path("pickup_datetime").asText(null), requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(predictionService.predict(request, requestId));
    }

    @PostMapping("/api/batch-predict")
    public ResponseEntity<List<BatchPredictionItem>> batchPredict(
            @RequestBody BatchPredictionRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /api/batch-predict | count={} | requestId={}",
                 request.getPredictions() != null ? request.getPredictions().size() : null, requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(predictionService.batchPredict(request.getPredictions(), requestId));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        List<ModelDescriptor> models = modelRegistry.describeAll();
        return ResponseEntity.ok(HealthResponse.builder()
            .status("healthy")
            .modelsAvailable(models.stream().filter(ModelDescriptor::isAvailable).count())
            .totalModels(models.size())
            .build());
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
