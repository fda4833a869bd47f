package com.farepredict.service;

import com.farepredict.dto.BatchPredictionItem;
import com.farepredict.dto.ModelDescriptor;
import com.farepredict.dto.PredictionResponse;
import com.farepredict.dto.TripRequest;
import com.farepredict.exception.BatchSizeExceededException;
import com.farepredict.exception.FarePredictionException;
import com.farepredict.exception.MissingFieldException;
import com.farepredict.exception.NoModelAvailableException;
import com.farepredict.exception.PredictionFailedException;
import com.farepredict.feature.FeatureBuilder;
import com.farepredict.feature.FeatureVector;
import com.farepredict.feature.GeoDistance;
import com.farepredict.model.ModelType;
import com.farepredict.model.RegressionModel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Answers single and batch fare requests.
 * <p>
 * Single requests whose model is unavailable fall back to the first available model in
 * {@link ModelType} order; batch items fall back to {@code linear_regression} only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionService {

    static final ModelType BATCH_FALLBACK = ModelType.LINEAR_REGRESSION;

    static final List<String> REQUIRED_FIELDS = List.of(
        "pickup_latitude", "pickup_longitude", "dropoff_latitude", "dropoff_longitude", "pickup_datetime");

    private final ModelRegistryService modelRegistry;
    private final FeatureBuilder       featureBuilder;
    private final ObjectMapper         objectMapper;

    @Value("${fare.prediction.default-model:random_forest}")
    private String defaultModel;

    @Value("${fare.prediction.max-batch-size:1000}")
    private int maxBatchSize;

    /**
     * Scores a trip as received on the wire. Field presence is checked before the attributes
     * are bound, so a missing field is reported ahead of a malformed one.
     */
    public PredictionResponse predict(JsonNode trip, String requestId) {
        return predict(readTrip(trip), requestId);
    }

    public PredictionResponse predict(TripRequest request, String requestId) {
        requireFields(request);

        ResolvedModel resolved = resolveOrFirstAvailable(requestedModel(request), requestId);
        FeatureVector features = buildFeatures(request);
        double prediction = roundToCents(Math.max(0.0, infer(resolved, features)));
        double distanceKm = roundToCents(GeoDistance.haversineKm(
            request.getPickupLatitude(), request.getPickupLongitude(),
            request.getDropoffLatitude(), request.getDropoffLongitude()));

        log.info("Prediction served | model={} | fare={} | distanceKm={} | requestId={}",
                 resolved.identifier(), prediction, distanceKm, requestId);
        return PredictionResponse.builder()
            .prediction(prediction)
            .modelUsed(resolved.identifier())
            .distanceKm(distanceKm)
            .build();
    }

    /**
     * Scores every item independently. The result has one entry per input, in input order;
     * an item that fails yields an error entry without affecting its neighbours.
     */
    public List<BatchPredictionItem> batchPredict(List<JsonNode> items, String requestId) {
        if (items == null) {
            throw new MissingFieldException("predictions");
        }
        if (items.size() > maxBatchSize) {
            throw new BatchSizeExceededException(items.size(), maxBatchSize);
        }

        List<BatchPredictionItem> results = new ArrayList<>(items.size());
        int failures = 0;
        for (int i = 0; i < items.size(); i++) {
            try {
                results.add(predictItem(items.get(i), i));
            } catch (FarePredictionException ex) {
                log.warn("Batch item failed | index={} | code={} | reason={} | requestId={}",
                         i, ex.getErrorCode(), ex.getMessage(), requestId);
                results.add(BatchPredictionItem.failure(ex.getMessage()));
                failures++;
            } catch (RuntimeException ex) {
                log.error("Batch item failed unexpectedly | index={} | requestId={}", i, requestId, ex);
                results.add(BatchPredictionItem.failure(
                    ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName()));
                failures++;
            }
        }
        log.info("Batch prediction served | count={} | failed={} | requestId={}",
                 results.size(), failures, requestId);
        return results;
    }

    private BatchPredictionItem predictItem(JsonNode entry, int index) {
        if (entry == null || entry.isNull()) {
            throw new PredictionFailedException("Batch entry " + index + " is empty");
        }
        TripRequest item = readTrip(entry);
        FeatureVector features = buildFeatures(item);
        ResolvedModel resolved = resolveOrBatchFallback(requestedModel(item));
        double prediction = roundToCents(Math.max(0.0, infer(resolved, features)));
        return BatchPredictionItem.success(prediction, resolved.identifier());
    }

    private TripRequest readTrip(JsonNode trip) {
        if (trip == null || !trip.isObject()) {
            String kind = trip == null ? "nothing" : trip.getNodeType().name().toLowerCase(Locale.ROOT);
            throw new PredictionFailedException("Trip must be a JSON object, got " + kind);
        }
        for (String field : REQUIRED_FIELDS) {
            if (!trip.hasNonNull(field)) {
                throw new MissingFieldException(field);
            }
        }
        try {
            return objectMapper.treeToValue(trip, TripRequest.class);
        } catch (JsonProcessingException ex) {
            throw new PredictionFailedException("Malformed trip attributes: " + ex.getOriginalMessage(), ex);
        }
    }

    private void requireFields(TripRequest request) {
        if (request.getPickupLatitude() == null) {
            throw new MissingFieldException("pickup_latitude");
        }
        if (request.getPickupLongitude() == null) {
            throw new MissingFieldException("pickup_longitude");
        }
        if (request.getDropoffLatitude() == null) {
            throw new MissingFieldException("dropoff_latitude");
        }
        if (request.getDropoffLongitude() == null) {
            throw new MissingFieldException("dropoff_longitude");
        }
        if (request.getPickupDatetime() == null) {
            throw new MissingFieldException("pickup_datetime");
        }
    }

    private String requestedModel(TripRequest request) {
        String model = request.getModel();
        return (model != null && !model.isBlank()) ? model : defaultModel;
    }

    private ResolvedModel resolveOrFirstAvailable(String requested, String requestId) {
        Optional<RegressionModel> model = modelRegistry.load(requested);
        if (model.isPresent()) {
            return new ResolvedModel(requested, model.get());
        }
        for (ModelDescriptor descriptor : modelRegistry.describeAll()) {
            if (!descriptor.isAvailable()) {
                continue;
            }
            Optional<RegressionModel> fallback = modelRegistry.load(descriptor.getIdentifier());
            if (fallback.isPresent()) {
                log.warn("Requested model unavailable, falling back | requested={} | using={} | requestId={}",
                         requested, descriptor.getIdentifier(), requestId);
                return new ResolvedModel(descriptor.getIdentifier(), fallback.get());
            }
        }
        log.error("No model artifacts available | modelDir={} | requestId={}",
                  modelRegistry.modelDirectory(), requestId);
        throw new NoModelAvailableException();
    }

    private ResolvedModel resolveOrBatchFallback(String requested) {
        Optional<RegressionModel> model = modelRegistry.load(requested);
        if (model.isPresent()) {
            return new ResolvedModel(requested, model.get());
        }
        return modelRegistry.load(BATCH_FALLBACK)
            .map(m -> new ResolvedModel(BATCH_FALLBACK.getIdentifier(), m))
            .orElseThrow(() -> new NoModelAvailableException(BATCH_FALLBACK.getIdentifier()));
    }

    private FeatureVector buildFeatures(TripRequest request) {
        return featureBuilder.build(
            request.getPickupLatitude(), request.getPickupLongitude(),
            request.getDropoffLatitude(), request.getDropoffLongitude(),
            request.getPickupDatetime());
    }

    private double infer(ResolvedModel resolved, FeatureVector features) {
        double estimate;
        try {
            estimate = resolved.model().predict(features.toArray());
        } catch (RuntimeException ex) {
            throw new PredictionFailedException(
                "Model '" + resolved.identifier() + "' failed to score the trip: " + ex.getMessage(), ex);
        }
        if (!Double.isFinite(estimate)) {
            throw new PredictionFailedException(
                "Model '" + resolved.identifier() + "' returned a non-finite estimate: " + estimate);
        }
        return estimate;
    }

    private static double roundToCents(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private record ResolvedModel(String identifier, RegressionModel model) {
    }
}
