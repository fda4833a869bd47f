package com.farepredict.config;

import com.farepredict.dto.ModelDescriptor;
import com.farepredict.model.ModelType;
import com.farepredict.service.ModelRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Logs which model artifacts are present once the application is ready to serve.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelStatusReporter {

    private final ModelRegistryService modelRegistry;

    @EventListener(ApplicationReadyEvent.class)
    public void reportModelStatus() {
        List<ModelDescriptor> models = modelRegistry.describeAll();
        long available = models.stream().filter(ModelDescriptor::isAvailable).count();

        log.info("Model status | dir={}", modelRegistry.modelDirectory());
        for (ModelDescriptor model : models) {
            log.info("  {} {}: {}", model.isAvailable() ? "✓" : "✗", model.getIdentifier(), model.getFile());
        }
        ModelType best = Arrays.stream(ModelType.values())
            .max(Comparator.comparingDouble(t -> Double.parseDouble(t.getR2())))
            .orElseThrow();
        log.info("Models available: {}/{} | best={} (R² = {})",
                 available, models.size(), best.getIdentifier(), best.getR2());
        if (available == 0) {
            log.warn("No model artifacts found; predictions will fail until one is added to {}",
                     modelRegistry.modelDirectory());
        }
    }
}
