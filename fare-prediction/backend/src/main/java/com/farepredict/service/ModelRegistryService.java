package com.farepredict.service;

import com.farepredict.dto.ModelDescriptor;
import com.farepredict.model.ModelArtifactLoader;
import com.farepredict.model.ModelType;
import com.farepredict.model.RegressionModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog of the servable models and owner of every loaded instance.
 * <p>
 * Loaded models are cached for the life of the process and never evicted. Misses are not
 * cached, so an artifact that appears on disk later is picked up by the next load.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    private final ModelArtifactLoader artifactLoader;
    private final ConcurrentHashMap<ModelType, RegressionModel> loaded = new ConcurrentHashMap<>();

    @Value("${fare.models.dir:models}")
    private String modelDir;

    /**
     * Unknown identifiers are never looked up on disk.
     *
     * @return the cached or freshly loaded model, or empty if its artifact is absent
     * @throws com.farepredict.exception.ModelLoadException if the artifact exists but cannot be read
     */
    public Optional<RegressionModel> load(String identifier) {
        Optional<ModelType> type = ModelType.fromIdentifier(identifier);
        if (type.isEmpty()) {
            log.warn("Unknown model requested | identifier={}", identifier);
            return Optional.empty();
        }
        return load(type.get());
    }

    public Optional<RegressionModel> load(ModelType type) {
        RegressionModel cached = loaded.get(type);
        if (cached != null) {
            log.debug("Model cache hit | model={}", type.getIdentifier());
            return Optional.of(cached);
        }
        // the artifact is read inside the mapping function; concurrent first loads of one model wait for it
        return Optional.ofNullable(loaded.computeIfAbsent(type, this::loadFromDisk));
    }

    public List<ModelDescriptor> describeAll() {
        return Arrays.stream(ModelType.values())
            .map(this::describe)
            .toList();
    }

    public long availableCount() {
        return describeAll().stream().filter(ModelDescriptor::isAvailable).count();
    }

    public Path modelDirectory() {
        return Paths.get(modelDir).toAbsolutePath().normalize();
    }

    public Path artifactPath(ModelType type) {
        return modelDirectory().resolve(type.artifactFileName());
    }

    private RegressionModel loadFromDisk(ModelType type) {
        Path artifact = artifactPath(type);
        if (!Files.isRegularFile(artifact)) {
            log.debug("Model artifact missing | model={} | path={}", type.getIdentifier(), artifact);
            return null;
        }
        RegressionModel model = artifactLoader.load(artifact);
        log.info("Model cached | model={}", type.getIdentifier());
        return model;
    }

    private ModelDescriptor describe(ModelType type) {
        Map<String, String> metrics = new LinkedHashMap<>();
        metrics.put("RMSE", type.getRmse());
        metrics.put("R²", type.getR2());
        return ModelDescriptor.builder()
            .identifier(type.getIdentifier())
            .file(type.artifactFileName())
            .available(Files.isRegularFile(artifactPath(type)))
            .metrics(metrics)
            .build();
    }
}
