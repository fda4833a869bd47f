package com.farepredict.model;

import com.farepredict.exception.ModelLoadException;
import com.farepredict.feature.FeatureVector;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a model artifact from disk. Artifacts are never written by this service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelArtifactLoader {

    private final ObjectMapper objectMapper;

    public RegressionModel load(Path artifact) {
        long started = System.nanoTime();
        RegressionModel model;
        try {
            model = objectMapper.readValue(artifact.toFile(), RegressionModel.class);
        } catch (IOException ex) {
            throw new ModelLoadException(artifact, ex);
        }
        if (model == null) {
            throw new ModelLoadException(artifact, new IOException("artifact is empty"));
        }
        try {
            model.validate(FeatureVector.SIZE);
        } catch (IllegalArgumentException ex) {
            throw new ModelLoadException(artifact, ex);
        }
        log.info("Model artifact loaded | file={} | kind={} | tookMs={}",
                 artifact.getFileName(), model.getClass().getSimpleName(),
                 (System.nanoTime() - started) / 1_000_000);
        return model;
    }
}
