package com.farepredict.service;

import com.farepredict.dto.ModelDescriptor;
import com.farepredict.exception.ModelLoadException;
import com.farepredict.model.LinearRegressionModel;
import com.farepredict.model.ModelArtifactLoader;
import com.farepredict.model.ModelType;
import com.farepredict.model.RegressionModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelRegistryServiceTest {

    @TempDir Path modelDir;

    @Mock ModelArtifactLoader artifactLoader;
    @InjectMocks ModelRegistryService registry;

    private final RegressionModel linear = LinearRegressionModel.builder()
        .intercept(1.0).coefficients(new double[16]).build();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(registry, "modelDir", modelDir.toString());
    }

    private Path placeArtifact(ModelType type) throws IOException {
        return Files.writeString(modelDir.resolve(type.artifactFileName()), "{}");
    }

    @Test
    void load_missingArtifact_returnsEmptyWithoutLoading() {
        assertThat(registry.load("random_forest")).isEmpty();
        verifyNoInteractions(artifactLoader);
    }

    @Test
    void load_unknownIdentifier_returnsEmptyWithoutTouchingDisk() throws IOException {
        Files.writeString(modelDir.resolve("svm_model.json"), "{}");

        assertThat(registry.load("svm")).isEmpty();
        assertThat(registry.load((String) null)).isEmpty();
        verifyNoInteractions(artifactLoader);
    }

    @Test
    void load_cachesFirstSuccessfulLoad() throws IOException {
        Path artifact = placeArtifact(ModelType.LINEAR_REGRESSION);
        when(artifactLoader.load(artifact)).thenReturn(linear);

        assertThat(registry.load("linear_regression")).containsSame(linear);
        assertThat(registry.load(ModelType.LINEAR_REGRESSION)).containsSame(linear);
        verify(artifactLoader, times(1)).load(any());
    }

    @Test
    void load_cachedModelSurvivesArtifactRemoval() throws IOException {
        Path artifact = placeArtifact(ModelType.LINEAR_REGRESSION);
        when(artifactLoader.load(artifact)).thenReturn(linear);
        registry.load("linear_regression");

        Files.delete(artifact);

        assertThat(registry.load("linear_regression")).containsSame(linear);
        assertThat(registry.availableCount()).isZero();
    }

    @Test
    void load_missIsNotCached_artifactAddedLaterIsPickedUp() throws IOException {
        assertThat(registry.load("xgboost")).isEmpty();

        Path artifact = placeArtifact(ModelType.XGBOOST);
        when(artifactLoader.load(artifact)).thenReturn(linear);

        assertThat(registry.load("xgboost")).contains(linear);
    }

    @Test
    void load_failedLoadLeavesNoEntryAndIsRetried() throws IOException {
        Path artifact = placeArtifact(ModelType.DECISION_TREE);
        when(artifactLoader.load(artifact))
            .thenThrow(new ModelLoadException(artifact, new IOException("truncated")))
            .thenReturn(linear);

        assertThatThrownBy(() -> registry.load("decision_tree"))
            .isInstanceOf(ModelLoadException.class)
            .hasMessageContaining("truncated");
        assertThat(registry.load("decision_tree")).contains(linear);
        verify(artifactLoader, times(2)).load(artifact);
    }

    @Test
    void load_concurrentFirstLoads_readArtifactOnce() throws Exception {
        Path artifact = placeArtifact(ModelType.RANDOM_FOREST);
        when(artifactLoader.load(artifact)).thenAnswer(inv -> {
            Thread.sleep(50);
            return LinearRegressionModel.builder().intercept(2.0).coefficients(new double[16]).build();
        });

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<RegressionModel>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                Callable<Optional<RegressionModel>> task = () -> {
                    start.await();
                    return registry.load("random_forest");
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            RegressionModel first = futures.get(0).get(5, TimeUnit.SECONDS).orElseThrow();
            for (Future<Optional<RegressionModel>> f : futures) {
                assertThat(f.get(5, TimeUnit.SECONDS)).containsSame(first);
            }
        } finally {
            pool.shutdownNow();
        }
        verify(artifactLoader, times(1)).load(artifact);
    }

    @Test
    void describeAll_listsAllModelsInFixedOrderWithLiveAvailability() throws IOException {
        assertThat(registry.describeAll()).extracting(ModelDescriptor::isAvailable)
            .containsExactly(false, false, false, false);

        placeArtifact(ModelType.DECISION_TREE);
        placeArtifact(ModelType.XGBOOST);

        List<ModelDescriptor> models = registry.describeAll();
        assertThat(models).extracting(ModelDescriptor::getIdentifier)
            .containsExactly("linear_regression", "decision_tree", "random_forest", "xgboost");
        assertThat(models).extracting(ModelDescriptor::isAvailable)
            .containsExactly(false, true, false, true);
        assertThat(models.get(2).getFile()).isEqualTo("random_forest_model.json");
        assertThat(models.get(2).getMetrics()).containsEntry("RMSE", "$3.42").containsEntry("R²", "0.91");
        assertThat(registry.availableCount()).isEqualTo(2);
        verifyNoInteractions(artifactLoader);
    }

    @Test
    void directoryInPlaceOfArtifact_isNotAvailable() throws IOException {
        Files.createDirectory(modelDir.resolve(ModelType.XGBOOST.artifactFileName()));

        assertThat(registry.load("xgboost")).isEmpty();
        assertThat(registry.availableCount()).isZero();
    }
}
