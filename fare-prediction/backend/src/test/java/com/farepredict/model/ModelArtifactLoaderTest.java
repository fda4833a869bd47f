package com.farepredict.model;

import com.farepredict.exception.ModelLoadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ModelArtifactLoaderTest {

    @TempDir Path dir;

    private final ModelArtifactLoader loader = new ModelArtifactLoader(new ObjectMapper());

    private Path fixture(ModelType type) throws IOException {
        Path target = dir.resolve(type.artifactFileName());
        try (InputStream in = getClass().getResourceAsStream("/models/" + type.artifactFileName())) {
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void load_readsEveryKindFromItsTypeProperty() throws IOException {
        assertThat(loader.load(fixture(ModelType.LINEAR_REGRESSION))).isInstanceOf(LinearRegressionModel.class);
        assertThat(loader.load(fixture(ModelType.DECISION_TREE))).isInstanceOf(DecisionTreeModel.class);
        assertThat(loader.load(fixture(ModelType.RANDOM_FOREST))).isInstanceOf(RandomForestModel.class);
        assertThat(loader.load(fixture(ModelType.XGBOOST))).isInstanceOf(GradientBoostedTreesModel.class);
    }

    @Test
    void load_mapsSnakeCaseBaseScore() throws IOException {
        GradientBoostedTreesModel model = (GradientBoostedTreesModel) loader.load(fixture(ModelType.XGBOOST));
        assertThat(model.getBaseScore()).isEqualTo(10.0);
        assertThat(model.getTrees()).hasSize(2);
    }

    @Test
    void load_malformedJson_throwsModelLoadException() throws IOException {
        Path artifact = Files.writeString(dir.resolve("linear_regression_model.json"), "{ not json");

        assertThatThrownBy(() -> loader.load(artifact))
            .isInstanceOf(ModelLoadException.class)
            .hasMessageContaining("linear_regression_model.json");
    }

    @Test
    void load_unknownType_throwsModelLoadException() throws IOException {
        Path artifact = Files.writeString(dir.resolve("xgboost_model.json"), "{\"type\":\"svm\"}");

        assertThatThrownBy(() -> loader.load(artifact))
            .isInstanceOf(ModelLoadException.class);
    }

    @Test
    void load_wrongCoefficientCount_throwsModelLoadException() throws IOException {
        Path artifact = Files.writeString(dir.resolve("linear_regression_model.json"),
            "{\"type\":\"linear_regression\",\"intercept\":1.0,\"coefficients\":[1.0,2.0]}");

        assertThatThrownBy(() -> loader.load(artifact))
            .isInstanceOf(ModelLoadException.class)
            .hasMessageContaining("16 coefficients")
            .hasFieldOrPropertyWithValue("errorCode", "MODEL_LOAD_FAILED");
    }
}
