package dev.devanks.propcast.worker.scoring;

import dev.devanks.propcast.worker.exception.ModelArtifactException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinearScoringModelTest {

    private static LinearModelDefinition definition(Double min, Double max) {
        LinearModelDefinition definition = new LinearModelDefinition();
        definition.setModelVersion("v1");
        definition.setIntercept(2.0);
        definition.setWeights(new LinkedHashMap<>(Map.of("points_avg_last_5", 0.5, "back_to_back", -3.0)));
        definition.setMinPrediction(min);
        definition.setMaxPrediction(max);
        return definition;
    }

    @Test
    @DisplayName("Should add weighted features to the intercept and ignore unset ones")
    void score_weightedSum() {
        LinearScoringModel model = new LinearScoringModel("m.json", definition(null, null));

        assertThat(model.score(Map.of("points_avg_last_5", 20.0, "back_to_back", 1.0))).isEqualTo(9.0);

        Map<String, Double> partial = new HashMap<>();
        partial.put("points_avg_last_5", 20.0);
        partial.put("back_to_back", null);
        assertThat(model.score(partial)).isEqualTo(12.0);
    }

    @Test
    @DisplayName("Should clamp the score to the artifact's range")
    void score_clamped() {
        LinearScoringModel model = new LinearScoringModel("m.json", definition(0.0, 10.0));

        assertThat(model.score(Map.of("points_avg_last_5", 40.0, "back_to_back", 0.0))).isEqualTo(10.0);
        assertThat(model.score(Map.of("points_avg_last_5", 0.0, "back_to_back", 1.0))).isZero();
    }

    @Test
    @DisplayName("Should reject artifacts without version or weights, or with an empty clamp range")
    void constructor_rejectsInvalidArtifacts() {
        LinearModelDefinition noVersion = definition(null, null);
        noVersion.setModelVersion(" ");
        LinearModelDefinition noWeights = definition(null, null);
        noWeights.setWeights(new LinkedHashMap<>());

        assertThatThrownBy(() -> new LinearScoringModel("m.json", noVersion)).isInstanceOf(ModelArtifactException.class);
        assertThatThrownBy(() -> new LinearScoringModel("m.json", noWeights)).isInstanceOf(ModelArtifactException.class);
        assertThatThrownBy(() -> new LinearScoringModel("m.json", definition(10.0, 0.0)))
                .isInstanceOf(ModelArtifactException.class);
    }

    @Test
    @DisplayName("Should list weighted features missing from the schema")
    void unknownFeatures_schemaMissingWeights_listed() {
        LinearScoringModel model = new LinearScoringModel("m.json", definition(null, null));

        assertThat(model.unknownFeatures(List.of("points_avg_last_5"))).containsExactly("back_to_back");
        assertThat(model.unknownFeatures(List.of("points_avg_last_5", "back_to_back"))).isEmpty();
    }
}
