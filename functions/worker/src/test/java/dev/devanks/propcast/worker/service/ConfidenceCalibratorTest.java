package dev.devanks.propcast.worker.service;

import dev.devanks.propcast.shared.model.SampleQuality;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceCalibratorTest {

    private final ConfidenceCalibrator calibrator = new ConfidenceCalibrator();

    @Test
    @DisplayName("Should discount the quality score by the sample tier")
    void calibrate_discountsByTier() {
        assertThat(calibrator.calibrate(90.0, SampleQuality.EXCELLENT)).isEqualTo(0.9);
        assertThat(calibrator.calibrate(90.0, SampleQuality.GOOD)).isEqualTo(0.81);
        assertThat(calibrator.calibrate(80.0, SampleQuality.LIMITED)).isEqualTo(0.6);
        assertThat(calibrator.calibrate(80.0, SampleQuality.INSUFFICIENT)).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Should keep confidence within [0, 1] for out-of-range scores")
    void calibrate_clamps() {
        assertThat(calibrator.calibrate(140.0, SampleQuality.EXCELLENT)).isEqualTo(1.0);
        assertThat(calibrator.calibrate(-5.0, SampleQuality.EXCELLENT)).isZero();
    }
}
