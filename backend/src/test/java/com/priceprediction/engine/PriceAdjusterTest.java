package com.priceprediction.engine;

import com.priceprediction.exception.ComputationException;
import com.priceprediction.reference.AreaTier;
import com.priceprediction.reference.ReferenceFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PriceAdjusterTest {

    private PriceAdjuster adjuster;

    @BeforeEach
    void setUp() {
        adjuster = new PriceAdjuster(new AreaTierLookup(ReferenceFixtures.areaTiers()));
    }

    @Test
    void adjust_appliesMultiplierAndPerUnitPrice() {
        PriceAdjustment adjustment = adjuster.adjust(1_745_000, 1.2, 100, List.of());

        assertThat(adjustment.adjustedPrice()).isCloseTo(2_094_000, within(1e-6));
        assertThat(adjustment.pricePerUnitArea()).isCloseTo(20_940, within(1e-6));
        assertThat(adjustment.basePrice()).isEqualTo(1_745_000);
        assertThat(adjustment.confidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
    }

    @Test
    void adjust_doesNotRound() {
        PriceAdjustment adjustment = adjuster.adjust(1_000_001, 0.9, 3, List.of());

        assertThat(adjustment.adjustedPrice()).isCloseTo(900_000.9, within(1e-6));
        assertThat(adjustment.pricePerUnitArea()).isCloseTo(300_000.3, within(1e-6));
    }

    @Test
    void adjust_nonPositiveArea_throws() {
        assertThatThrownBy(() -> adjuster.adjust(1_000_000, 1.0, 0, List.of()))
            .isInstanceOf(ComputationException.class)
            .hasMessageContaining("area_size");
        assertThatThrownBy(() -> adjuster.adjust(1_000_000, 1.0, -5, List.of()))
            .isInstanceOf(ComputationException.class);
    }

    @Test
    void adjust_nonFiniteBase_throws() {
        assertThatThrownBy(() -> adjuster.adjust(Double.NaN, 1.0, 100, List.of()))
            .isInstanceOf(ComputationException.class);
    }

    @Test
    void lookup_isCaseInsensitiveAndTrimmed() {
        AreaTierMatch match = adjuster.lookup("  dubai Marina ");

        assertThat(match.tier()).isEqualTo(AreaTier.PREMIUM);
        assertThat(match.multiplier()).isEqualTo(1.2);
        assertThat(match.matched()).isTrue();
    }

    @Test
    void lookup_unknownOrMissingArea_fallsBackToAverage() {
        for (String name : new String[] {"UNKNOWN AREA", "", null}) {
            AreaTierMatch match = adjuster.lookup(name);
            assertThat(match.tier()).isEqualTo(AreaTier.AVERAGE);
            assertThat(match.multiplier()).isEqualTo(1.0);
            assertThat(match.matched()).isFalse();
        }
    }

    @Test
    void confidence_gradesBySeverity() {
        PredictionWarning size = PredictionWarning.of(WarningKind.SIZE_RANGE, "size");
        PredictionWarning mismatch = PredictionWarning.of(WarningKind.TYPE_MISMATCH, "mismatch");

        assertThat(PriceAdjuster.confidenceFor(List.of())).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(PriceAdjuster.confidenceFor(List.of(size))).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(PriceAdjuster.confidenceFor(List.of(size, mismatch))).isEqualTo(ConfidenceLevel.LOW);
    }

    @Test
    void confidence_sizeWarningNeverUpgrades() {
        List<List<PredictionWarning>> cases = List.of(
            List.of(),
            List.of(PredictionWarning.of(WarningKind.UNKNOWN_AREA, "a")),
            List.of(PredictionWarning.of(WarningKind.FIELD_POLICY, "b")),
            List.of(PredictionWarning.of(WarningKind.TYPE_MISMATCH, "c"), PredictionWarning.of(WarningKind.AUTO_FILLED, "d")));

        for (List<PredictionWarning> warnings : cases) {
            List<PredictionWarning> withSize = new ArrayList<>(warnings);
            withSize.add(PredictionWarning.of(WarningKind.SIZE_RANGE, "size"));

            ConfidenceLevel before = PriceAdjuster.confidenceFor(warnings);
            ConfidenceLevel after = PriceAdjuster.confidenceFor(withSize);
            assertThat(after).isNotEqualTo(ConfidenceLevel.HIGH);
            assertThat(after.ordinal()).isGreaterThanOrEqualTo(before.ordinal());
        }
    }
}
