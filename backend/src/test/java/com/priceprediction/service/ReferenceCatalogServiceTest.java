package com.priceprediction.service;

import com.priceprediction.client.LabelFeatureEncoder;
import com.priceprediction.dto.AreaListResponse;
import com.priceprediction.dto.FormPolicyResponse;
import com.priceprediction.dto.ReloadResponse;
import com.priceprediction.dto.SizeSuggestionResponse;
import com.priceprediction.engine.FieldRequirement;
import com.priceprediction.engine.PredictionOrchestrator;
import com.priceprediction.engine.PriceModel;
import com.priceprediction.engine.PropertyType;
import com.priceprediction.engine.RegistrationType;
import com.priceprediction.exception.SizeRangeNotFoundException;
import com.priceprediction.reference.AreaTier;
import com.priceprediction.reference.ReferenceData;
import com.priceprediction.reference.ReferenceFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReferenceCatalogServiceTest {

    @Mock PredictionEngineRegistry registry;
    @Mock PriceModel               priceModel;
    @InjectMocks ReferenceCatalogService service;

    private ReferenceData data;

    @BeforeEach
    void setUp() {
        data = ReferenceFixtures.referenceData();
        PredictionOrchestrator orchestrator = PredictionOrchestrator.create(
            data, new LabelFeatureEncoder(data.getVocabulary()), priceModel, true);
        lenient().when(registry.current()).thenReturn(new PredictionEngineRegistry.EngineSnapshot(data, orchestrator));
    }

    @Test
    void formPolicy_land_hidesBedroomsAndOffersExistingOnly() {
        FormPolicyResponse resp = service.formPolicy("Residential", "Land", null);

        assertThat(resp.isMatchedRule()).isTrue();
        assertThat(resp.getFields()).containsEntry("bedrooms", FieldRequirement.HIDDEN)
            .containsEntry("has_parking", FieldRequirement.HIDDEN)
            .containsEntry("area_size", FieldRequirement.REQUIRED);
        assertThat(resp.getRegistrationTypeOptions()).containsExactly(RegistrationType.EXISTING);
        assertThat(resp.getPropertyTypeOptions())
            .containsExactly(PropertyType.UNIT, PropertyType.VILLA, PropertyType.LAND);
    }

    @Test
    void formPolicy_residentialUnit_filtersSubtypesByUsage() {
        FormPolicyResponse resp = service.formPolicy("residential", "unit", "Flat");

        assertThat(resp.getSubtypeOptions()).containsExactly("Flat");
        assertThat(resp.getFields()).containsEntry("area_size", FieldRequirement.AUTO_FILLED);
    }

    @Test
    void formPolicy_unknownUsage_throws() {
        assertThatThrownBy(() -> service.formPolicy("Spaceport", "Unit", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Spaceport");
    }

    @Test
    void sizeSuggestion_returnsRangeAndWarningBounds() {
        SizeSuggestionResponse resp = service.sizeSuggestion(2);

        assertThat(resp.getBucket()).isEqualTo("2BR");
        assertThat(resp.getAverage()).isEqualTo(124.0);
        assertThat(resp.getLowerWarningBound()).isEqualTo(74.2);
        assertThat(resp.getUpperWarningBound()).isEqualTo(214.5);
    }

    @Test
    void sizeSuggestion_unknownBucket_throwsNotFound() {
        assertThatThrownBy(() -> service.sizeSuggestion(9)).isInstanceOf(SizeRangeNotFoundException.class);
    }

    @Test
    void areas_areSortedFromMostExpensiveTier() {
        AreaListResponse resp = service.areas();

        assertThat(resp.getTotalAreas()).isEqualTo(6);
        assertThat(resp.getAreas().get(0).getName()).isEqualTo("PALM JUMEIRAH");
        assertThat(resp.getAreas().get(resp.getAreas().size() - 1).getTier()).isEqualTo(AreaTier.BUDGET);
    }

    @Test
    void reload_reportsNewSnapshot() {
        when(registry.reload()).thenReturn(data);

        ReloadResponse resp = service.reload("req-9");

        assertThat(resp.getAreaCount()).isEqualTo(6);
        assertThat(resp.getSizeBuckets()).isEqualTo(4);
        assertThat(resp.getFormRules()).isEqualTo(4);
        assertThat(resp.getLoadedAt()).isEqualTo(data.getLoadedAt());
    }
}
