package com.priceprediction.engine;

import com.priceprediction.dto.PropertyRequest;
import com.priceprediction.reference.ReferenceFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PropertyValidatorTest {

    private PropertyValidator validator;
    private FormDependencyResolver resolver;

    @BeforeEach
    void setUp() {
        validator = new PropertyValidator(ReferenceFixtures.sizeRanges(), ReferenceFixtures.subtypes());
        resolver = new FormDependencyResolver(ReferenceFixtures.formRules(), ReferenceFixtures.subtypes());
    }

    private List<PredictionWarning> validate(PropertyRequest request) {
        return validator.validate(request, resolver.resolve(request.getUsage(), request.getType(), request.getSubtype()));
    }

    @Test
    void validate_typicalFlat_hasNoWarnings() {
        assertThat(validate(ReferenceFixtures.flat(100, 2, "DUBAI MARINA"))).isEmpty();
    }

    @Test
    void validate_undersizedFlat_reportsSizeRange() {
        List<PredictionWarning> warnings = validate(ReferenceFixtures.flat(20, 2, "BUSINESS BAY"));

        assertThat(warnings).extracting(PredictionWarning::message)
            .containsExactly("area_size 20 below typical range [106,143] for 2BR");
        assertThat(warnings.get(0).kind()).isEqualTo(WarningKind.SIZE_RANGE);
    }

    @Test
    void validate_oversizedFlat_reportsAbove() {
        assertThat(validate(ReferenceFixtures.flat(250, 2, "DUBAI MARINA")))
            .extracting(PredictionWarning::message)
            .containsExactly("area_size 250 above typical range [106,143] for 2BR");
    }

    @Test
    void validate_sizeWithinTolerance_isAccepted() {
        // 2BR lower bound is 106 * 0.7 = 74.2
        assertThat(validate(ReferenceFixtures.flat(80, 2, "DUBAI MARINA"))).isEmpty();
    }

    @Test
    void validate_bucketWithoutRange_skipsSizeCheck() {
        assertThat(validate(ReferenceFixtures.flat(5000, 4, "DUBAI MARINA")))
            .extracting(PredictionWarning::kind)
            .doesNotContain(WarningKind.SIZE_RANGE);
    }

    @Test
    void validate_hiddenFieldSupplied_reportsFieldPolicy() {
        PropertyRequest land = ReferenceFixtures.residentialLand(500, null).toBuilder().hasParking(true).build();

        assertThat(validate(land)).containsExactly(PredictionWarning.of(WarningKind.FIELD_POLICY,
            "has_parking is not applicable to Residential Land and was ignored"));
    }

    @Test
    void validate_requiredFieldMissing_reportsFieldPolicy() {
        PropertyRequest villa = PropertyRequest.builder()
            .usage(PropertyUsage.RESIDENTIAL).type(PropertyType.VILLA).subtype("Villa")
            .areaSize(300.0).areaName("PALM JUMEIRAH").build();

        assertThat(validate(villa)).extracting(PredictionWarning::message)
            .containsExactly("bedrooms is required for Residential Villa");
    }

    @Test
    void validate_ordersPolicyThenSizeThenMismatch() {
        PropertyRequest request = ReferenceFixtures.flat(20, 2, "DUBAI MARINA").toBuilder().subtype("Villa").build();
        FieldPolicy policy = FieldPolicy.of(Map.of(PropertyField.HAS_PARKING, FieldRequirement.HIDDEN));

        List<PredictionWarning> warnings = validator.validate(request, policy);

        assertThat(warnings).extracting(PredictionWarning::kind).containsExactly(
            WarningKind.FIELD_POLICY, WarningKind.SIZE_RANGE, WarningKind.SIZE_RANGE, WarningKind.TYPE_MISMATCH);
        assertThat(warnings).extracting(PredictionWarning::message).containsExactly(
            "has_parking is not applicable to Residential Unit and was ignored",
            "area_size 20 below typical range [106,143] for 2BR",
            "Villa typically ranges 120-2500 sqm",
            "subtype 'Villa' is not a known Unit subtype");
    }

    @Test
    void validate_landWithBedrooms_reportsMismatch() {
        assertThat(validator.validate(ReferenceFixtures.residentialLand(500, 3), FieldPolicy.permissive()))
            .extracting(PredictionWarning::message)
            .contains("Land cannot have bedrooms");
    }

    @Test
    void validate_atypicalBedroomCount_reportsMismatch() {
        PropertyRequest villa = PropertyRequest.builder()
            .usage(PropertyUsage.RESIDENTIAL).type(PropertyType.VILLA).subtype("Villa")
            .areaSize(60.0).bedrooms(1).build();

        assertThat(validate(villa)).extracting(PredictionWarning::message)
            .containsExactly("Villa typically ranges 120-2500 sqm", "Villa typically has 2-7 bedrooms");
    }

    @Test
    void validate_flatBelowSubtypeSize_reportsSizeRangeOnly() {
        List<PredictionWarning> warnings = validate(ReferenceFixtures.flat(12, 1, "DUBAI MARINA"));

        assertThat(warnings).extracting(PredictionWarning::kind).containsOnly(WarningKind.SIZE_RANGE);
        assertThat(warnings).extracting(PredictionWarning::message).contains("Flat typically ranges 15-700 sqm");
    }

    @Test
    void validate_hiddenBedroomsSupplied_reportsFieldPolicy() {
        PropertyRequest shop = PropertyRequest.builder()
            .usage(PropertyUsage.COMMERCIAL).type(PropertyType.UNIT).subtype("Shop")
            .areaSize(80.0).bedrooms(1).build();

        assertThat(validate(shop)).extracting(PredictionWarning::kind).containsExactly(WarningKind.FIELD_POLICY);
        assertThat(validate(shop)).extracting(PredictionWarning::message)
            .containsExactly("bedrooms is not applicable to Commercial Unit and was ignored");
    }

    @Test
    void validate_doesNotChangeRequest() {
        PropertyRequest request = ReferenceFixtures.flat(20, 2, "BUSINESS BAY");
        PropertyRequest copy = request.toBuilder().build();

        validate(request);

        assertThat(request).isEqualTo(copy);
    }
}
