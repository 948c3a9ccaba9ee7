package com.priceprediction.engine;

import com.priceprediction.dto.PropertyRequest;
import com.priceprediction.exception.StructuralException;
import com.priceprediction.reference.AutoFillStrategy;
import com.priceprediction.reference.FormRule;
import com.priceprediction.reference.FormRuleTable;
import com.priceprediction.reference.SizeRange;
import com.priceprediction.reference.SizeRangeTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a raw request into the complete field set the model needs, following
 * the field policy. Hidden fields are cleared; the validator reports values
 * supplied for them. Rejects Land with bedrooms and any required field that
 * has no default.
 */
public class RequestNormalizer {

    public static final String UNKNOWN_AREA = "unknown";

    private final SizeRangeTable sizeRanges;
    private final FormRuleTable formRules;

    public RequestNormalizer(SizeRangeTable sizeRanges, FormRuleTable formRules) {
        this.sizeRanges = sizeRanges;
        this.formRules = formRules;
    }

    public NormalizedRequest normalize(PropertyRequest request, FieldPolicy policy) {
        List<PredictionWarning> notes = new ArrayList<>();
        PropertyRequest.PropertyRequestBuilder builder = request.toBuilder();

        int bedrooms = resolveBedrooms(request, policy);
        builder.bedrooms(bedrooms);
        builder.areaSize(resolveAreaSize(request, policy, bedrooms, notes));

        if (policy.isRequired(PropertyField.SUBTYPE) && RequestFields.isMissing(request, PropertyField.SUBTYPE)) {
            throw new StructuralException("subtype is required for " + RequestFields.describe(request));
        }
        if (policy.isHidden(PropertyField.HAS_PARKING) || request.getHasParking() == null) {
            builder.hasParking(false);
        }
        if (policy.isHidden(PropertyField.HAS_PROJECT)) {
            builder.hasProject(false);
        } else if (request.getHasProject() == null) {
            builder.hasProject(true);
        }
        if (RequestFields.isMissing(request, PropertyField.AREA_NAME) || policy.isHidden(PropertyField.AREA_NAME)) {
            builder.areaName(UNKNOWN_AREA);
        } else {
            builder.areaName(request.getAreaName().trim());
        }
        if (request.getRegistrationType() == null) {
            builder.registrationType(formRules.registrationTypesFor(request.getType()).get(0));
        }
        return new NormalizedRequest(builder.build(), notes);
    }

    private int resolveBedrooms(PropertyRequest request, FieldPolicy policy) {
        Integer bedrooms = request.getBedrooms();
        if (policy.isHidden(PropertyField.BEDROOMS)) {
            if (request.getType() == PropertyType.LAND && bedrooms != null && bedrooms > 0) {
                throw new StructuralException("Land cannot have bedrooms");
            }
            return 0;
        }
        if (bedrooms == null) {
            if (policy.isRequired(PropertyField.BEDROOMS)) {
                throw new StructuralException("bedrooms is required for " + RequestFields.describe(request));
            }
            return 0;
        }
        return bedrooms;
    }

    private double resolveAreaSize(PropertyRequest request, FieldPolicy policy, int bedrooms,
                                   List<PredictionWarning> notes) {
        Double areaSize = request.getAreaSize();
        if (areaSize != null) {
            return areaSize;
        }
        if (policy.isAutoFilled(PropertyField.AREA_SIZE) && !policy.isHidden(PropertyField.BEDROOMS)
                && autoFillStrategy(request) == AutoFillStrategy.SIZE_RANGE_AVERAGE) {
            Optional<SizeRange> range = sizeRanges.forBedrooms(bedrooms);
            if (range.isPresent()) {
                double suggested = range.get().average();
                notes.add(PredictionWarning.of(WarningKind.AUTO_FILLED, String.format(
                    "area_size auto-filled with %s sqm, the average for %s",
                    RequestFields.plain(suggested), SizeRangeTable.bucketOf(bedrooms))));
                return suggested;
            }
        }
        throw new StructuralException("area_size is required and must be positive");
    }

    private AutoFillStrategy autoFillStrategy(PropertyRequest request) {
        return formRules.find(request.getUsage(), request.getType())
            .map(FormRule::autoFill)
            .map(fill -> fill.get(PropertyField.AREA_SIZE))
            .orElse(null);
    }
}
