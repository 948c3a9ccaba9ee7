package com.priceprediction.engine;

import com.priceprediction.dto.PropertyRequest;
import com.priceprediction.reference.SizeRange;
import com.priceprediction.reference.SizeRangeTable;
import com.priceprediction.reference.SubtypeCatalog;
import com.priceprediction.reference.SubtypeProfile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Advisory checks of a request against its field policy and the observed
 * size and subtype data. Never blocks a prediction and never mutates the
 * request. Warnings are ordered: field policy, then size range, then mismatch.
 */
public class PropertyValidator {

    private final SizeRangeTable sizeRanges;
    private final SubtypeCatalog subtypes;

    public PropertyValidator(SizeRangeTable sizeRanges, SubtypeCatalog subtypes) {
        this.sizeRanges = sizeRanges;
        this.subtypes = subtypes;
    }

    public List<PredictionWarning> validate(PropertyRequest request, FieldPolicy policy) {
        List<PredictionWarning> warnings = new ArrayList<>();
        checkFieldPolicy(request, policy, warnings);
        checkSizeRange(request, policy, warnings);
        checkTypeMismatch(request, policy, warnings);
        return List.copyOf(warnings);
    }

    private void checkFieldPolicy(PropertyRequest request, FieldPolicy policy, List<PredictionWarning> warnings) {
        for (PropertyField field : PropertyField.values()) {
            if (policy.isHidden(field) && RequestFields.isSupplied(request, field)) {
                warnings.add(PredictionWarning.of(WarningKind.FIELD_POLICY,
                    field.getWireName() + " is not applicable to " + RequestFields.describe(request)
                        + " and was ignored"));
            } else if (policy.isRequired(field) && RequestFields.isMissing(request, field)) {
                warnings.add(PredictionWarning.of(WarningKind.FIELD_POLICY,
                    field.getWireName() + " is required for " + RequestFields.describe(request)));
            }
        }
    }

    private void checkSizeRange(PropertyRequest request, FieldPolicy policy, List<PredictionWarning> warnings) {
        Double areaSize = request.getAreaSize();
        if (areaSize == null || !(areaSize > 0)) {
            return;
        }
        checkBedroomSizeRange(request, policy, areaSize, warnings);

        Optional<SubtypeProfile> profile = subtypes.profile(request.getSubtype());
        if (profile.isEmpty() || !profile.get().hasSizeRange()) {
            return;
        }
        SubtypeProfile p = profile.get();
        if (areaSize < p.minSize() || areaSize > p.maxSize()) {
            warnings.add(PredictionWarning.of(WarningKind.SIZE_RANGE, String.format(
                "%s typically ranges %s-%s sqm", p.name(),
                RequestFields.plain(p.minSize()), RequestFields.plain(p.maxSize()))));
        }
    }

    private void checkBedroomSizeRange(PropertyRequest request, FieldPolicy policy, double areaSize,
                                       List<PredictionWarning> warnings) {
        Integer bedrooms = request.getBedrooms();
        if (policy.isHidden(PropertyField.BEDROOMS) || bedrooms == null || bedrooms < 0) {
            return;
        }
        Optional<SizeRange> range = sizeRanges.forBedrooms(bedrooms);
        if (range.isEmpty()) {
            return;
        }
        SizeRange r = range.get();
        String direction = null;
        if (sizeRanges.isBelowTypical(r, areaSize)) {
            direction = "below";
        } else if (sizeRanges.isAboveTypical(r, areaSize)) {
            direction = "above";
        }
        if (direction != null) {
            warnings.add(PredictionWarning.of(WarningKind.SIZE_RANGE, String.format(
                "area_size %s %s typical range [%s,%s] for %s",
                RequestFields.plain(areaSize), direction,
                RequestFields.plain(r.minTypical()), RequestFields.plain(r.maxTypical()),
                SizeRangeTable.bucketOf(bedrooms))));
        }
    }

    private void checkTypeMismatch(PropertyRequest request, FieldPolicy policy, List<PredictionWarning> warnings) {
        PropertyType type = request.getType();
        String subtype = request.getSubtype();
        Integer bedrooms = request.getBedrooms();

        if (type == PropertyType.LAND && bedrooms != null && bedrooms > 0) {
            warnings.add(PredictionWarning.of(WarningKind.TYPE_MISMATCH, "Land cannot have bedrooms"));
        }
        if (type != null && subtype != null && !subtype.isBlank() && !subtypes.isKnownFor(type, subtype)) {
            warnings.add(PredictionWarning.of(WarningKind.TYPE_MISMATCH,
                "subtype '" + subtype + "' is not a known " + type.getLabel() + " subtype"));
        }

        Optional<SubtypeProfile> profile = subtypes.profile(subtype);
        if (profile.isEmpty()) {
            return;
        }
        SubtypeProfile p = profile.get();
        List<Integer> typical = p.typicalBedrooms();
        if (!policy.isHidden(PropertyField.BEDROOMS) && bedrooms != null
                && !typical.isEmpty() && !typical.contains(bedrooms)) {
            warnings.add(PredictionWarning.of(WarningKind.TYPE_MISMATCH, String.format(
                "%s typically has %d-%d bedrooms", p.name(), Collections.min(typical), Collections.max(typical))));
        }
    }
}
