package com.priceprediction.service;

import com.priceprediction.dto.AreaListResponse;
import com.priceprediction.dto.FormPolicyResponse;
import com.priceprediction.dto.PropertyTypesResponse;
import com.priceprediction.dto.RegistrationTypesResponse;
import com.priceprediction.dto.ReloadResponse;
import com.priceprediction.dto.SizeSuggestionResponse;
import com.priceprediction.dto.ValidationRulesResponse;
import com.priceprediction.engine.FieldPolicy;
import com.priceprediction.engine.FieldRequirement;
import com.priceprediction.engine.PropertyField;
import com.priceprediction.engine.PropertyType;
import com.priceprediction.engine.PropertyUsage;
import com.priceprediction.engine.RegistrationType;
import com.priceprediction.exception.SizeRangeNotFoundException;
import com.priceprediction.reference.AreaTierEntry;
import com.priceprediction.reference.ReferenceData;
import com.priceprediction.reference.SizeRange;
import com.priceprediction.reference.SizeRangeTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Read-only views of the reference data that drive the property form. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceCatalogService {

    private final PredictionEngineRegistry registry;

    public FormPolicyResponse formPolicy(String usageLabel, String typeLabel, String subtype) {
        PropertyUsage usage = PropertyUsage.fromLabel(usageLabel);
        PropertyType type = PropertyType.fromLabel(typeLabel);
        PredictionEngineRegistry.EngineSnapshot snapshot = registry.current();
        ReferenceData data = snapshot.data();
        FieldPolicy policy = snapshot.orchestrator().resolver().resolve(usage, type, subtype);

        Map<String, FieldRequirement> fields = new LinkedHashMap<>();
        for (PropertyField field : PropertyField.values()) {
            fields.put(field.getWireName(), policy.requirement(field));
        }
        return FormPolicyResponse.builder()
            .usage(usage)
            .type(type)
            .subtype(subtype)
            .matchedRule(policy.isMatchedRule())
            .fields(fields)
            .propertyTypeOptions(data.getFormRules().typesFor(usage))
            .subtypeOptions(data.getSubtypes().optionsFor(usage, type))
            .registrationTypeOptions(data.getFormRules().registrationTypesFor(type))
            .build();
    }

    public SizeSuggestionResponse sizeSuggestion(int bedrooms) {
        SizeRangeTable table = registry.current().data().getSizeRanges();
        SizeRange range = table.forBedrooms(bedrooms)
            .orElseThrow(() -> new SizeRangeNotFoundException(bedrooms));
        return SizeSuggestionResponse.builder()
            .bedrooms(bedrooms)
            .bucket(SizeRangeTable.bucketOf(bedrooms))
            .minTypical(range.minTypical())
            .maxTypical(range.maxTypical())
            .average(range.average())
            .median(range.median())
            .lowerWarningBound(PriceFormat.round2(range.minTypical() * table.lowerTolerance()))
            .upperWarningBound(PriceFormat.round2(range.maxTypical() * table.upperTolerance()))
            .build();
    }

    public AreaListResponse areas() {
        List<AreaListResponse.Area> areas = registry.current().data().getAreaTiers().entries().stream()
            .sorted(Comparator.comparing(AreaTierEntry::tier).thenComparing(AreaTierEntry::areaName))
            .map(e -> AreaListResponse.Area.builder()
                .name(e.areaName()).tier(e.tier()).multiplier(e.multiplier()).build())
            .toList();
        return AreaListResponse.builder().totalAreas(areas.size()).areas(areas).build();
    }

    public PropertyTypesResponse propertyTypes() {
        ReferenceData data = registry.current().data();
        Map<String, List<PropertyType>> typesByUsage = new LinkedHashMap<>();
        for (PropertyUsage usage : PropertyUsage.values()) {
            typesByUsage.put(usage.getLabel(), data.getFormRules().typesFor(usage));
        }
        Map<String, List<String>> subtypesByType = new LinkedHashMap<>();
        for (PropertyType type : PropertyType.values()) {
            subtypesByType.put(type.getLabel(), data.getSubtypes().subtypesByType().getOrDefault(type, List.of()));
        }
        return PropertyTypesResponse.builder()
            .usages(List.of(PropertyUsage.values()))
            .typesByUsage(typesByUsage)
            .subtypesByType(subtypesByType)
            .subtypes(data.getSubtypes().allSubtypes())
            .build();
    }

    public RegistrationTypesResponse registrationTypes() {
        ReferenceData data = registry.current().data();
        Map<String, List<RegistrationType>> typical = new LinkedHashMap<>();
        for (PropertyType type : PropertyType.values()) {
            typical.put(type.getLabel(), data.getFormRules().registrationTypesFor(type));
        }
        return RegistrationTypesResponse.builder()
            .registrationTypes(List.of(RegistrationType.values()))
            .typicalByType(typical)
            .build();
    }

    public ValidationRulesResponse validationRules() {
        ReferenceData data = registry.current().data();
        return ValidationRulesResponse.builder()
            .sizeRanges(data.getSizeRanges().ranges())
            .lowerTolerance(data.getSizeRanges().lowerTolerance())
            .upperTolerance(data.getSizeRanges().upperTolerance())
            .subtypeProfiles(data.getSubtypes().profiles())
            .build();
    }

    public ReloadResponse reload(String requestId) {
        ReferenceData data = registry.reload();
        log.info("Reference reload requested | areas={} | requestId={}", data.getAreaTiers().size(), requestId);
        return ReloadResponse.builder()
            .loadedAt(data.getLoadedAt())
            .areaCount(data.getAreaTiers().size())
            .sizeBuckets(data.getSizeRanges().ranges().size())
            .formRules(data.getFormRules().rules().size())
            .build();
    }
}
