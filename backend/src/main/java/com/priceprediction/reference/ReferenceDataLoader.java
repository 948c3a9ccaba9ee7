package com.priceprediction.reference;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceprediction.engine.PropertyField;
import com.priceprediction.engine.PropertyType;
import com.priceprediction.engine.PropertyUsage;
import com.priceprediction.engine.RegistrationType;
import com.priceprediction.exception.ReferenceDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the reference JSON documents from the classpath and builds the
 * immutable tables. Any invariant violation fails the load.
 */
@Slf4j
@Component
public class ReferenceDataLoader {

    private final ObjectMapper mapper;

    @Value("${reference.validation-rules:reference/validation-rules.json}")
    private String validationRulesPath;

    @Value("${reference.form-rules:reference/form-rules.json}")
    private String formRulesPath;

    @Value("${reference.area-tiers:reference/area-tiers.json}")
    private String areaTiersPath;

    @Value("${reference.encoder-vocabulary:reference/encoder-vocabulary.json}")
    private String vocabularyPath;

    public ReferenceDataLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ReferenceData load() {
        ValidationRulesDocument validation = read(validationRulesPath, ValidationRulesDocument.class);
        FormRulesDocument form = read(formRulesPath, FormRulesDocument.class);
        AreaTiersDocument tiers = read(areaTiersPath, AreaTiersDocument.class);
        VocabularyDocument vocabulary = read(vocabularyPath, VocabularyDocument.class);

        ReferenceData data;
        try {
            data = ReferenceData.builder()
                .sizeRanges(toSizeRanges(validation))
                .areaTiers(toAreaTiers(tiers))
                .formRules(toFormRules(form))
                .subtypes(toSubtypes(form, validation))
                .vocabulary(new EncoderVocabulary(vocabulary.areas(), vocabulary.propertySubtypes(),
                    vocabulary.registrationTypes()))
                .loadedAt(Instant.now())
                .build();
        } catch (IllegalArgumentException ex) {
            throw new ReferenceDataException("Invalid reference data: " + ex.getMessage(), ex);
        }
        log.info("Reference data loaded | sizeBuckets={} | areas={} | formRules={} | subtypes={}",
            data.getSizeRanges().ranges().size(), data.getAreaTiers().size(),
            data.getFormRules().rules().size(), data.getSubtypes().profiles().size());
        return data;
    }

    private <T> T read(String path, Class<T> type) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new ReferenceDataException("Reference file not found on classpath: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            return mapper.readValue(in, type);
        } catch (IOException | IllegalArgumentException ex) {
            throw new ReferenceDataException("Cannot read reference file " + path + ": " + ex.getMessage(), ex);
        }
    }

    private SizeRangeTable toSizeRanges(ValidationRulesDocument doc) {
        Map<String, SizeRange> ranges = new LinkedHashMap<>();
        require(doc.sizeRanges(), "size_ranges").forEach((bucket, r) ->
            ranges.put(bucket, new SizeRange(r.minTypical(), r.maxTypical(), r.average(), r.median())));
        Tolerance tolerance = doc.sizeTolerance() != null ? doc.sizeTolerance() : new Tolerance(0.7, 1.5);
        return new SizeRangeTable(ranges, tolerance.lower(), tolerance.upper());
    }

    private AreaTierTable toAreaTiers(AreaTiersDocument doc) {
        List<AreaTierEntry> entries = new ArrayList<>();
        require(doc.areas(), "areas").forEach((name, area) -> {
            AreaTier tier = AreaTier.fromLabel(require(area.tier(), "tier of " + name));
            double multiplier = area.multiplier() != null ? area.multiplier() : tier.getDefaultMultiplier();
            entries.add(new AreaTierEntry(name, tier, multiplier));
        });
        return new AreaTierTable(entries);
    }

    private FormRuleTable toFormRules(FormRulesDocument doc) {
        Map<PropertyCategory, FormRule> rules = new HashMap<>();
        for (RuleDocument rule : require(doc.rules(), "rules")) {
            PropertyCategory category = new PropertyCategory(
                PropertyUsage.fromLabel(require(rule.usage(), "rule usage")),
                PropertyType.fromLabel(require(rule.type(), "rule type")));
            Map<PropertyField, AutoFillStrategy> autoFill = new EnumMap<>(PropertyField.class);
            if (rule.autoFill() != null) {
                rule.autoFill().forEach((field, strategy) -> autoFill.put(field(field), AutoFillStrategy.valueOf(strategy)));
            }
            FormRule formRule = new FormRule(fields(rule.required()), fields(rule.hidden()), autoFill);
            if (rules.put(category, formRule) != null) {
                throw new ReferenceDataException("Duplicate form rule for " + category.describe());
            }
        }

        Map<PropertyUsage, List<PropertyType>> typesByUsage = new EnumMap<>(PropertyUsage.class);
        if (doc.propertyTypeByUsage() != null) {
            doc.propertyTypeByUsage().forEach((usage, types) -> typesByUsage.put(
                PropertyUsage.fromLabel(usage), types.stream().map(PropertyType::fromLabel).toList()));
        }
        Map<PropertyType, List<RegistrationType>> regTypes = new EnumMap<>(PropertyType.class);
        if (doc.typicalRegistrationTypes() != null) {
            doc.typicalRegistrationTypes().forEach((type, values) -> {
                if (values == null || values.isEmpty()) {
                    throw new ReferenceDataException("typical_registration_types of " + type + " must not be empty");
                }
                regTypes.put(PropertyType.fromLabel(type), values.stream().map(RegistrationType::fromLabel).toList());
            });
        }
        return new FormRuleTable(rules, typesByUsage, regTypes);
    }

    private SubtypeCatalog toSubtypes(FormRulesDocument form, ValidationRulesDocument validation) {
        Map<PropertyType, List<String>> byType = new EnumMap<>(PropertyType.class);
        if (form.propertySubtypeByType() != null) {
            form.propertySubtypeByType().forEach((type, subtypes) -> byType.put(PropertyType.fromLabel(type), subtypes));
        }
        Map<PropertyUsage, List<String>> byUsage = new EnumMap<>(PropertyUsage.class);
        if (form.propertySubtypeByUsage() != null) {
            form.propertySubtypeByUsage().forEach((usage, subtypes) -> byUsage.put(PropertyUsage.fromLabel(usage), subtypes));
        }
        List<SubtypeProfile> profiles = new ArrayList<>();
        if (validation.propertySubtypeSpecifics() != null) {
            validation.propertySubtypeSpecifics().forEach((name, s) -> {
                Double min = null;
                Double max = null;
                if (s.sizeRange() != null) {
                    if (s.sizeRange().size() != 2 || s.sizeRange().get(0) > s.sizeRange().get(1)) {
                        throw new ReferenceDataException("size_range of subtype " + name + " must be [min, max]");
                    }
                    min = s.sizeRange().get(0);
                    max = s.sizeRange().get(1);
                }
                boolean applicable = s.bedroomsApplicable() == null || s.bedroomsApplicable();
                profiles.add(new SubtypeProfile(name, s.typicalBedrooms(), applicable, min, max));
            });
        }
        return new SubtypeCatalog(byType, byUsage, profiles);
    }

    private static Set<PropertyField> fields(List<String> names) {
        Set<PropertyField> fields = new LinkedHashSet<>();
        if (names != null) {
            names.forEach(n -> fields.add(field(n)));
        }
        return fields;
    }

    private static PropertyField field(String wireName) {
        return Arrays.stream(PropertyField.values())
            .filter(f -> f.getWireName().equals(wireName))
            .findFirst()
            .orElseThrow(() -> new ReferenceDataException("Unknown form field '" + wireName + "'"));
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new ReferenceDataException("Reference data is missing '" + name + "'");
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ValidationRulesDocument(
        @JsonProperty("size_tolerance") Tolerance sizeTolerance,
        @JsonProperty("size_ranges") Map<String, SizeRangeDocument> sizeRanges,
        @JsonProperty("property_subtype_specifics") Map<String, SubtypeDocument> propertySubtypeSpecifics
    ) {}

    record Tolerance(double lower, double upper) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SizeRangeDocument(
        @JsonProperty("min_typical") double minTypical,
        @JsonProperty("max_typical") double maxTypical,
        double average,
        double median
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubtypeDocument(
        @JsonProperty("typical_bedrooms") List<Integer> typicalBedrooms,
        @JsonProperty("bedrooms_applicable") Boolean bedroomsApplicable,
        @JsonProperty("size_range") List<Double> sizeRange
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FormRulesDocument(
        @JsonProperty("property_type_by_usage") Map<String, List<String>> propertyTypeByUsage,
        @JsonProperty("property_subtype_by_type") Map<String, List<String>> propertySubtypeByType,
        @JsonProperty("property_subtype_by_usage") Map<String, List<String>> propertySubtypeByUsage,
        @JsonProperty("typical_registration_types") Map<String, List<String>> typicalRegistrationTypes,
        List<RuleDocument> rules
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleDocument(
        String usage,
        String type,
        List<String> required,
        List<String> hidden,
        @JsonProperty("auto_fill") Map<String, String> autoFill
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AreaTiersDocument(Map<String, AreaDocument> areas) {}

    record AreaDocument(String tier, Double multiplier) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record VocabularyDocument(
        List<String> areas,
        @JsonProperty("property_subtypes") List<String> propertySubtypes,
        @JsonProperty("registration_types") List<String> registrationTypes
    ) {}
}
