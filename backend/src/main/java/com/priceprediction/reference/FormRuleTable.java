package com.priceprediction.reference;

import com.priceprediction.engine.PropertyType;
import com.priceprediction.engine.PropertyUsage;
import com.priceprediction.engine.RegistrationType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Form rules per (usage, type) plus the option lists that drive the dynamic form. */
public final class FormRuleTable {

    private final Map<PropertyCategory, FormRule> rules;
    private final Map<PropertyUsage, List<PropertyType>> typesByUsage;
    private final Map<PropertyType, List<RegistrationType>> registrationTypesByType;

    public FormRuleTable(Map<PropertyCategory, FormRule> rules,
                         Map<PropertyUsage, List<PropertyType>> typesByUsage,
                         Map<PropertyType, List<RegistrationType>> registrationTypesByType) {
        this.rules = Map.copyOf(rules);
        this.typesByUsage = Map.copyOf(typesByUsage);
        this.registrationTypesByType = Map.copyOf(registrationTypesByType);
    }

    public Optional<FormRule> find(PropertyUsage usage, PropertyType type) {
        if (usage == null || type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(new PropertyCategory(usage, type)));
    }

    public List<PropertyType> typesFor(PropertyUsage usage) {
        return usage == null ? List.of(PropertyType.values()) : typesByUsage.getOrDefault(usage, List.of(PropertyType.values()));
    }

    public List<RegistrationType> registrationTypesFor(PropertyType type) {
        return type == null ? List.of(RegistrationType.values()) : registrationTypesByType.getOrDefault(type, List.of(RegistrationType.values()));
    }

    public Map<PropertyCategory, FormRule> rules() {
        return rules;
    }
}
