package com.priceprediction.engine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/** Requirement of every {@link PropertyField} for one property configuration. */
public final class FieldPolicy {

    private final Map<PropertyField, FieldRequirement> requirements;
    private final boolean matchedRule;

    private FieldPolicy(Map<PropertyField, FieldRequirement> requirements, boolean matchedRule) {
        this.requirements = Collections.unmodifiableMap(requirements);
        this.matchedRule = matchedRule;
    }

    /** Every field optional; used when no rule covers the (usage, type) pair. */
    public static FieldPolicy permissive() {
        Map<PropertyField, FieldRequirement> all = new EnumMap<>(PropertyField.class);
        for (PropertyField field : PropertyField.values()) {
            all.put(field, FieldRequirement.OPTIONAL);
        }
        return new FieldPolicy(all, false);
    }

    static FieldPolicy of(Map<PropertyField, FieldRequirement> requirements) {
        Map<PropertyField, FieldRequirement> copy = new EnumMap<>(PropertyField.class);
        for (PropertyField field : PropertyField.values()) {
            copy.put(field, requirements.getOrDefault(field, FieldRequirement.OPTIONAL));
        }
        return new FieldPolicy(copy, true);
    }

    /** Returns a policy with the given fields hidden; hidden fields stay hidden. */
    FieldPolicy hide(Set<PropertyField> fields) {
        if (fields.isEmpty()) {
            return this;
        }
        Map<PropertyField, FieldRequirement> copy = new EnumMap<>(requirements);
        fields.forEach(f -> copy.put(f, FieldRequirement.HIDDEN));
        return new FieldPolicy(copy, matchedRule);
    }

    public FieldRequirement requirement(PropertyField field) {
        return requirements.get(field);
    }

    public boolean isHidden(PropertyField field) {
        return requirements.get(field) == FieldRequirement.HIDDEN;
    }

    public boolean isRequired(PropertyField field) {
        return requirements.get(field) == FieldRequirement.REQUIRED;
    }

    public boolean isAutoFilled(PropertyField field) {
        return requirements.get(field) == FieldRequirement.AUTO_FILLED;
    }

    public boolean isMatchedRule() {
        return matchedRule;
    }

    public Map<PropertyField, FieldRequirement> asMap() {
        return requirements;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldPolicy)) {
            return false;
        }
        FieldPolicy other = (FieldPolicy) o;
        return matchedRule == other.matchedRule && requirements.equals(other.requirements);
    }

    @Override
    public int hashCode() {
        return requirements.hashCode() * 31 + Boolean.hashCode(matchedRule);
    }

    @Override
    public String toString() {
        return "FieldPolicy" + requirements;
    }
}
