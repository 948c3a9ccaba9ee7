package com.priceprediction.engine;

import com.priceprediction.reference.FormRule;
import com.priceprediction.reference.FormRuleTable;
import com.priceprediction.reference.SubtypeCatalog;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides, for a property configuration, which request fields are required,
 * optional, hidden or auto-filled. Stateless; safe for concurrent use.
 */
public class FormDependencyResolver {

    private final FormRuleTable formRules;
    private final SubtypeCatalog subtypes;

    public FormDependencyResolver(FormRuleTable formRules, SubtypeCatalog subtypes) {
        this.formRules = formRules;
        this.subtypes = subtypes;
    }

    public FieldPolicy resolve(PropertyUsage usage, PropertyType type, String subtype) {
        Optional<FormRule> rule = formRules.find(usage, type);
        if (rule.isEmpty()) {
            return FieldPolicy.permissive();
        }
        FieldPolicy policy = FieldPolicy.of(requirementsOf(rule.get()));
        return policy.hide(narrowedBySubtype(subtype));
    }

    private static Map<PropertyField, FieldRequirement> requirementsOf(FormRule rule) {
        Map<PropertyField, FieldRequirement> requirements = new EnumMap<>(PropertyField.class);
        requirements.put(PropertyField.USAGE, FieldRequirement.REQUIRED);
        requirements.put(PropertyField.TYPE, FieldRequirement.REQUIRED);
        rule.required().forEach(f -> requirements.put(f, FieldRequirement.REQUIRED));
        rule.autoFill().keySet().forEach(f -> requirements.put(f, FieldRequirement.AUTO_FILLED));
        rule.hidden().forEach(f -> requirements.put(f, FieldRequirement.HIDDEN));
        return requirements;
    }

    // a subtype can only hide more fields
    private Set<PropertyField> narrowedBySubtype(String subtype) {
        Set<PropertyField> hidden = EnumSet.noneOf(PropertyField.class);
        subtypes.profile(subtype)
            .filter(p -> !p.bedroomsApplicable())
            .ifPresent(p -> hidden.add(PropertyField.BEDROOMS));
        return hidden;
    }
}
