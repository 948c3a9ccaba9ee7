package com.priceprediction.dto;

import com.priceprediction.engine.FieldRequirement;
import com.priceprediction.engine.PropertyType;
import com.priceprediction.engine.PropertyUsage;
import com.priceprediction.engine.RegistrationType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** What the form should show for one usage/type/subtype selection. */
@Value
@Builder
public class FormPolicyResponse {
    PropertyUsage                 usage;
    PropertyType                  type;
    String                        subtype;
    boolean                       matchedRule;
    Map<String, FieldRequirement> fields;
    List<PropertyType>            propertyTypeOptions;
    List<String>                  subtypeOptions;
    List<RegistrationType>        registrationTypeOptions;
}
