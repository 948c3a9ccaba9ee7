package com.priceprediction.dto;

import com.priceprediction.engine.PropertyType;
import com.priceprediction.engine.PropertyUsage;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class PropertyTypesResponse {
    List<PropertyUsage>                     usages;
    Map<String, List<PropertyType>>         typesByUsage;
    Map<String, List<String>>               subtypesByType;
    List<String>                            subtypes;
}
