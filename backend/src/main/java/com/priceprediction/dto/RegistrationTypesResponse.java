package com.priceprediction.dto;

import com.priceprediction.engine.RegistrationType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class RegistrationTypesResponse {
    List<RegistrationType>                     registrationTypes;
    Map<String, List<RegistrationType>>        typicalByType;
}
