package com.priceprediction.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.priceprediction.engine.PropertyType;
import com.priceprediction.engine.PropertyUsage;
import com.priceprediction.engine.RegistrationType;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One property to price. Every field is nullable so that an absent value can be
 * told apart from {@code false} or {@code 0}; which fields must be present
 * depends on the (usage, type) pair and is decided by the form rules.
 * The snake_case aliases accept the column names of the training data.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PropertyRequest {

    PropertyUsage usage;

    PropertyType type;

    @Size(max = 100, message = "subtype must be at most 100 characters")
    @JsonAlias({"property_sub_type_en", "subType"})
    String subtype;

    @JsonAlias({"area_size", "procedure_area"})
    Double areaSize;

    @PositiveOrZero(message = "bedrooms must be >= 0")
    @JsonDeserialize(using = BedroomsDeserializer.class)
    Integer bedrooms;

    @JsonAlias("has_parking")
    Boolean hasParking;

    @JsonAlias("has_project")
    Boolean hasProject;

    @Size(max = 120, message = "areaName must be at most 120 characters")
    @JsonAlias({"area_name", "area_name_en"})
    String areaName;

    @JsonAlias({"registration_type", "reg_type_en"})
    RegistrationType registrationType;
}
