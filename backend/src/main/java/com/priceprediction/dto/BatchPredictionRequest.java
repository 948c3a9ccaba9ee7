package com.priceprediction.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Items are deliberately not bean-validated here: one malformed item is
 * rejected on its own and must not fail the whole batch.
 */
@Value
@Builder
@Jacksonized
public class BatchPredictionRequest {
    @NotEmpty(message = "properties must contain at least one item")
    List<PropertyRequest> properties;
}
