package com.priceprediction.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ReloadResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant loadedAt;
    int     areaCount;
    int     sizeBuckets;
    int     formRules;
}
