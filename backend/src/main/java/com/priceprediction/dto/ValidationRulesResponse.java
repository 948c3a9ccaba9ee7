package com.priceprediction.dto;

import com.priceprediction.reference.SizeRange;
import com.priceprediction.reference.SubtypeProfile;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ValidationRulesResponse {
    Map<String, SizeRange>      sizeRanges;
    double                      lowerTolerance;
    double                      upperTolerance;
    Map<String, SubtypeProfile> subtypeProfiles;
}
