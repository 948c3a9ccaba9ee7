package com.priceprediction.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SizeSuggestionResponse {
    int    bedrooms;
    String bucket;
    double minTypical;
    double maxTypical;
    double average;
    double median;
    double lowerWarningBound;
    double upperWarningBound;
}
