package com.priceprediction.reference;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/** One immutable snapshot of every reference table the engine reads. */
@Value
@Builder
public class ReferenceData {
    @NonNull SizeRangeTable    sizeRanges;
    @NonNull AreaTierTable     areaTiers;
    @NonNull FormRuleTable     formRules;
    @NonNull SubtypeCatalog    subtypes;
    @NonNull EncoderVocabulary vocabulary;
    Instant loadedAt;
}
