package com.catalog.reconciliation.derive;

import java.util.Optional;

/**
 * Normalizes life stage to {@code puppy}, {@code senior}, {@code all} or {@code adult}.
 * No stage is assumed when the text carries none.
 */
public class LifeStageClassifier {

    public static final String PUPPY = "puppy";
    public static final String ADULT = "adult";
    public static final String SENIOR = "senior";
    public static final String ALL = "all";

    private static final KeywordFamilies STAGES = KeywordFamilies.builder()
            .family(PUPPY, "puppy", "puppies", "junior", "young", "growth", "starter")
            .family(SENIOR, "senior", "mature adult", "mature", "aged", "older", "7+", "8+", "9+")
            .family(ALL, "all life stages", "all life", "all stages", "all ages", "any age", "life stages")
            .family(ADULT, "adult", "maintenance")
            .build();

    public Optional<String> classify(String lifeStageRaw, String productName) {
        if (lifeStageRaw != null && lifeStageRaw.trim().equalsIgnoreCase(ALL)) {
            return Optional.of(ALL);
        }
        Optional<String> fromField = STAGES.classify(lifeStageRaw);
        if (fromField.isPresent()) {
            return fromField;
        }
        return STAGES.classify(productName);
    }
}
