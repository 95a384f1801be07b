package com.catalog.reconciliation.derive;

import java.util.Optional;

/**
 * Normalizes food form to {@code dry}, {@code wet}, {@code raw} or {@code vet}.
 */
public class FormClassifier {

    public static final String DRY = "dry";
    public static final String WET = "wet";
    public static final String RAW = "raw";
    public static final String VET = "vet";

    private static final KeywordFamilies FROM_FORM = KeywordFamilies.builder()
            .family(DRY, "dry", "kibble", "kibbles", "biscuit", "biscuits", "crispy", "crunchy")
            .family(WET, "wet", "can", "cans", "canned", "tin", "tins", "pouch", "pouches", "tray", "trays",
                    "pate", "pâté", "gravy", "jelly", "loaf")
            .family(RAW, "raw", "freeze-dried", "freeze dried", "frozen", "fresh", "barf")
            .family(VET, "vet", "veterinary", "prescription", "therapeutic", "clinical")
            .build();

    /**
     * Form from the raw form field, falling back to keywords in the product name.
     */
    public Optional<String> classify(String formRaw, String productName) {
        Optional<String> fromForm = FROM_FORM.classify(formRaw);
        if (fromForm.isPresent()) {
            return fromForm;
        }
        return FROM_FORM.classify(productName);
    }

    public Optional<String> normalize(String formRaw) {
        return FROM_FORM.classify(formRaw);
    }
}
