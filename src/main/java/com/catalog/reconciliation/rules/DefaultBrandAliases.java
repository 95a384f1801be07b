package com.catalog.reconciliation.rules;

/**
 * Built-in alias table covering the brands whose names are routinely split or
 * abbreviated by retailer feeds. Curated deployments load their own table through
 * {@code CsvAliasMapLoader}; this one backs tests and local runs.
 */
public final class DefaultBrandAliases {

    public static final String VERSION = "builtin-1";

    private DefaultBrandAliases() {
        // Utility class
    }

    public static BrandAliasMap create() {
        return BrandAliasMap.builder()
                .version(VERSION)

                // Royal Canin
                .canonical("Royal Canin", "royal_canin")
                .alias("RoyalCanin", "royal_canin")
                .alias("Royal Canin Veterinary Diet", "royal_canin", "veterinary_diet")
                .alias("Royal Canin Veterinary", "royal_canin", "veterinary_diet")
                .deny("Royal Canine")
                .deny("Canine")

                // Hill's
                .canonical("Hill's", "hills")
                .alias("Hill's Science Plan", "hills", "science_plan")
                .alias("Hill's Science Diet", "hills", "science_plan")
                .alias("Hill's Prescription Diet", "hills", "prescription_diet")
                .alias("Hills Science Plan", "hills", "science_plan")
                .alias("Hills Prescription Diet", "hills", "prescription_diet")

                // Purina
                .canonical("Purina", "purina")
                .alias("Purina Pro Plan", "purina", "pro_plan")
                .alias("Pro Plan", "purina", "pro_plan")
                .alias("ProPlan", "purina", "pro_plan")
                .alias("Purina ONE", "purina", "one")
                .alias("Purina Beta", "purina", "beta")

                // Two- and three-word brands prone to splitting
                .canonical("Arden Grange", "arden_grange")
                .canonical("Barking Heads", "barking_heads")
                .canonical("Lily's Kitchen", "lilys_kitchen")
                .alias("Lily Kitchen", "lilys_kitchen")
                .canonical("Taste of the Wild", "taste_of_the_wild")
                .canonical("Wild Freedom", "wild_freedom")
                .canonical("Nature's Variety", "natures_variety")
                .canonical("Nature's Menu", "natures_menu")
                .canonical("James Wellbeloved", "james_wellbeloved")
                .alias("James Well Beloved", "james_wellbeloved")
                .canonical("Wainwright's", "wainwrights")
                .canonical("Pooch & Mutt", "pooch_mutt")
                .alias("Pooch and Mutt", "pooch_mutt")
                .canonical("Edgard & Cooper", "edgard_cooper")
                .alias("Edgard and Cooper", "edgard_cooper")

                // Lines carried as brand + line
                .canonical("Farmina", "farmina")
                .alias("Farmina N&D", "farmina", "n_d")
                .canonical("Wellness", "wellness")
                .alias("Wellness Core", "wellness", "core")

                // Single-word brands
                .canonical("Burns", "burns")
                .canonical("Acana", "acana")
                .canonical("Orijen", "orijen")
                .canonical("Forthglade", "forthglade")
                .build();
    }
}
