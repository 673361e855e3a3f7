package com.exhibition.ledger.rules;

import java.util.List;

/**
 * Built-in rules for reducing a company name to the form hashed into an identity key.
 * Legal-form and grouping words are removed in English and Persian, then punctuation.
 */
public final class CompanyNameRules {

    // A word is bounded by anything that is not a letter, digit or combining mark.
    private static final String BEFORE = "(?<![\\p{L}\\p{N}\\p{M}])";
    private static final String AFTER = "(?![\\p{L}\\p{N}\\p{M}])";

    private CompanyNameRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getStopWordRules());
        engine.addRules(getCommonRules());
        return engine;
    }

    /**
     * Gets the stop-word rules. Each removes a whole word only, so "income" keeps its "inc".
     */
    public static List<NormalizationRule> getStopWordRules() {
        return List.of(
                stopWord("company-company", "company", 10),
                stopWord("company-ltd", "ltd", 10),
                stopWord("company-inc", "inc", 10),
                stopWord("company-group", "group", 10),
                stopWord("company-corp", "corp", 10),
                // "sherkat" (company) and "gorooh" (group)
                stopWord("company-fa-company", "شرکت", 10),
                stopWord("company-fa-group", "گروه", 10)
        );
    }

    /**
     * Gets rules that run after stop-word removal.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // Zero-width non-joiner separates Persian word parts
                NormalizationRule.builder()
                        .name("common-zwnj")
                        .pattern("\\u200C")
                        .replacement(" ")
                        .priority(50)
                        .build(),

                // Punctuation and symbols become spaces
                NormalizationRule.builder()
                        .name("common-punctuation")
                        .pattern("[\\p{P}\\p{S}]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }

    private static NormalizationRule stopWord(String name, String word, int priority) {
        return NormalizationRule.builder()
                .name(name)
                .pattern(BEFORE + word + AFTER)
                .replacement(" ")
                .priority(priority)
                .build();
    }
}
