package com.supplier.catalog.rules;

import java.util.List;

/**
 * Built-in rules for product labels.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getUnitRules());
        engine.addRules(getCommonRules());
        return engine;
    }

    /**
     * Unifies spellings of common pack units so "10 Stück" and "10 pcs" compare equal.
     */
    public static List<NormalizationRule> getUnitRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("unit-pieces")
                        .pattern("\\b(pieces|piece|pcs|pc|stk|st\u00fcck|stuks)\\b\\.?")
                        .replacement("pcs")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("unit-millilitre")
                        .pattern("(\\d)\\s*(millilit(er|re)s?|ml)\\b")
                        .replacement("$1ml")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("unit-litre")
                        .pattern("(\\d)\\s*(lit(er|re)s?|ltr|l)\\b")
                        .replacement("$1l")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("unit-gram")
                        .pattern("(\\d)\\s*(grams?|gr|g)\\b")
                        .replacement("$1g")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("unit-centimetre")
                        .pattern("(\\d)\\s*(centimet(er|re)s?|cm)\\b")
                        .replacement("$1cm")
                        .priority(10)
                        .build(),

                // "10 x 10" -> "10x10"
                NormalizationRule.builder()
                        .name("unit-dimension")
                        .pattern("(\\d)\\s*[x\u00d7*]\\s*(\\d)")
                        .replacement("$1x$2")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Punctuation and spacing rules applied to every label.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" ")
                        .priority(50)
                        .build(),

                // Keeps letters of any script, digits and spaces
                NormalizationRule.builder()
                        .name("common-special-chars")
                        .pattern("[^\\p{L}\\p{N}\\s]")
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
}
