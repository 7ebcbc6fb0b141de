package com.racing.reconcile.rules;

import java.util.List;

/**
 * Built-in rule sets for circuit names and for the keys used in driver name matching.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Engine that rewrites title-cased circuit names into their canonical short forms.
     */
    public static NormalizationEngine circuitEngine() {
        return new NormalizationEngine(getCircuitRules(), false);
    }

    /**
     * Engine producing lowercase, accent-free, suffix-free keys for comparing driver names.
     */
    public static NormalizationEngine matchingKeyEngine() {
        NormalizationEngine engine = new NormalizationEngine(true);
        engine.addRules(getWhitespaceRules());
        engine.addRules(getPersonSuffixRules());
        engine.addRules(getDiacriticRules());
        return engine;
    }

    /**
     * Canonical substring substitutions for circuit names. Case-sensitive because they run
     * after title-casing.
     */
    public static List<NormalizationRule> getCircuitRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("circuit-grand-prix")
                        .pattern("Grand Prix")
                        .replacement("GP")
                        .caseSensitive(true)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("circuit-international")
                        .pattern("International Circuit")
                        .replacement("Circuit")
                        .caseSensitive(true)
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("circuit-racing")
                        .pattern("Racing Circuit")
                        .replacement("Circuit")
                        .caseSensitive(true)
                        .priority(20)
                        .build()
        );
    }

    public static List<NormalizationRule> getWhitespaceRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("common-trim")
                        .pattern("^\\s+|\\s+$")
                        .replacement("")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Generational suffixes: "Jr", "Sr" and roman numerals II to IV.
     */
    public static List<NormalizationRule> getPersonSuffixRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("person-generational-suffix")
                        .pattern("\\s+(jr|sr|ii|iii|iv)\\.?$")
                        .replacement("")
                        .priority(30)
                        .build()
        );
    }

    /**
     * Fixed folding table for the accented letters common in driver names.
     */
    public static List<NormalizationRule> getDiacriticRules() {
        return List.of(
                diacritic("a", "[áàâãä]"),
                diacritic("e", "[éèêë]"),
                diacritic("i", "[íìîï]"),
                diacritic("o", "[óòôõö]"),
                diacritic("u", "[úùûü]"),
                diacritic("c", "ç"),
                diacritic("n", "ñ")
        );
    }

    private static NormalizationRule diacritic(String base, String pattern) {
        return NormalizationRule.builder()
                .name("fold-" + base)
                .pattern(pattern)
                .replacement(base)
                .priority(50)
                .build();
    }
}
