package com.lexicon.enrichment.rules;

import com.lexicon.enrichment.core.model.Language;

import java.util.List;

/**
 * Rules that strip dictionary decoration from a canonical-language reference before lookup,
 * e.g. {@code "Haus²"}, {@code "laufen (ugs.)"}, {@code "freuen, sich"}.
 */
public final class ReferenceCleaningRules {

    private ReferenceCleaningRules() {
    }

    public static List<NormalizationRule> canonicalLabelRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("trailing-footnote-marker")
                        .pattern("[0-9¹²³⁴⁵⁶⁷⁸⁹⁰]+$")
                        .languages(Language.CANONICAL)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("trailing-hyphen")
                        .pattern("-$")
                        .languages(Language.CANONICAL)
                        .priority(20)
                        .build(),
                NormalizationRule.builder()
                        .name("trailing-exclamation")
                        .pattern("!$")
                        .languages(Language.CANONICAL)
                        .priority(30)
                        .build(),
                NormalizationRule.builder()
                        .name("trailing-parenthetical")
                        .pattern("\\s*\\(.*\\)\\s*$")
                        .languages(Language.CANONICAL)
                        .priority(40)
                        .build(),
                NormalizationRule.builder()
                        .name("reflexive-marker")
                        .pattern("\\s*,\\s*sich\\s*$")
                        .caseInsensitive(true)
                        .languages(Language.CANONICAL)
                        .priority(50)
                        .build(),
                NormalizationRule.builder()
                        .name("trailing-asterisk")
                        .pattern("\\*$")
                        .languages(Language.CANONICAL)
                        .priority(60)
                        .build()
        );
    }

    public static NormalizationEngine canonicalLabelEngine() {
        return new NormalizationEngine(canonicalLabelRules());
    }
}
