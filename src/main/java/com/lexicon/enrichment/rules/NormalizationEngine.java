package com.lexicon.enrichment.rules;

import com.lexicon.enrichment.core.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Applies normalization rules in priority order (lower number first), then trims and collapses whitespace.
 * Case is preserved: canonical labels are matched exactly.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_PASSES = 4;

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this(List.of());
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public synchronized void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public synchronized boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public synchronized List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Rewrites a term with every rule that applies to its language.
     *
     * @return the rewritten term, or an empty string for null or blank input
     */
    public String normalize(String term, Language language) {
        if (term == null || term.isBlank()) {
            return "";
        }
        List<NormalizationRule> applicable = getRules().stream().filter(r -> r.appliesTo(language)).toList();
        String result = term.trim();
        // decorations can be stacked ("Haus² (ugs.)"), so repeat until nothing changes
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String start = result;
            for (NormalizationRule rule : applicable) {
                String before = result;
                result = rule.apply(result).trim();
                if (!before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
            if (result.equals(start)) {
                break;
            }
        }
        return WHITESPACE.matcher(result).replaceAll(" ");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
