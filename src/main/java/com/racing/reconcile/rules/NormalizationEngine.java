package com.racing.reconcile.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies an ordered list of {@link NormalizationRule}s to a name.
 * Rules run in priority order (lower number first); equal priorities keep insertion order.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;
    private final boolean lowercase;

    /**
     * @param lowercase whether the final cleanup also lowercases the result
     */
    public NormalizationEngine(boolean lowercase) {
        this.rules = new ArrayList<>();
        this.lowercase = lowercase;
    }

    public NormalizationEngine(List<NormalizationRule> rules, boolean lowercase) {
        this.rules = new ArrayList<>(rules);
        this.lowercase = lowercase;
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a name. Blank or null input yields an empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        result = result.trim().replaceAll("\\s+", " ");
        if (lowercase) {
            result = result.toLowerCase(Locale.ROOT);
        }
        return result;
    }

    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
