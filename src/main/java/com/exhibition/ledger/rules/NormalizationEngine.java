package com.exhibition.ledger.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Engine for applying normalization rules to company names.
 * Rules are applied in priority order (lower priority number = higher precedence),
 * after the input has passed through {@link ValueNormalizer}.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    /**
     * Adds multiple rules to the engine.
     */
    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    /**
     * Normalizes the given name: lowercases it, applies every rule in priority order,
     * then trims and collapses whitespace. Never returns null.
     */
    public String normalize(String name) {
        String result = ValueNormalizer.normalize(name).toLowerCase(Locale.ROOT);
        if (result.isEmpty()) {
            return "";
        }

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return result.strip().replaceAll("\\s+", " ");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
