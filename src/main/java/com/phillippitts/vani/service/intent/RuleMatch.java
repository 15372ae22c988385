package com.phillippitts.vani.service.intent;

import com.phillippitts.vani.domain.Intent;

import java.util.Comparator;
import java.util.Map;

/**
 * A trigger rule that occurred in an utterance.
 */
public record RuleMatch(TriggerRule rule, TriggerPattern.Occurrence occurrence) {

    /**
     * Priority order: specific rules before catch-all rules, then tier, then longest matched
     * span, then intent declaration order, then earliest position. Total over matches of one
     * utterance, so resolution is deterministic.
     */
    public static final Comparator<RuleMatch> PRIORITY = Comparator
            .comparing((RuleMatch m) -> m.rule().catchAll())
            .thenComparing(m -> m.intent().tier())
            .thenComparing(Comparator.comparingInt(RuleMatch::spanLength).reversed())
            .thenComparing(RuleMatch::intent)
            .thenComparingInt(m -> m.occurrence().start());

    public Intent intent() {
        return rule.intent();
    }

    public int spanLength() {
        return occurrence.length();
    }

    public Map<String, String> slots() {
        return occurrence.slots();
    }
}
