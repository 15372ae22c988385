package com.phillippitts.vani.service.intent;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only mapping of (language, intent) to trigger patterns. The single source of truth for
 * which text activates which intent.
 *
 * <p>Construction validates completeness: every intent except {@link Intent#CONVERSATION} must
 * have at least one pattern per supported language. A gap is a configuration defect and fails
 * construction with {@link IllegalStateException}.
 *
 * <p>Immutable after construction; thread-safe.
 */
public final class TriggerRuleTable {

    private final Map<Language, List<TriggerRule>> byLanguage;
    private final EntityCatalog catalog;

    private TriggerRuleTable(List<TriggerRule> rules, EntityCatalog catalog) {
        this.catalog = catalog;
        Map<Language, List<TriggerRule>> grouped = new EnumMap<>(Language.class);
        for (Language language : Language.values()) {
            grouped.put(language, new ArrayList<>());
        }
        for (TriggerRule rule : rules) {
            grouped.get(rule.language()).add(rule);
        }
        List<String> gaps = new ArrayList<>();
        for (Language language : Language.values()) {
            for (Intent intent : Intent.values()) {
                if (intent == Intent.CONVERSATION) {
                    continue;
                }
                boolean covered = grouped.get(language).stream().anyMatch(r -> r.intent() == intent);
                if (!covered) {
                    gaps.add(language.tag() + "/" + intent);
                }
            }
        }
        if (!gaps.isEmpty()) {
            throw new IllegalStateException("Trigger table has no patterns for: " + gaps);
        }
        Map<Language, List<TriggerRule>> frozen = new EnumMap<>(Language.class);
        grouped.forEach((language, list) -> frozen.put(language, List.copyOf(list)));
        this.byLanguage = Collections.unmodifiableMap(frozen);
    }

    public static Builder builder(EntityCatalog catalog) {
        return new Builder(catalog);
    }

    /**
     * @return rules for one language, in table order
     */
    public List<TriggerRule> rulesFor(Language language) {
        return byLanguage.get(Objects.requireNonNull(language, "language must not be null"));
    }

    /**
     * @return rules for one intent across all languages, in table order
     */
    public List<TriggerRule> rulesFor(Intent intent) {
        return byLanguage.values().stream()
                .flatMap(List::stream)
                .filter(r -> r.intent() == intent)
                .collect(Collectors.toList());
    }

    /**
     * Evaluates every pattern of the language against the text.
     *
     * @return one match per rule that occurs, in table order
     */
    public List<RuleMatch> matchAll(String normalizedText, Language language) {
        List<RuleMatch> matches = new ArrayList<>();
        for (TriggerRule rule : rulesFor(language)) {
            Optional<TriggerPattern.Occurrence> occurrence = rule.pattern().find(normalizedText);
            occurrence.ifPresent(o -> matches.add(new RuleMatch(rule, o)));
        }
        return matches;
    }

    public EntityCatalog catalog() {
        return catalog;
    }

    public int size() {
        return byLanguage.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Accumulates rules; {@link #build()} validates completeness.
     */
    public static final class Builder {
        private final EntityCatalog catalog;
        private final List<TriggerRule> rules = new ArrayList<>();

        private Builder(EntityCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        }

        /**
         * Adds command phrases: stripped from the text when building a query.
         */
        public Builder commands(Language language, Intent intent, String... patterns) {
            return add(language, intent, true, patterns);
        }

        /**
         * Adds content keywords: they select the intent but stay in the query.
         */
        public Builder keywords(Language language, Intent intent, String... patterns) {
            return add(language, intent, false, patterns);
        }

        /**
         * Adds open-ended command phrases, ranked below every specific rule.
         */
        public Builder catchAll(Language language, Intent intent, String... patterns) {
            for (String p : patterns) {
                rules.add(new TriggerRule(language, intent, TriggerPattern.compile(p, catalog), true, true));
            }
            return this;
        }

        public TriggerRuleTable build() {
            return new TriggerRuleTable(rules, catalog);
        }

        private Builder add(Language language, Intent intent, boolean command, String... patterns) {
            for (String p : patterns) {
                rules.add(new TriggerRule(language, intent, TriggerPattern.compile(p, catalog), command));
            }
            return this;
        }
    }
}
