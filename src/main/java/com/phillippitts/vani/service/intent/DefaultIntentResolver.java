package com.phillippitts.vani.service.intent;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Collect-all-then-prioritize resolver over a {@link TriggerRuleTable}.
 *
 * <p>Every pattern of the utterance's language is evaluated; the matches are ranked by
 * {@link RuleMatch#PRIORITY}:
 * <ol>
 *   <li>specific rules before catch-all rules such as "open &lt;target&gt;"</li>
 *   <li>tier: control &gt; vision &gt; website &gt; application &gt; system &gt; information</li>
 *   <li>longest matched span within a tier</li>
 *   <li>intent declaration order</li>
 * </ol>
 * No match resolves to {@link Intent#CONVERSATION}.
 *
 * <p><b>Thread Safety:</b> stateless apart from the immutable table.
 *
 * @since 1.0
 */
public final class DefaultIntentResolver implements IntentResolver {

    private static final Logger LOG = LogManager.getLogger(DefaultIntentResolver.class);

    private final TriggerRuleTable table;

    public DefaultIntentResolver(TriggerRuleTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    @Override
    public Intent resolve(String normalizedText, Language language) {
        List<RuleMatch> ranked = rankedMatches(normalizedText, language);
        if (ranked.isEmpty()) {
            LOG.debug("No trigger matched (lang={}); defaulting to conversation", language.tag());
            return Intent.CONVERSATION;
        }
        RuleMatch winner = ranked.get(0);
        if (LOG.isDebugEnabled() && ranked.size() > 1) {
            LOG.debug("Resolved {} over {} other match(es) via '{}'",
                    winner.intent(), ranked.size() - 1, winner.rule().pattern().source());
        }
        return winner.intent();
    }

    @Override
    public List<RuleMatch> rankedMatches(String normalizedText, Language language) {
        Objects.requireNonNull(normalizedText, "normalizedText must not be null");
        Objects.requireNonNull(language, "language must not be null");
        if (normalizedText.isEmpty()) {
            return List.of();
        }
        List<RuleMatch> matches = table.matchAll(normalizedText, language);
        matches.sort(RuleMatch.PRIORITY);
        return List.copyOf(matches);
    }
}
