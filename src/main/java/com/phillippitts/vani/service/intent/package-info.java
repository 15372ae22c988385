/**
 * Intent resolution.
 *
 * <p>{@link com.phillippitts.vani.service.intent.DefaultTriggerRules} builds the
 * {@link com.phillippitts.vani.service.intent.TriggerRuleTable} from per-language keyword and
 * verb-object patterns. The resolver collects every match and picks the winner by tier, then
 * span length, then intent order, then position, so the same text always yields the same intent.
 * Catch-all verb phrases such as "open &lt;target&gt;" rank below every specific match. Text that
 * matches nothing is a conversation turn.
 */
package com.phillippitts.vani.service.intent;
