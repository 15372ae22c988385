package com.phillippitts.vani.service.extract;

import com.phillippitts.vani.domain.ExtractionResult;
import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.NormalizedUtterance;
import com.phillippitts.vani.domain.ParsedCommand;
import com.phillippitts.vani.domain.Slots;
import com.phillippitts.vani.domain.VolumeDirection;
import com.phillippitts.vani.service.intent.EntityCatalog;
import com.phillippitts.vani.service.intent.EntityCatalog.EntityKind;
import com.phillippitts.vani.service.intent.TriggerPattern;
import com.phillippitts.vani.service.intent.TriggerRule;
import com.phillippitts.vani.service.intent.TriggerRuleTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Slot extraction driven by the same trigger table the resolver uses.
 *
 * <ul>
 *   <li>{@code app}, {@code site}, {@code browser}: entity slots captured by the intent's
 *       patterns, mapped to canonical names through the {@link EntityCatalog}</li>
 *   <li>{@code browser}: additionally found by "in &lt;browser&gt;" style phrases; left absent
 *       when not stated</li>
 *   <li>{@code direction}: explicit up/down/mute keywords only</li>
 *   <li>{@code query}: the utterance with the intent's command phrases removed; content
 *       keywords such as "weather" are kept</li>
 * </ul>
 */
public final class DefaultParameterExtractor implements ParameterExtractor {

    private static final Logger LOG = LogManager.getLogger(DefaultParameterExtractor.class);

    private static final Map<Language, List<String>> BROWSER_PHRASES = Map.of(
            Language.ENGLISH, List.of("in <browser>", "on <browser>", "using <browser>", "with <browser>"),
            Language.HINDI, List.of("<browser> में", "<browser> पर"),
            Language.GUJARATI, List.of("<browser> માં", "<browser> પર"));

    private static final Map<VolumeDirection, List<String>> DIRECTION_WORDS = Map.of(
            VolumeDirection.MUTE, List.of("mute", "silence", "म्यूट", "चुप", "મ્યૂટ"),
            VolumeDirection.UP, List.of("up", "increase", "raise", "louder", "बढ़ाओ", "बढ़ा दो", "बढ़ाएं",
                    "तेज़", "तेज", "વધારો", "વધારે"),
            VolumeDirection.DOWN, List.of("down", "decrease", "lower", "reduce", "quieter", "कम", "घटाओ",
                    "ઘટાડો", "ઓછો", "ઓછું"));

    private static final List<String> NEWS_WORDS = List.of("news", "headlines", "latest", "समाचार", "खबर",
            "ख़बर", "सुर्खियां", "સમાચાર", "હેડલાઇન્સ");

    private static final List<String> FILLER_WORDS = List.of("please", "कृपया", "ज़रा", "કૃપા કરીને", "જરા");

    private final TriggerRuleTable table;
    private final EntityCatalog catalog;
    private final Map<Language, List<TriggerPattern>> browserPatterns = new EnumMap<>(Language.class);
    private final Map<VolumeDirection, List<TriggerPattern>> directionPatterns = new EnumMap<>(VolumeDirection.class);
    private final List<TriggerPattern> newsPatterns;
    private final List<TriggerPattern> fillerPatterns;

    /**
     * @param table trigger table shared with the resolver
     */
    public DefaultParameterExtractor(TriggerRuleTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.catalog = table.catalog();
        BROWSER_PHRASES.forEach((language, phrases) -> browserPatterns.put(language, compileAll(phrases)));
        DIRECTION_WORDS.forEach((direction, words) -> directionPatterns.put(direction, compileAll(words)));
        this.newsPatterns = compileAll(NEWS_WORDS);
        this.fillerPatterns = compileAll(FILLER_WORDS);
    }

    @Override
    public ExtractionResult extract(Intent intent, NormalizedUtterance utterance) {
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(utterance, "utterance must not be null");
        String text = utterance.text();
        Language language = utterance.language();

        Map<String, String> slots = new LinkedHashMap<>();
        switch (intent) {
            case OPEN_APP, CLOSE_APP -> captureEntity(intent, text, language, EntityKind.APP, Slots.APP, slots);
            case OPEN_WEBSITE -> {
                captureEntity(intent, text, language, EntityKind.SITE, Slots.SITE, slots);
                captureEntity(intent, text, language, EntityKind.BROWSER, Slots.BROWSER, slots);
                if (!slots.containsKey(Slots.BROWSER)) {
                    browserPhrase(text, language).ifPresent(b -> slots.put(Slots.BROWSER, b));
                }
            }
            case VOLUME_CONTROL -> direction(text).ifPresent(d -> slots.put(Slots.DIRECTION, d.slotValue()));
            case WEB_SEARCH, KNOWLEDGE -> {
                String query = query(intent, text, language);
                if (!query.isEmpty()) {
                    slots.put(Slots.QUERY, query);
                }
                if (intent == Intent.WEB_SEARCH) {
                    slots.put(Slots.SEARCH_KIND, isNews(text) ? "news" : "general");
                }
            }
            default -> {
                // no slots
            }
        }

        List<String> missing = intent.requiredSlots().stream()
                .filter(s -> !slots.containsKey(s))
                .sorted()
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            LOG.debug("Missing slot(s) {} for {} (lang={})", missing, intent, language.tag());
            return ExtractionResult.missing(intent, missing, slots);
        }
        return ExtractionResult.complete(new ParsedCommand(intent, slots, text, language));
    }

    private void captureEntity(Intent intent, String text, Language language, EntityKind kind, String slot,
                               Map<String, String> into) {
        for (TriggerRule rule : rulesFor(intent, language)) {
            if (!rule.pattern().slotNames().contains(slot)) {
                continue;
            }
            Optional<String> value = rule.pattern().find(text)
                    .map(o -> o.slots().get(slot))
                    .flatMap(span -> catalog.canonical(kind, span));
            if (value.isPresent()) {
                into.put(slot, value.get());
                return;
            }
        }
    }

    private Optional<String> browserPhrase(String text, Language language) {
        for (TriggerPattern pattern : browserPatterns.getOrDefault(language, List.of())) {
            Optional<String> value = pattern.find(text)
                    .map(o -> o.slots().get(Slots.BROWSER))
                    .flatMap(span -> catalog.canonical(EntityKind.BROWSER, span));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Mute wins outright; otherwise the earliest up/down keyword decides.
     */
    Optional<VolumeDirection> direction(String text) {
        if (occursIn(directionPatterns.get(VolumeDirection.MUTE), text)) {
            return Optional.of(VolumeDirection.MUTE);
        }
        int up = earliest(directionPatterns.get(VolumeDirection.UP), text);
        int down = earliest(directionPatterns.get(VolumeDirection.DOWN), text);
        if (up < 0 && down < 0) {
            return Optional.empty();
        }
        if (down < 0 || (up >= 0 && up < down)) {
            return Optional.of(VolumeDirection.UP);
        }
        return Optional.of(VolumeDirection.DOWN);
    }

    String query(Intent intent, String text, Language language) {
        String remaining = text;
        for (TriggerRule rule : rulesFor(intent, language)) {
            if (rule.command()) {
                remaining = rule.pattern().removeFrom(remaining);
            }
        }
        for (TriggerPattern filler : fillerPatterns) {
            remaining = filler.removeFrom(remaining);
        }
        return remaining.replaceAll("\\s+", " ").trim();
    }

    private boolean isNews(String text) {
        return occursIn(newsPatterns, text);
    }

    private List<TriggerRule> rulesFor(Intent intent, Language language) {
        return table.rulesFor(language).stream()
                .filter(r -> r.intent() == intent)
                .collect(Collectors.toList());
    }

    private static boolean occursIn(List<TriggerPattern> patterns, String text) {
        return earliest(patterns, text) >= 0;
    }

    private static int earliest(List<TriggerPattern> patterns, String text) {
        return patterns.stream()
                .flatMap(p -> p.find(text).stream())
                .mapToInt(TriggerPattern.Occurrence::start)
                .min()
                .orElse(-1);
    }

    private List<TriggerPattern> compileAll(List<String> phrases) {
        List<TriggerPattern> compiled = new ArrayList<>(phrases.size());
        for (String phrase : phrases) {
            compiled.add(TriggerPattern.compile(phrase, catalog));
        }
        return List.copyOf(compiled);
    }
}
