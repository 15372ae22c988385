package com.phillippitts.vani.service.intent;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A trigger phrase compiled to a regular expression over normalized text.
 *
 * <p>Syntax, space-separated tokens:
 * <ul>
 *   <li>{@code word} - literal word, matched on word boundaries</li>
 *   <li>{@code *} - one or more arbitrary words</li>
 *   <li>{@code [the|my]} - optional literal word (alternatives separated by {@code |})</li>
 *   <li>{@code <app>}, {@code <site>}, {@code <browser>} - a known entity from the
 *       {@link EntityCatalog}, captured under that slot name</li>
 *   <li>{@code <query>} - free text captured under that slot name</li>
 *   <li>{@code <target>} - any one or two words, captured under that slot name</li>
 *   <li>a leading {@code ^} / trailing {@code $} anchors the pattern to the start / end of the
 *       utterance</li>
 * </ul>
 *
 * <p>Examples: {@code "what do you see"}, {@code "what * see"}, {@code "open [the] <app>"},
 * {@code "<app> बंद करो"}, {@code "^stop$"}.
 */
public final class TriggerPattern {

    private static final String WORD_CHAR = "[\\p{L}\\p{M}\\p{N}]";
    private static final String LEFT_BOUNDARY = "(?<!" + WORD_CHAR + ")";
    private static final String RIGHT_BOUNDARY = "(?!" + WORD_CHAR + ")";
    private static final String FREE_LAZY = "\\S+(?:\\s+\\S+)*?";
    private static final String FREE_GREEDY = "\\S+(?:\\s+\\S+)*";
    private static final String SHORT_SPAN = "\\S+(?:\\s+\\S+)?";
    private static final Set<String> FREE_SLOTS = Set.of("query");
    private static final String TARGET_SLOT = "target";

    private final String source;
    private final Pattern regex;
    private final List<String> slotNames;

    private TriggerPattern(String source, Pattern regex, List<String> slotNames) {
        this.source = source;
        this.regex = regex;
        this.slotNames = List.copyOf(slotNames);
    }

    /**
     * Compiles a trigger phrase.
     *
     * @param source  phrase in the syntax above
     * @param catalog entity aliases used for entity slots
     * @return compiled pattern
     * @throws IllegalArgumentException on malformed syntax (empty phrase, unknown slot, optional
     *                                  token in last position, duplicated slot)
     */
    public static TriggerPattern compile(String source, EntityCatalog catalog) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");
        String phrase = Normalizer.normalize(source, Normalizer.Form.NFC).toLowerCase(Locale.ROOT).trim();
        boolean anchoredStart = phrase.startsWith("^");
        boolean anchoredEnd = phrase.endsWith("$");
        phrase = phrase.substring(anchoredStart ? 1 : 0, phrase.length() - (anchoredEnd ? 1 : 0)).trim();
        if (phrase.isEmpty()) {
            throw new IllegalArgumentException("Empty trigger pattern: '" + source + "'");
        }

        String[] tokens = phrase.split("\\s+");
        List<String> slots = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        sb.append(anchoredStart ? "^" : LEFT_BOUNDARY);
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            boolean last = i == tokens.length - 1;
            if (token.startsWith("[") && token.endsWith("]")) {
                if (last) {
                    throw new IllegalArgumentException("Optional token cannot end a pattern: '" + source + "'");
                }
                sb.append("(?:").append(literalAlternatives(token.substring(1, token.length() - 1)))
                        .append(RIGHT_BOUNDARY).append("\\s+)?");
                continue;
            }
            if ("*".equals(token)) {
                sb.append(last ? FREE_GREEDY : FREE_LAZY);
            } else if (token.startsWith("<") && token.endsWith(">")) {
                String slot = token.substring(1, token.length() - 1);
                if (slots.contains(slot)) {
                    throw new IllegalArgumentException("Duplicate slot <" + slot + "> in '" + source + "'");
                }
                slots.add(slot);
                sb.append("(?<").append(slot).append(">").append(slotRegex(slot, last, catalog, source)).append(")");
            } else {
                sb.append(Pattern.quote(token));
            }
            if (!last) {
                sb.append("\\s+");
            }
        }
        sb.append(anchoredEnd ? "$" : RIGHT_BOUNDARY);
        return new TriggerPattern(source, Pattern.compile(sb.toString()), slots);
    }

    /**
     * Finds the first occurrence of this pattern in the text.
     *
     * @param normalizedText text produced by the language normalizer
     * @return span and captured slots, or empty when the pattern does not occur
     */
    public Optional<Occurrence> find(String normalizedText) {
        Matcher m = regex.matcher(normalizedText);
        if (!m.find()) {
            return Optional.empty();
        }
        Map<String, String> captured = new LinkedHashMap<>();
        for (String slot : slotNames) {
            String value = m.group(slot);
            if (value != null) {
                captured.put(slot, value);
            }
        }
        return Optional.of(new Occurrence(m.start(), m.end(), captured));
    }

    /**
     * Removes every occurrence of this pattern from the text. Used to strip command words from a
     * search query.
     */
    public String removeFrom(String normalizedText) {
        return regex.matcher(normalizedText).replaceAll(" ");
    }

    public String source() {
        return source;
    }

    public List<String> slotNames() {
        return slotNames;
    }

    @Override
    public String toString() {
        return source;
    }

    private static String slotRegex(String slot, boolean last, EntityCatalog catalog, String source) {
        if (FREE_SLOTS.contains(slot)) {
            return last ? FREE_GREEDY : FREE_LAZY;
        }
        if (TARGET_SLOT.equals(slot)) {
            return SHORT_SPAN;
        }
        try {
            EntityCatalog.EntityKind kind = EntityCatalog.EntityKind.valueOf(slot.toUpperCase(Locale.ROOT));
            return catalog.alternation(kind);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown slot <" + slot + "> in '" + source + "'", e);
        }
    }

    private static String literalAlternatives(String body) {
        List<String> quoted = new ArrayList<>();
        for (String alt : body.split("\\|")) {
            if (!alt.isBlank()) {
                quoted.add(Pattern.quote(alt.trim()));
            }
        }
        return "(?:" + String.join("|", quoted) + ")";
    }

    /**
     * Where a pattern occurred and what it captured.
     *
     * @param start start offset in the normalized text
     * @param end   end offset (exclusive)
     * @param slots captured slot spans keyed by slot name
     */
    public record Occurrence(int start, int end, Map<String, String> slots) {

        public Occurrence {
            slots = Map.copyOf(slots);
        }

        public int length() {
            return end - start;
        }
    }
}
