package com.phillippitts.vani.service.language;

import com.phillippitts.vani.domain.Language;
import com.phillippitts.vani.domain.NormalizedUtterance;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Detects the language of a transcript from its Unicode script and produces the normalized
 * text the resolver and extractor work on.
 *
 * <p><b>Detection rule:</b> every code point in the Devanagari block counts for Hindi, every
 * code point in the Gujarati block counts for Gujarati, and every Latin letter counts for
 * English. The language with the most code points wins; ties resolve to English. Input with no
 * counted code points at all (digits, punctuation) falls back to the STT hint, then English.
 *
 * <p><b>Normalization:</b> NFC composition, case folding, trim, internal whitespace collapsed to
 * one space, and terminal punctuation (including the Devanagari danda) stripped.
 *
 * <p>Pure function; thread-safe.
 *
 * @since 1.0
 */
public final class LanguageNormalizer {

    private static final int DEVANAGARI_START = 0x0900;
    private static final int DEVANAGARI_END = 0x097F;
    private static final int GUJARATI_START = 0x0A80;
    private static final int GUJARATI_END = 0x0AFF;

    private static final String TERMINAL_PUNCTUATION = ".!?,;:।॥\"'…";

    /**
     * Normalizes a transcript with no language hint.
     */
    public NormalizedUtterance normalize(String raw) {
        return normalize(raw, null);
    }

    /**
     * Normalizes a transcript.
     *
     * @param raw  transcript text (nullable; null is treated as empty)
     * @param hint language reported by the STT engine, used only when the text has no script
     *             evidence (nullable)
     * @return normalized text and detected language; {@link NormalizedUtterance#isEmpty()} when
     *         nothing but whitespace or punctuation was given
     */
    public NormalizedUtterance normalize(String raw, Language hint) {
        Language fallback = hint == null ? Language.ENGLISH : hint;
        if (raw == null || raw.isBlank()) {
            return NormalizedUtterance.empty(fallback);
        }
        String composed = Normalizer.normalize(raw, Normalizer.Form.NFC);
        Language language = detect(composed, fallback);
        String text = stripTerminalPunctuation(collapseWhitespace(composed.toLowerCase(Locale.ROOT)));
        if (text.isEmpty()) {
            return NormalizedUtterance.empty(language);
        }
        return new NormalizedUtterance(text, language);
    }

    /**
     * Applies the script-majority rule.
     *
     * @param text     text to inspect
     * @param fallback language returned when no script evidence exists
     * @return detected language
     */
    Language detect(String text, Language fallback) {
        int latin = 0;
        int devanagari = 0;
        int gujarati = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            if (cp >= DEVANAGARI_START && cp <= DEVANAGARI_END) {
                devanagari++;
            } else if (cp >= GUJARATI_START && cp <= GUJARATI_END) {
                gujarati++;
            } else if (Character.isLetter(cp)
                    && Character.UnicodeScript.of(cp) == Character.UnicodeScript.LATIN) {
                latin++;
            }
            i += Character.charCount(cp);
        }
        if (latin == 0 && devanagari == 0 && gujarati == 0) {
            return fallback;
        }
        if (devanagari > latin && devanagari > gujarati) {
            return Language.HINDI;
        }
        if (gujarati > latin && gujarati > devanagari) {
            return Language.GUJARATI;
        }
        return Language.ENGLISH;
    }

    private static String collapseWhitespace(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean pendingSpace = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                pendingSpace = sb.length() > 0;
            } else {
                if (pendingSpace) {
                    sb.append(' ');
                    pendingSpace = false;
                }
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String stripTerminalPunctuation(String s) {
        int end = s.length();
        while (end > 0) {
            char c = s.charAt(end - 1);
            if (TERMINAL_PUNCTUATION.indexOf(c) >= 0 || c == ' ') {
                end--;
            } else {
                break;
            }
        }
        return s.substring(0, end);
    }
}
