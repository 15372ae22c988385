package com.phillippitts.vani.service.intent;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static alias table of the applications, websites and browsers the assistant can name.
 *
 * <p>Aliases cover the English spelling plus the Devanagari and Gujarati transliterations a
 * speech engine produces, and map to one canonical name each ("google chrome" and "क्रोम"
 * both map to {@code chrome}, "youtube" maps to {@code youtube.com}). Website slots also accept
 * any bare domain such as {@code example.org}, which is its own canonical form.
 *
 * <p>Immutable after construction; thread-safe.
 */
public final class EntityCatalog {

    /** Slot kinds a trigger pattern may reference. */
    public enum EntityKind { APP, SITE, BROWSER }

    private static final String DOMAIN_REGEX =
            "[a-z0-9-]+(?:\\.[a-z0-9-]+)*\\.(?:com|org|net|io|in|co|dev|edu|gov|ai)";
    private static final Pattern DOMAIN = Pattern.compile(DOMAIN_REGEX);

    private final Map<String, String> apps;
    private final Map<String, String> sites;
    private final Map<String, String> browsers;

    private EntityCatalog(Map<String, String> apps, Map<String, String> sites, Map<String, String> browsers) {
        this.apps = Collections.unmodifiableMap(new LinkedHashMap<>(apps));
        this.sites = Collections.unmodifiableMap(new LinkedHashMap<>(sites));
        this.browsers = Collections.unmodifiableMap(new LinkedHashMap<>(browsers));
    }

    /**
     * The catalog shipped with the assistant.
     */
    public static EntityCatalog defaults() {
        return builder()
                .app("firefox", "firefox", "mozilla firefox", "फ़ायरफ़ॉक्स", "फायरफॉक्स", "ફાયરફોક્સ")
                .app("chrome", "chrome", "google chrome", "क्रोम", "ક્રોમ")
                .app("chromium", "chromium")
                .app("terminal", "terminal", "टर्मिनल", "ટર્મિનલ")
                .app("files", "files", "file manager", "फ़ाइल मैनेजर", "ફાઇલ મેનેજર")
                .app("calculator", "calculator", "कैलकुलेटर", "કેલ્ક્યુલેટર")
                .app("text editor", "text editor", "gedit", "टेक्स्ट एडिटर", "ટેક્સ્ટ એડિટર")
                .app("code", "vs code", "visual studio code", "code")
                .app("settings", "settings", "सेटिंग्स", "સેટિંગ્સ")
                .site("youtube.com", "youtube", "यूट्यूब", "યુટ્યુબ")
                .site("google.com", "google", "गूगल", "ગૂગલ")
                .site("gmail.com", "gmail", "जीमेल", "જીમેલ")
                .site("facebook.com", "facebook", "फेसबुक", "ફેસબુક")
                .site("twitter.com", "twitter", "ट्विटर", "ટ્વિટર")
                .site("github.com", "github", "गिटहब", "ગિટહબ")
                .browser("firefox", "firefox", "फ़ायरफ़ॉक्स", "फायरफॉक्स", "ફાયરફોક્સ")
                .browser("chrome", "chrome", "google chrome", "क्रोम", "ક્રોમ")
                .browser("chromium", "chromium")
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Regex alternation matching any alias of the given kind, longest alias first so
     * "google chrome" wins over "google". Website aliases that prefix an application or browser
     * alias carry a negative lookahead, and website slots also accept bare domains.
     */
    String alternation(EntityKind kind) {
        return switch (kind) {
            case APP -> alternationOf(apps.keySet(), List.of());
            case BROWSER -> alternationOf(browsers.keySet(), List.of());
            case SITE -> {
                List<String> longer = new ArrayList<>(apps.keySet());
                longer.addAll(browsers.keySet());
                yield alternationOf(sites.keySet(), longer) + "|" + DOMAIN_REGEX;
            }
        };
    }

    /**
     * Resolves an alias span to its canonical name.
     *
     * @param kind  entity kind
     * @param alias matched span (already normalized)
     * @return canonical name, or empty if the span is not a known alias (or domain, for sites)
     */
    public Optional<String> canonical(EntityKind kind, String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        String key = normalize(alias);
        return switch (kind) {
            case APP -> Optional.ofNullable(apps.get(key));
            case BROWSER -> Optional.ofNullable(browsers.get(key));
            case SITE -> {
                String site = sites.get(key);
                if (site != null) {
                    yield Optional.of(site);
                }
                yield DOMAIN.matcher(key).matches() ? Optional.of(key) : Optional.empty();
            }
        };
    }

    private static String alternationOf(Set<String> aliases, List<String> longerNames) {
        List<String> sorted = new ArrayList<>(aliases);
        sorted.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        List<String> parts = new ArrayList<>(sorted.size());
        for (String alias : sorted) {
            List<String> suffixes = new ArrayList<>();
            for (String longer : longerNames) {
                if (longer.startsWith(alias + " ")) {
                    suffixes.add(Pattern.quote(longer.substring(alias.length() + 1)));
                }
            }
            String part = Pattern.quote(alias);
            if (!suffixes.isEmpty()) {
                part += "(?!\\s+(?:" + String.join("|", suffixes) + "))";
            }
            parts.add(part);
        }
        return String.join("|", parts);
    }

    static String normalize(String s) {
        return Normalizer.normalize(s, Normalizer.Form.NFC).toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Collects aliases. Each alias maps to exactly one canonical name per kind.
     */
    public static final class Builder {
        private final Map<String, String> apps = new LinkedHashMap<>();
        private final Map<String, String> sites = new LinkedHashMap<>();
        private final Map<String, String> browsers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder app(String canonical, String... aliases) {
            put(apps, canonical, aliases);
            return this;
        }

        public Builder site(String canonical, String... aliases) {
            put(sites, canonical, aliases);
            return this;
        }

        public Builder browser(String canonical, String... aliases) {
            put(browsers, canonical, aliases);
            return this;
        }

        public EntityCatalog build() {
            return new EntityCatalog(apps, sites, browsers);
        }

        private static void put(Map<String, String> target, String canonical, String... aliases) {
            Objects.requireNonNull(canonical, "canonical must not be null");
            for (String alias : aliases) {
                String key = normalize(alias);
                String previous = target.putIfAbsent(key, canonical);
                if (previous != null && !previous.equals(canonical)) {
                    throw new IllegalArgumentException(
                            "Alias '" + alias + "' already maps to '" + previous + "'");
                }
            }
        }
    }
}
