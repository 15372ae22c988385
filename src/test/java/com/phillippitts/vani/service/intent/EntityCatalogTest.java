package com.phillippitts.vani.service.intent;

import org.junit.jupiter.api.Test;

import static com.phillippitts.vani.service.intent.EntityCatalog.EntityKind.APP;
import static com.phillippitts.vani.service.intent.EntityCatalog.EntityKind.BROWSER;
import static com.phillippitts.vani.service.intent.EntityCatalog.EntityKind.SITE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityCatalogTest {

    private final EntityCatalog catalog = EntityCatalog.defaults();

    @Test
    void shouldMapSiteAliasToCanonicalDomain() {
        assertThat(catalog.canonical(SITE, "youtube")).contains("youtube.com");
        assertThat(catalog.canonical(SITE, "यूट्यूब")).contains("youtube.com");
        assertThat(catalog.canonical(SITE, "યુટ્યુબ")).contains("youtube.com");
    }

    @Test
    void shouldAcceptBareDomainsAsSites() {
        assertThat(catalog.canonical(SITE, "example.org")).contains("example.org");
        assertThat(catalog.canonical(SITE, "example")).isEmpty();
    }

    @Test
    void shouldMapTransliteratedAppNames() {
        assertThat(catalog.canonical(APP, "क्रोम")).contains("chrome");
        assertThat(catalog.canonical(APP, "Google Chrome")).contains("chrome");
        assertThat(catalog.canonical(BROWSER, "ફાયરફોક્સ")).contains("firefox");
    }

    @Test
    void shouldReturnEmptyForUnknownOrNullAlias() {
        assertThat(catalog.canonical(APP, "photoshop")).isEmpty();
        assertThat(catalog.canonical(APP, null)).isEmpty();
    }

    @Test
    void shouldPreferLongerAppNameOverSitePrefix() {
        // "google" is a site, but "google chrome" is an application
        String siteRegex = catalog.alternation(SITE);

        assertThat("google".matches(siteRegex)).isTrue();
        assertThat(java.util.regex.Pattern.compile("^(?:" + siteRegex + ")").matcher("google chrome").lookingAt())
                .isFalse();
    }

    @Test
    void shouldRejectConflictingAlias() {
        assertThatThrownBy(() -> EntityCatalog.builder()
                .app("chrome", "browser")
                .app("firefox", "browser")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("browser");
    }
}
