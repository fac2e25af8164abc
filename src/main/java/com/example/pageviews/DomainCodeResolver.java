package com.example.pageviews;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves a domain code such as {@code en}, {@code fr.m.v} or {@code commons.m} into its
 * language, project domain and mobile flag.
 *
 * Codes have 1-3 dot separated parts, see
 * https://wikitech.wikimedia.org/wiki/Data_Platform/Data_Lake/Traffic/Pageviews
 */
public final class DomainCodeResolver {

    /** Project short codes used as the second (desktop) or third (mobile) part. */
    static final Map<String, String> PROJECT_DOMAINS = Map.ofEntries(
            Map.entry("b", "wikibooks.org"),
            Map.entry("d", "wiktionary.org"),
            Map.entry("f", "wikimediafoundation.org"),
            Map.entry("m", "wikimedia.org"),
            Map.entry("n", "wikinews.org"),
            Map.entry("q", "wikiquote.org"),
            Map.entry("s", "wikisource.org"),
            Map.entry("v", "wikiversity.org"),
            Map.entry("voy", "wikivoyage.org"),
            Map.entry("w", "mediawiki.org"),
            Map.entry("wd", "wikidata.org"));

    /** Cross-language projects addressed without a language prefix, e.g. "commons.m" or "meta.m.m". */
    static final Map<String, String> META_PROJECTS = Map.of(
            "commons", "commons.wikimedia.org",
            "meta", "meta.wikimedia.org",
            "incubator", "incubator.wikimedia.org",
            "species", "species.wikimedia.org",
            "strategy", "strategy.wikimedia.org",
            "outreach", "outreach.wikimedia.org",
            "usability", "usability.wikimedia.org",
            "quality", "quality.wikimedia.org");

    static final String DEFAULT_LANGUAGE = "en";
    static final String WIKIPEDIA = "wikipedia.org";
    // Undocumented upstream code: a bare quoted blank that appears to be wikifunctions.
    static final String QUOTED_BLANK = "\"\"";
    static final String WIKIFUNCTIONS = "wikifunctions.org";

    private DomainCodeResolver() {}

    /**
     * @return the resolved code, or empty when the code has none of the documented shapes
     */
    public static Optional<DomainCode> resolve(String domainCode) {
        String[] parts = domainCode.split("\\.", 3);
        String first = parts[0];

        String metaDomain = META_PROJECTS.get(first);
        if (metaDomain != null) {
            return Optional.of(new DomainCode(DEFAULT_LANGUAGE, metaDomain, parts.length == 3));
        }

        switch (parts.length) {
            case 1:
                if (QUOTED_BLANK.equals(first)) {
                    return Optional.of(new DomainCode(DEFAULT_LANGUAGE, WIKIFUNCTIONS, false));
                }
                return Optional.of(new DomainCode(first, WIKIPEDIA, false));
            case 2:
                String second = parts[1];
                if ("m".equals(second) || "zero".equals(second)) {
                    return Optional.of(new DomainCode(first, WIKIPEDIA, true));
                }
                return Optional.of(new DomainCode(first, PROJECT_DOMAINS.get(second), false));
            case 3:
                return Optional.of(new DomainCode(first, PROJECT_DOMAINS.get(parts[2]), true));
            default:
                return Optional.empty();
        }
    }
}
