package com.example.pageviews;

import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Predicates used to select a subset of a pageviews dump. Every field is optional; a null field
 * accepts everything.
 *
 * {@code lineRegex} is tested against the raw line before parsing, which is much cheaper than
 * parsing every line when only a small part of the file is wanted. All other fields are tested
 * against parsed {@link Pageview}s and combined with AND.
 */
@Value
@Builder(toBuilder = true)
public class FilterSpec {

    /** Accepts everything. */
    public static final FilterSpec NONE = FilterSpec.builder().build();

    Pattern lineRegex;
    Set<String> domainCodes;
    Pattern pageTitle;
    Long minViews;
    Long maxViews;
    Set<String> languages;
    Set<String> domains;
    Boolean mobile;

    public boolean hasPreFilters() {
        return lineRegex != null;
    }

    public boolean hasPostFilters() {
        return domainCodes != null
                || pageTitle != null
                || minViews != null
                || maxViews != null
                || languages != null
                || domains != null
                || mobile != null;
    }

    public static class FilterSpecBuilder {

        public FilterSpecBuilder lineRegex(String regex) {
            this.lineRegex = Pattern.compile(regex);
            return this;
        }

        public FilterSpecBuilder lineRegex(Pattern regex) {
            this.lineRegex = regex;
            return this;
        }

        public FilterSpecBuilder pageTitle(String regex) {
            this.pageTitle = Pattern.compile(regex);
            return this;
        }

        public FilterSpecBuilder pageTitle(Pattern regex) {
            this.pageTitle = regex;
            return this;
        }

        public FilterSpecBuilder domainCodes(String... values) {
            this.domainCodes = setOf(values);
            return this;
        }

        public FilterSpecBuilder domainCodes(Set<String> values) {
            this.domainCodes = values == null ? null : Set.copyOf(values);
            return this;
        }

        public FilterSpecBuilder languages(String... values) {
            this.languages = setOf(values);
            return this;
        }

        public FilterSpecBuilder languages(Set<String> values) {
            this.languages = values == null ? null : Set.copyOf(values);
            return this;
        }

        public FilterSpecBuilder domains(String... values) {
            this.domains = setOf(values);
            return this;
        }

        public FilterSpecBuilder domains(Set<String> values) {
            this.domains = values == null ? null : Set.copyOf(values);
            return this;
        }

        private static Set<String> setOf(String... values) {
            return Set.copyOf(new LinkedHashSet<>(Arrays.asList(values)));
        }
    }
}
