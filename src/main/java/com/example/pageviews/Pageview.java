package com.example.pageviews;

import lombok.Value;

/**
 * One parsed line of a pageviews dump.
 *
 * {@code domainCode} is the raw first column, {@code pageTitle} is already de-escaped and
 * {@code views} holds an unsigned 32-bit count.
 */
@Value
public class Pageview {
    String domainCode;
    String pageTitle;
    long views;
    DomainCode parsed;

    public String getLanguage() {
        return parsed.getLanguage();
    }

    public String getDomain() {
        return parsed.getDomain();
    }

    public boolean isMobile() {
        return parsed.isMobile();
    }
}
