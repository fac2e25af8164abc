package com.example.pageviews;

import lombok.Value;

/**
 * Semantic parts of a domain code: language edition, project domain and platform.
 * {@code domain} is null when the project part of the code is not recognized.
 */
@Value
public class DomainCode {
    String language;
    String domain;
    boolean mobile;
}
