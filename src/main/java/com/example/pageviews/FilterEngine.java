package com.example.pageviews;

import lombok.Getter;

/**
 * Evaluates a {@link FilterSpec} in two stages: {@link #prePass(String)} on raw lines and
 * {@link #postPass(Pageview)} on parsed records. Failed results pass both stages untouched so
 * that no error is lost to filtering.
 */
public final class FilterEngine {

    @Getter
    private final FilterSpec spec;

    public FilterEngine(FilterSpec spec) {
        this.spec = spec == null ? FilterSpec.NONE : spec;
    }

    public boolean prePass(String line) {
        return spec.getLineRegex() == null || spec.getLineRegex().matcher(line).find();
    }

    public boolean postPass(Pageview pageview) {
        if (spec.getDomainCodes() != null && !spec.getDomainCodes().contains(pageview.getDomainCode())) {
            return false;
        }
        if (spec.getPageTitle() != null && !spec.getPageTitle().matcher(pageview.getPageTitle()).find()) {
            return false;
        }
        if (spec.getMinViews() != null && pageview.getViews() < spec.getMinViews()) {
            return false;
        }
        if (spec.getMaxViews() != null && pageview.getViews() > spec.getMaxViews()) {
            return false;
        }
        if (spec.getLanguages() != null && !spec.getLanguages().contains(pageview.getLanguage())) {
            return false;
        }
        if (spec.getDomains() != null
                && (pageview.getDomain() == null || !spec.getDomains().contains(pageview.getDomain()))) {
            return false;
        }
        return spec.getMobile() == null || spec.getMobile() == pageview.isMobile();
    }

    public boolean acceptsLine(Result<String> line) {
        return line.isFailed() || prePass(line.get());
    }

    public boolean acceptsRecord(Result<Pageview> record) {
        return record.isFailed() || postPass(record.get());
    }
}
