package com.example.pageviews;

/**
 * Parses lines of an hourly pageviews dump.
 *
 * A line has four space separated columns: domain code, page title, view count and a response
 * size that is ignored. Page titles may be wrapped in double quotes, in which case an embedded
 * quote is written as {@code \"}.
 */
public final class LineParser {

    static final String DOMAIN_CODE = "domain code";
    static final String PAGE_TITLE = "page title";
    static final String VIEWS = "views";

    private LineParser() {}

    public static Pageview parse(String line) throws PageviewException {
        String[] fields = line.split(" ", 4);

        String domainCode = fields[0];
        if (fields.length < 2) {
            throw new MissingFieldException(PAGE_TITLE);
        }
        String pageTitle = normalizeTitle(fields[1]);
        if (fields.length < 3) {
            throw new MissingFieldException(VIEWS);
        }
        long views = parseViews(fields[2]);

        DomainCode parsed = DomainCodeResolver.resolve(domainCode)
                .orElseThrow(() -> new InvalidFieldException(DOMAIN_CODE));
        return new Pageview(domainCode, pageTitle, views, parsed);
    }

    public static Result<Pageview> tryParse(String line) {
        return Result.of(line, LineParser::parse);
    }

    /**
     * Strips one layer of surrounding quotes and unescapes {@code \"}. Unquoted values are returned
     * as they are. Only observed in the dumps, not documented upstream.
     */
    static String normalizeTitle(String value) {
        if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"') {
            return value.substring(1, value.length() - 1).replace("\\\"", "\"");
        }
        return value;
    }

    private static long parseViews(String value) throws InvalidFieldException {
        try {
            return Integer.toUnsignedLong(Integer.parseUnsignedInt(value));
        } catch (NumberFormatException e) {
            throw new InvalidFieldException(VIEWS, e);
        }
    }
}
