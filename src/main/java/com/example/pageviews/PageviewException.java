package com.example.pageviews;

/**
 * Base class for failures tied to a single line of a pageviews dump. These never abort a stream;
 * they travel inside {@link Result} values in input order.
 */
public class PageviewException extends Exception {

    public PageviewException(String message) {
        super(message);
    }

    public PageviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
