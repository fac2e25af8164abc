package com.example.pageviews;

import lombok.Getter;

/**
 * A line ended before one of its required columns.
 */
@Getter
public class MissingFieldException extends PageviewException {

    private final String field;

    public MissingFieldException(String field) {
        super("Missing " + field);
        this.field = field;
    }
}
