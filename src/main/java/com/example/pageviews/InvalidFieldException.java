package com.example.pageviews;

import lombok.Getter;

/**
 * A column was present but could not be interpreted.
 */
@Getter
public class InvalidFieldException extends PageviewException {

    private final String field;

    public InvalidFieldException(String field) {
        super("Invalid " + field);
        this.field = field;
    }

    public InvalidFieldException(String field, Throwable cause) {
        super("Invalid " + field, cause);
        this.field = field;
    }
}
