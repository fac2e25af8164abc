package com.example.pageviews;

import java.io.IOException;

/**
 * The line source could not produce the next line.
 */
public class ReadFailureException extends PageviewException {

    public ReadFailureException(IOException cause) {
        super("Failed to read line: " + cause.getMessage(), cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
