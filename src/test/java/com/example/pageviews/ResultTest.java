package com.example.pageviews;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ResultTest {

    @Test
    void mapTransformsValues() {
        assertEquals(Result.ok(3), Result.ok("abc").map(String::length));
    }

    @Test
    void failuresSurviveMapAndFlatMap() {
        MissingFieldException error = new MissingFieldException("views");
        Result<String> failed = Result.failed(error);

        assertSame(error, failed.map(String::length).getError());
        assertSame(error, failed.flatMap(LineParser::parse).getError());
    }

    @Test
    void flatMapCapturesThrownFailure() {
        Result<Pageview> parsed = Result.ok("en").flatMap(LineParser::parse);
        assertTrue(parsed.isFailed());
        assertEquals("Missing page title", parsed.getError().getMessage());
    }

    @Test
    void rejectsNulls() {
        assertThrows(NullPointerException.class, () -> Result.ok(null));
        assertThrows(NullPointerException.class, () -> Result.failed(null));
    }
}
