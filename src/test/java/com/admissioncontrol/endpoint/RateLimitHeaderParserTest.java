package com.admissioncontrol.endpoint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitHeaderParserTest {

    @Test
    @DisplayName("Should parse a well-formed header")
    void shouldParseHeader() {
        EndpointLimits limits = RateLimitHeaderParser.parse("limit=160; remaining=159; reset=8");

        assertEquals(160, limits.getLimit());
        assertEquals(159, limits.getRemaining());
        assertEquals(8, limits.getReset());
    }

    @Test
    @DisplayName("Should tolerate case, whitespace, floats and extra fields")
    void shouldBeLenientAboutFormatting() {
        EndpointLimits limits = RateLimitHeaderParser.parse(" LIMIT = 60.9 ;Remaining=0;reset=1.5; window=60 ; junk");

        assertEquals(new EndpointLimits(60, 0, 1), limits);
    }

    @Test
    @DisplayName("Should reject a non-numeric value")
    void shouldRejectNonNumeric() {
        MalformedRateLimitHeaderException e = assertThrows(MalformedRateLimitHeaderException.class,
                () -> RateLimitHeaderParser.parse("limit=abc; remaining=159; reset=8"));

        assertTrue(e.getMessage().contains("non-numeric"));
    }

    @Test
    @DisplayName("Should list the missing fields")
    void shouldReportMissingFields() {
        MalformedRateLimitHeaderException e = assertThrows(MalformedRateLimitHeaderException.class,
                () -> RateLimitHeaderParser.parse("limit=160"));

        assertEquals("Missing required fields: remaining, reset", e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "garbage", "limit=; remaining=1; reset=1", "limit=NaN; remaining=1; reset=1"})
    @DisplayName("Should reject malformed headers")
    void shouldRejectMalformed(String header) {
        assertThrows(MalformedRateLimitHeaderException.class, () -> RateLimitHeaderParser.parse(header));
    }
}
