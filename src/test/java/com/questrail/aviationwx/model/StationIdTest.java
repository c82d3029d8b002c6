package com.questrail.aviationwx.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class StationIdTest
{
    @Test
    void roundTripsFourUppercaseLetters()
    {
        for (String code : new String[] {"EGMC", "KJFK", "LFPG", "AAAA", "ZZZZ"}) {
            StationId id = StationId.of(code);
            assertEquals(code, id.value());
            assertEquals(code, id.toString());
        }
    }

    @Test
    void rejectsAnythingElse()
    {
        assertThrows(IllegalArgumentException.class, () -> StationId.of("EGM"));
        assertThrows(IllegalArgumentException.class, () -> StationId.of("EGMCX"));
        assertThrows(IllegalArgumentException.class, () -> StationId.of("egmc"));
        assertThrows(IllegalArgumentException.class, () -> StationId.of("EG1C"));
        assertThrows(IllegalArgumentException.class, () -> StationId.of(""));
        assertThrows(NullPointerException.class, () -> StationId.of(null));
    }

    @Test
    void equalityIsByValue()
    {
        assertEquals(StationId.of("EGMC"), StationId.of("EGMC"));
        assertEquals(StationId.of("EGMC").hashCode(), StationId.of("EGMC").hashCode());
        assertNotEquals(StationId.of("EGMC"), StationId.of("EGLL"));
    }
}
