package com.questrail.aviationwx.config;

import com.questrail.aviationwx.observability.NullObservabilitySink;
import com.questrail.aviationwx.observability.Slf4jReportObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

final class AviationWeatherConfigTest
{
    @Test
    void defaultsLogThroughSlf4jWithUnixLineBreaks()
    {
        AviationWeatherConfig config = AviationWeatherConfig.defaults();

        assertInstanceOf(Slf4jReportObservabilitySink.class, config.observabilitySink());
        assertEquals(Clock.systemUTC(), config.clock());
        assertEquals("\n", config.lineSeparator());
        assertFalse(config.includeRawText());
    }

    @Test
    void builderOverridesEachField()
    {
        Clock fixed = Clock.fixed(Instant.parse("2024-03-20T16:52:00Z"), ZoneOffset.UTC);
        AviationWeatherConfig config = AviationWeatherConfig.builder()
                .withObservabilitySink(NullObservabilitySink.INSTANCE)
                .withClock(fixed)
                .withLineSeparator("\r\n")
                .withIncludeRawText(true)
                .build();

        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
        assertSame(fixed, config.clock());
        assertEquals("\r\n", config.lineSeparator());
        assertTrue(config.includeRawText());
    }

    @Test
    void rejectsNullCollaborators()
    {
        assertThrows(NullPointerException.class,
                () -> AviationWeatherConfig.builder().withObservabilitySink(null).build());
        assertThrows(NullPointerException.class,
                () -> AviationWeatherConfig.builder().withClock(null).build());
        assertThrows(NullPointerException.class,
                () -> AviationWeatherConfig.builder().withLineSeparator(null).build());
    }
}
