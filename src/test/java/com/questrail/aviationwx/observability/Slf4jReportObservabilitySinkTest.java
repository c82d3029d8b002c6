package com.questrail.aviationwx.observability;

import com.questrail.aviationwx.codec.MissingStationException;
import com.questrail.aviationwx.model.FieldDefect;
import com.questrail.aviationwx.model.StationId;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jReportObservabilitySinkTest
{
    private final Slf4jReportObservabilitySink sink = new Slf4jReportObservabilitySink();
    private final Instant now = Instant.parse("2024-03-20T16:52:00Z");

    @Test
    void logsEveryEventKindWithoutThrowing()
    {
        StationId station = StationId.of("EGMC");

        assertDoesNotThrow(() -> {
            sink.onReportDecoded(new ReportDecodedEvent(now, ReportKind.METAR, station, 9, 0));
            sink.onReportDecoded(new ReportDecodedEvent(now, ReportKind.TAF, station, 14, 2));
            sink.onFieldDefect(new FieldDefectEvent(now, ReportKind.METAR,
                    new FieldDefect("wind", "XXXKT", "expected dddff[Gfmfm]KT")));
            sink.onError(new ReportErrorEvent(now, ReportKind.METAR, "METAR 201650Z", "no station",
                    new MissingStationException("no station")));
        });
    }

    @Test
    void decodedEventIsCleanOnlyWithoutDefects()
    {
        StationId station = StationId.of("EGMC");

        assertTrue(new ReportDecodedEvent(now, ReportKind.METAR, station, 9, 0).isClean());
        assertFalse(new ReportDecodedEvent(now, ReportKind.METAR, station, 9, 1).isClean());
    }

    @Test
    void nullSinkIgnoresEverything()
    {
        assertDoesNotThrow(() -> {
            NullObservabilitySink.INSTANCE.onReportDecoded(null);
            NullObservabilitySink.INSTANCE.onFieldDefect(null);
            NullObservabilitySink.INSTANCE.onError(null);
        });
    }
}
