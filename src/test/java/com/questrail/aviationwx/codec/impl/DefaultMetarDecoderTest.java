package com.questrail.aviationwx.codec.impl;

import com.questrail.aviationwx.codec.EmptyReportException;
import com.questrail.aviationwx.codec.MalformedTimeException;
import com.questrail.aviationwx.codec.MissingStationException;
import com.questrail.aviationwx.codec.MissingTimeException;
import com.questrail.aviationwx.model.Altimeter;
import com.questrail.aviationwx.model.ClearSky;
import com.questrail.aviationwx.model.CloudCoverage;
import com.questrail.aviationwx.model.CloudLayer;
import com.questrail.aviationwx.model.DayTime;
import com.questrail.aviationwx.model.DirectionRange;
import com.questrail.aviationwx.model.FieldDefect;
import com.questrail.aviationwx.model.MetarRecord;
import com.questrail.aviationwx.model.ReportModifier;
import com.questrail.aviationwx.model.ReportType;
import com.questrail.aviationwx.model.SpeedUnit;
import com.questrail.aviationwx.model.StationId;
import com.questrail.aviationwx.model.TemperatureDewpoint;
import com.questrail.aviationwx.model.Visibility;
import com.questrail.aviationwx.model.WeatherPhenomenon;
import com.questrail.aviationwx.model.Wind;
import com.questrail.aviationwx.observability.FieldDefectEvent;
import com.questrail.aviationwx.observability.RecordingObservabilitySink;
import com.questrail.aviationwx.observability.ReportDecodedEvent;
import com.questrail.aviationwx.observability.ReportErrorEvent;
import com.questrail.aviationwx.observability.ReportKind;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DefaultMetarDecoder}.
 *
 * These tests validate the observation boundary:
 *   raw METAR line -> MetarRecord
 */
final class DefaultMetarDecoderTest
{
    private static final String EGMC = "METAR EGMC 201650Z 31009KT 280V360 9999 BKN019 03/M00 Q1014";

    private final DefaultMetarDecoder decoder = new DefaultMetarDecoder();

    @Test
    void decodesReferenceObservation()
    {
        MetarRecord metar = decoder.decode(EGMC);

        assertEquals(ReportType.ROUTINE, metar.reportType());
        assertEquals(StationId.of("EGMC"), metar.station());
        assertEquals(new DayTime(20, 16, 50), metar.observationTime());

        Wind wind = metar.wind().orElseThrow();
        assertEquals(310, wind.directionDegrees().getAsInt());
        assertEquals(9, wind.speedKnots());
        assertTrue(wind.gustKnots().isEmpty());
        assertEquals(Optional.of(new DirectionRange(280, 360)), wind.variableBetween());

        Visibility.Distance visibility = (Visibility.Distance) metar.visibility().orElseThrow();
        assertEquals("9999", visibility.figure());
        assertEquals(Visibility.Bound.OR_MORE, visibility.bound());

        assertEquals(List.of(CloudLayer.of(CloudCoverage.BROKEN, 1900)), metar.cloudLayers());
        assertEquals(Optional.of(new TemperatureDewpoint(3, 0)), metar.temperatureDewpoint());
        assertEquals(Optional.of(Altimeter.hectopascals(1014)), metar.altimeter());

        assertEquals(EGMC, metar.rawText());
        assertTrue(metar.defects().isEmpty());
        assertTrue(metar.receiptTime().isEmpty());
    }

    @Test
    void reportTypeKeywordIsOptional()
    {
        MetarRecord metar = decoder.decode("EGMC 201650Z 31009KT 9999");

        assertEquals(ReportType.ROUTINE, metar.reportType());
        assertEquals(StationId.of("EGMC"), metar.station());
    }

    @Test
    void malformedWindIsUnsetButOtherFieldsSurvive()
    {
        MetarRecord metar = decoder.decode("METAR EGMC 201650Z XXXKT 9999 BKN019 03/M00 Q1014");

        assertTrue(metar.wind().isEmpty());
        assertEquals(StationId.of("EGMC"), metar.station());
        assertEquals(new DayTime(20, 16, 50), metar.observationTime());
        assertTrue(metar.visibility().isPresent());
        assertEquals(1, metar.cloudLayers().size());
        assertTrue(metar.altimeter().isPresent());

        assertEquals(1, metar.defects().size());
        FieldDefect defect = metar.defects().get(0);
        assertEquals("wind", defect.field());
        assertEquals("XXXKT", defect.token());
    }

    @Test
    void emptyInputFails()
    {
        assertThrows(EmptyReportException.class, () -> decoder.decode(""));
        assertThrows(EmptyReportException.class, () -> decoder.decode("    "));
    }

    @Test
    void missingStationFails()
    {
        assertThrows(MissingStationException.class, () -> decoder.decode("METAR 201650Z 31009KT 9999"));
        assertThrows(MissingStationException.class, () -> decoder.decode("METAR"));
    }

    @Test
    void missingOrMalformedTimeFails()
    {
        assertThrows(MissingTimeException.class, () -> decoder.decode("METAR EGMC 31009KT 9999"));
        assertThrows(MissingTimeException.class, () -> decoder.decode("METAR EGMC"));
        assertThrows(MalformedTimeException.class, () -> decoder.decode("METAR EGMC 201690Z 31009KT"));
        assertThrows(MalformedTimeException.class, () -> decoder.decode("METAR EGMC 20165Z 31009KT"));
    }

    @Test
    void decodesSpecialAutomatedReportWithWeatherTrendAndRemarks()
    {
        MetarRecord metar = decoder.decode(
                "SPECI KJFK 201651Z AUTO VRB03KT 1 1/2SM -SHRA BR FEW008 SCT020CB M02/M05 A2992 NOSIG RMK AO2 SLP132");

        assertEquals(ReportType.SPECIAL, metar.reportType());
        assertEquals(List.of(ReportModifier.AUTOMATED), metar.modifiers());

        Wind wind = metar.wind().orElseThrow();
        assertTrue(wind.isVariable());
        assertEquals(3, wind.speedKnots());

        Visibility.Distance visibility = (Visibility.Distance) metar.visibility().orElseThrow();
        assertEquals(1.5, visibility.value(), 1e-9);
        assertEquals(Visibility.DistanceUnit.STATUTE_MILES, visibility.unit());
        assertEquals("1 1/2", visibility.figure());

        assertEquals(2, metar.weather().size());
        WeatherPhenomenon showers = metar.weather().get(0);
        assertEquals(WeatherPhenomenon.Intensity.LIGHT, showers.intensity());
        assertEquals(Optional.of("SH"), showers.descriptor());
        assertEquals(List.of("RA"), showers.phenomena());
        assertEquals(List.of("BR"), metar.weather().get(1).phenomena());

        assertEquals(2, metar.cloudLayers().size());
        assertEquals(Optional.of(CloudLayer.ConvectiveCloud.CB), metar.cloudLayers().get(1).convective());

        assertEquals(Optional.of(new TemperatureDewpoint(-2, -5)), metar.temperatureDewpoint());
        assertEquals(Optional.of(Altimeter.inchesOfMercuryHundredths(2992)), metar.altimeter());
        assertEquals(Optional.of("NOSIG"), metar.trend());
        assertEquals(Optional.of("AO2 SLP132"), metar.remarks());
        assertTrue(metar.defects().isEmpty());
    }

    @Test
    void trendGroupsEndTheObservationBody()
    {
        MetarRecord metar = decoder.decode("METAR EGMC 201650Z 31009KT 9999 BKN019 03/M00 Q1014 TEMPO 4000 RA");

        assertEquals(Optional.of("TEMPO 4000 RA"), metar.trend());
        assertTrue(metar.weather().isEmpty());
        assertTrue(metar.defects().isEmpty());
    }

    @Test
    void gustNotAboveMeanIsKeptAndReported()
    {
        MetarRecord metar = decoder.decode("METAR EGMC 201650Z 31015G10KT 9999");

        assertEquals(10, metar.wind().orElseThrow().gustKnots().getAsInt());
        assertEquals(1, metar.defects().size());
        assertEquals("wind", metar.defects().get(0).field());
    }

    @Test
    void metricWindUnitsAreConvertedToKnots()
    {
        MetarRecord metar = decoder.decode("METAR UUEE 201650Z 18005MPS 9999");

        Wind wind = metar.wind().orElseThrow();
        assertEquals(10, wind.speedKnots());
        assertEquals(SpeedUnit.METERS_PER_SECOND, wind.encodedUnit());
    }

    @Test
    void cavokAndClearSkyCodes()
    {
        MetarRecord cavok = decoder.decode("METAR LFPG 201650Z 00000KT CAVOK 15/10 Q1020");
        assertEquals(Optional.of(Visibility.Cavok.INSTANCE), cavok.visibility());
        assertTrue(cavok.wind().orElseThrow().isCalm());

        MetarRecord nsc = decoder.decode("METAR EGMC 201650Z 31009KT 9999 NSC 03/M00 Q1014");
        assertEquals(Optional.of(ClearSky.NSC), nsc.clearSky());
        assertTrue(nsc.cloudLayers().isEmpty());
    }

    @Test
    void duplicateAndStrayGroupsAreDefectsNotFailures()
    {
        MetarRecord metar = decoder.decode("METAR EGMC 201650Z 31009KT 280V360 9999 4000 RERA 03/M00 Q1014");

        assertEquals("9999", ((Visibility.Distance) metar.visibility().orElseThrow()).figure());
        assertEquals(2, metar.defects().size());
        assertEquals("visibility", metar.defects().get(0).field());
        assertEquals("unrecognized", metar.defects().get(1).field());
    }

    @Test
    void reportsEventsToObservabilitySink()
    {
        Instant now = Instant.parse("2024-03-20T16:52:00Z");
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        DefaultMetarDecoder observed = new DefaultMetarDecoder(sink, Clock.fixed(now, ZoneOffset.UTC));

        observed.decode("METAR EGMC 201650Z XXXKT 9999");

        List<FieldDefectEvent> defects = sink.getEvents(FieldDefectEvent.class);
        assertEquals(1, defects.size());
        assertEquals("XXXKT", defects.get(0).defect().token());

        ReportDecodedEvent decoded = sink.getEvents(ReportDecodedEvent.class).get(0);
        assertEquals(ReportKind.METAR, decoded.kind());
        assertEquals(StationId.of("EGMC"), decoded.station());
        assertEquals(5, decoded.tokenCount());
        assertEquals(1, decoded.defectCount());
        assertEquals(now, decoded.timestamp());

        assertThrows(MissingStationException.class, () -> observed.decode("METAR 201650Z"));
        ReportErrorEvent error = sink.getEvents(ReportErrorEvent.class).get(0);
        assertEquals("METAR 201650Z", error.rawText());
        assertInstanceOf(MissingStationException.class, error.cause());
    }

    @Test
    void plusSuffixedVisibilityIsOpenEndedStatuteMiles()
    {
        MetarRecord metar = decoder.decode("METAR KJFK 201651Z 18010KT 6+ SCT030 20/10 A2992");

        Visibility.Distance visibility = (Visibility.Distance) metar.visibility().orElseThrow();
        assertEquals(6.0, visibility.value(), 1e-9);
        assertEquals(Visibility.DistanceUnit.STATUTE_MILES, visibility.unit());
        assertEquals(Visibility.Bound.OR_MORE, visibility.bound());
        assertEquals("6", visibility.figure());
        assertTrue(metar.defects().isEmpty());
    }
}
