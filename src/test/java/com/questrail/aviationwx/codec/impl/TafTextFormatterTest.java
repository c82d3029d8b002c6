package com.questrail.aviationwx.codec.impl;

import com.questrail.aviationwx.model.TafRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TafTextFormatter}.
 */
final class TafTextFormatterTest
{
    private final DefaultTafDecoder decoder = new DefaultTafDecoder();
    private final TafTextFormatter formatter = new TafTextFormatter();

    @Test
    void rendersReferenceForecast()
    {
        TafRecord taf = decoder.decode(
                "TAF EGMC 201701Z 2018/2102 32012KT 9999 BKN018 PROB30 TEMPO 2018/2020 BKN014 TEMPO 2020/2102 BKN012");

        assertEquals(List.of(
                "Station: EGMC",
                "Issue Date: 20th",
                "Issue Time: 17:01Z",
                "Valid From: 18:00Z on 20th",
                "Valid To: 02:00Z on 21st",
                "BASE FORECAST",
                "  Wind: 320° at 12 KT",
                "  Visibility: 10 km or more",
                "  Cloud Layer: Broken at 1800 feet",
                "FORECAST CHANGES",
                "1. PROB30 TEMPORARY 30% 18:00Z to 20:00Z:",
                "  Cloud Layer: Broken at 1400 feet",
                "2. TEMPORARY 20:00Z on 20th to 02:00Z on 21st:",
                "  Cloud Layer: Broken at 1200 feet"
        ), formatter.formatLines(taf));
    }

    @Test
    void neverLeaksRawPeriodDigitsOrPlaceholders()
    {
        TafRecord taf = decoder.decode(
                "TAF EGMC 201701Z 2018/2102 32012KT 9999 BKN018 BECMG 2100/2102 4000 RA");

        String text = formatter.format(taf, "\n");
        assertFalse(text.contains("N/A"));
        assertFalse(text.contains("2018"));
        assertFalse(text.contains("2100/2102"));
        assertTrue(text.contains("1. BECOMING 00:00Z to 02:00Z:"));
        assertTrue(text.contains("  Weather: Rain"));
    }

    @Test
    void fromGroupAndMissingPeriod()
    {
        TafRecord from = decoder.decode(
                "TAF KJFK 201130Z 2012/2118 18010KT P6SM SCT030 FM201800 22015G25KT 3SM -RA OVC015");
        List<String> lines = formatter.formatLines(from);
        assertTrue(lines.contains("  Visibility: more than 6 statute miles"));
        assertTrue(lines.contains("1. FROM 18:00Z on 20th:"));
        assertTrue(lines.contains("  Wind: 220° at 15 KT gusting to 25 KT"));
        assertTrue(lines.contains("  Visibility: 3 statute miles"));
        assertTrue(lines.contains("  Weather: Light Rain"));
        assertTrue(lines.contains("  Cloud Layer: Overcast at 1500 feet"));

        TafRecord missing = decoder.decode("TAF EGLL 201100Z 2012/2118 24010KT 9999 SCT030 BECMG BKN020");
        lines = formatter.formatLines(missing);
        assertTrue(lines.contains("1. BECOMING period not specified:"));
        assertTrue(lines.get(lines.size() - 1).startsWith("Raw: TAF EGLL"));
    }

    @Test
    void baseWindRendersNotReportedButChangeGroupsOmitAbsentFields()
    {
        TafRecord taf = decoder.decode("TAF EGLL 201100Z 2012/2118 9999 SCT030 TEMPO 2014/2016 4000 SHRA");

        List<String> lines = formatter.formatLines(taf);
        assertTrue(lines.contains("  Wind: not reported"));
        int header = lines.indexOf("1. TEMPORARY 14:00Z to 16:00Z:");
        assertEquals("  Visibility: 4000 meters", lines.get(header + 1));
        assertEquals("  Weather: Showers Rain", lines.get(header + 2));
        assertEquals(header + 3, lines.size());
    }

    @Test
    void temperatureForecastWindShearAndStatus()
    {
        TafRecord taf = decoder.decode(
                "TAF AMD EGLL 201100Z 2012/2118 24010KT 9999 NSC WS020/05065KT TX15/2014Z TNM02/2106Z RMK NXT FCST");

        List<String> lines = formatter.formatLines(taf);
        assertEquals("Report Status: AMENDED", lines.get(1));
        assertTrue(lines.contains("  Clouds: No significant cloud"));
        assertTrue(lines.contains("  Wind Shear: at 2000 feet, 050° at 65 KT"));
        assertTrue(lines.contains("TEMPERATURE FORECAST"));
        assertTrue(lines.contains("  Maximum: 15°C at 14:00Z on 20th"));
        assertTrue(lines.contains("  Minimum: -2°C at 06:00Z on 21st"));
        assertFalse(lines.contains("FORECAST CHANGES"));
        assertEquals("Remarks: NXT FCST", lines.get(lines.size() - 1));
    }

    @Test
    void formattingIsIdempotent()
    {
        TafRecord taf = decoder.decode(
                "TAF EGMC 201701Z 2018/2102 32012KT 9999 BKN018 PROB30 TEMPO 2018/2020 BKN014 TEMPO 2020/2102 BKN012");

        assertEquals(formatter.format(taf, "\n"), formatter.format(taf, "\n"));
    }

    @Test
    void nilForecastRendersStatusInPlaceOfValidity()
    {
        TafRecord taf = decoder.decode("TAF EGLL 201100Z NIL");

        assertEquals(List.of(
                "Station: EGLL",
                "Report Status: NIL (report missing or forecast suspended)",
                "Issue Date: 20th",
                "Issue Time: 11:00Z"
        ), formatter.formatLines(taf));
    }

    @Test
    void rendersPressureForecastAndAmendmentsNotScheduled()
    {
        TafRecord taf = decoder.decode(
                "TAF AMD KXYZ 201100Z 2012/2112 18010KT P6SM SCT030 QNH2992INS AMD NOT SKED");

        assertEquals(List.of(
                "Station: KXYZ",
                "Report Status: AMENDED, AMD NOT SKED (updates not scheduled)",
                "Issue Date: 20th",
                "Issue Time: 11:00Z",
                "Valid From: 12:00Z on 20th",
                "Valid To: 12:00Z on 21st",
                "BASE FORECAST",
                "  Wind: 180° at 10 KT",
                "  Visibility: more than 6 statute miles",
                "  Cloud Layer: Scattered at 3000 feet",
                "PRESSURE FORECAST",
                "  1. QNH: 29.92 inHg"
        ), formatter.formatLines(taf));
    }
}
