package com.questrail.aviationwx.internal.time;

import com.questrail.aviationwx.codec.MalformedTimeException;
import com.questrail.aviationwx.model.DayTime;
import com.questrail.aviationwx.model.StartInstant;
import com.questrail.aviationwx.model.ValidityPeriod;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReportTimesTest
 * -----------------------------------------------------------------------------
 * Day/hour parsing, ordinal labels and period rendering.
 */
final class ReportTimesTest
{
    @Test
    void ordinalLabelsFollowEnglishSuffixRule()
    {
        int[] days = {1, 2, 3, 4, 11, 12, 13, 21, 22, 23, 31};
        String[] expected = {"1st", "2nd", "3rd", "4th", "11th", "12th", "13th", "21st", "22nd", "23rd", "31st"};

        for (int i = 0; i < days.length; i++) {
            assertEquals(expected[i], ReportTimes.ordinalLabel(days[i]));
        }
        assertEquals("20th", ReportTimes.ordinalLabel(20));
        assertEquals("32nd", ReportTimes.ordinalLabel(32));
        assertThrows(IllegalArgumentException.class, () -> ReportTimes.ordinalLabel(0));
    }

    @Test
    void parseIssueTimeAcceptsExactlySixDigits()
    {
        assertEquals(new DayTime(20, 16, 50), ReportTimes.parseIssueTime("201650"));
        assertEquals(new DayTime(20, 17, 1), ReportTimes.parseIssueTime("201701"));
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseIssueTime("201650Z"));
    }

    @Test
    void parseIssueTimeRejectsWrongDigitCountOrRange()
    {
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseIssueTime("20165"));
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseIssueTime("2016500"));
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseIssueTime("321650"));
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseIssueTime("002000"));
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseIssueTime("202400"));
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseIssueTime("201660"));
    }

    @Test
    void hour24NormalisesToMidnightOfNextDay()
    {
        assertEquals(DayTime.of(21, 0), ReportTimes.parseDayHour("2024"));
        assertEquals(DayTime.of(32, 0), ReportTimes.parseDayHour("3124"));
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseDayHour("2025"));
    }

    @Test
    void parseValidityToken()
    {
        ValidityPeriod period = ReportTimes.parseValidityToken("2018/2102");

        assertEquals(DayTime.of(20, 18), period.from());
        assertEquals(DayTime.of(21, 2), period.to());
        assertTrue(period.crossesDayBoundary());
    }

    @Test
    void parseValidityTokenWrapsMonthEndOnlyForComparison()
    {
        ValidityPeriod period = ReportTimes.parseValidityToken("3118/0106");

        assertEquals(31, period.from().day());
        assertEquals(1, period.to().day());
    }

    @Test
    void parseValidityTokenRejectsBackwardsOrMalformedPeriods()
    {
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseValidityToken("2018/2017"));
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseValidityToken("2018/2018"));
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseValidityToken("201/2102"));
        assertThrows(MalformedTimeException.class, () -> ReportTimes.parseValidityToken("2018-2102"));
    }

    @Test
    void formatPeriodSameDayOmitsDay()
    {
        assertEquals("18:00Z to 20:00Z",
                ReportTimes.formatPeriod(DayTime.of(20, 18), DayTime.of(20, 20)));
    }

    @Test
    void formatPeriodCrossDayShowsOrdinals()
    {
        assertEquals("20:00Z on 20th to 02:00Z on 21st",
                ReportTimes.formatPeriod(DayTime.of(20, 20), DayTime.of(21, 2)));
    }

    @Test
    void formatWindowOfStartInstant()
    {
        assertEquals("18:00Z on 20th", ReportTimes.formatWindow(new StartInstant(DayTime.of(20, 18))));
        assertEquals("16:50Z", ReportTimes.formatTime(new DayTime(20, 16, 50)));
    }
}
