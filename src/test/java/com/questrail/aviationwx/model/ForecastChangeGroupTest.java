package com.questrail.aviationwx.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class ForecastChangeGroupTest
{
    private final ValidityPeriod period = new ValidityPeriod(DayTime.of(20, 18), DayTime.of(20, 20));

    @Test
    void probableTemporaryRequiresThirtyOrForty()
    {
        ForecastChangeGroup group = new ForecastChangeGroup(ChangeKind.PROBABLE_TEMPORARY, OptionalInt.of(30),
                Optional.of(period), ForecastConditions.EMPTY);

        assertEquals("PROB30 TEMPORARY", group.label());
        assertThrows(IllegalArgumentException.class, () -> new ForecastChangeGroup(
                ChangeKind.PROBABLE_TEMPORARY, OptionalInt.of(20), Optional.of(period), ForecastConditions.EMPTY));
        assertThrows(IllegalArgumentException.class, () -> new ForecastChangeGroup(
                ChangeKind.PROBABLE_TEMPORARY, OptionalInt.empty(), Optional.of(period), ForecastConditions.EMPTY));
    }

    @Test
    void onlyProbableTemporaryCarriesProbability()
    {
        assertThrows(IllegalArgumentException.class, () -> new ForecastChangeGroup(
                ChangeKind.TEMPORARY, OptionalInt.of(30), Optional.of(period), ForecastConditions.EMPTY));
    }

    @Test
    void fromGroupsCarryAStartInstantOnly()
    {
        StartInstant start = new StartInstant(DayTime.of(20, 18));

        assertEquals("FROM", new ForecastChangeGroup(ChangeKind.FROM, OptionalInt.empty(),
                Optional.of(start), ForecastConditions.EMPTY).label());
        assertThrows(IllegalArgumentException.class, () -> new ForecastChangeGroup(
                ChangeKind.FROM, OptionalInt.empty(), Optional.of(period), ForecastConditions.EMPTY));
        assertThrows(IllegalArgumentException.class, () -> new ForecastChangeGroup(
                ChangeKind.BECOMING, OptionalInt.empty(), Optional.of(start), ForecastConditions.EMPTY));
    }
}
