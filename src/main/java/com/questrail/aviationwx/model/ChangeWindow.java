package com.questrail.aviationwx.model;

/**
 * The time window a forecast change group applies to.
 *
 * <ul>
 *   <li>{@link ValidityPeriod}: a {@code DDHH/DDHH} range (BECMG, TEMPO, PROB TEMPO)</li>
 *   <li>{@link StartInstant}: a single {@code FMDDHHMM} start with no separate end</li>
 * </ul>
 */
public sealed interface ChangeWindow permits ValidityPeriod, StartInstant
{
    /**
     * Returns the instant the window opens.
     */
    DayTime start();
}
