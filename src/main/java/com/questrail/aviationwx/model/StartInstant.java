package com.questrail.aviationwx.model;

import java.util.Objects;

/**
 * Start-only window of a {@code FM} change group.
 */
public record StartInstant(DayTime start) implements ChangeWindow
{
    public StartInstant {
        Objects.requireNonNull(start, "start");
    }
}
